/*
 * MIT License
 *
 * Copyright (c) 2022 Daniel Avery
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.avery.pivot;

import java.util.Objects;
import java.util.function.Function;

/**
 * A value column of a pivot: an {@link Aggregate aggregate function} applied to the values a selector takes from the
 * items at each intersection. Every column leaf of the pivot gets one value per measure, in measure order.
 *
 * <p>Whether the values are numeric decides how some aggregates behave. A measure may declare the type of its values;
 * otherwise the type is inferred from the values at evaluation time.
 *
 * <p>Measures use default object {@code equals()} and {@code hashCode()}. That is, two measures are only equal if they
 * are the same object.
 *
 * @param <T> the item type
 */
public final class Measure<T> {
    private final String title;
    private final Function<? super T, ?> selector;
    private final Aggregate aggregate;
    private final Class<?> valueType;
    private final Function<Object, String> formatter;

    /**
     * Creates a new measure that sums the values taken by the given selector.
     *
     * @param title the measure title
     * @param selector a function that selects the measured value from an item
     */
    public Measure(String title, Function<? super T, ?> selector) {
        this(title, selector, Aggregate.SUM);
    }

    /**
     * Creates a new measure that applies the given aggregate to the values taken by the given selector. A
     * {@code null} aggregate defaults to {@link Aggregate#SUM}.
     *
     * @param title the measure title
     * @param selector a function that selects the measured value from an item
     * @param aggregate the aggregate function
     */
    public Measure(String title, Function<? super T, ?> selector, Aggregate aggregate) {
        this(title, selector, aggregate, null, String::valueOf);
    }

    private Measure(String title, Function<? super T, ?> selector, Aggregate aggregate, Class<?> valueType,
                    Function<Object, String> formatter) {
        this.title = Objects.requireNonNull(title);
        this.selector = Objects.requireNonNull(selector);
        this.aggregate = aggregate != null ? aggregate : Aggregate.SUM;
        this.valueType = valueType;
        this.formatter = Objects.requireNonNull(formatter);
    }

    /**
     * Returns a copy of this measure that declares the given value type. A numeric type (a {@code Number} subtype or a
     * numeric primitive) makes the measure numeric regardless of the values seen.
     *
     * @param valueType the declared value type
     * @return a new measure
     */
    public Measure<T> withValueType(Class<?> valueType) {
        return new Measure<>(title, selector, aggregate, Objects.requireNonNull(valueType), formatter);
    }

    /**
     * Returns a copy of this measure that formats values with the given function.
     *
     * @param formatter a function that renders a non-null value
     * @return a new measure
     */
    public Measure<T> withFormatter(Function<Object, String> formatter) {
        return new Measure<>(title, selector, aggregate, valueType, formatter);
    }

    /**
     * Returns the value selected by this measure from the given item.
     *
     * @param item the item
     * @return the measured value of the item
     */
    public Object get(T item) {
        return selector.apply(item);
    }

    public String title() {
        return title;
    }

    public Aggregate aggregate() {
        return aggregate;
    }

    /**
     * Returns the declared value type, or {@code null} if the type is inferred from the values.
     *
     * @return the declared value type
     */
    public Class<?> valueType() {
        return valueType;
    }

    /**
     * Renders a computed value for display. A {@code null} value renders as the empty string.
     *
     * @param value the computed value
     * @return the rendered value
     */
    public String formatValue(Object value) {
        return value == null ? "" : formatter.apply(value);
    }

    /**
     * Returns a string representation of this measure, consisting of the aggregate followed by the title in
     * parentheses, eg {@code "SUM(Amount)"}.
     *
     * @return a string representation of this measure
     */
    @Override
    public String toString() {
        return aggregate + "(" + title + ")";
    }
}
