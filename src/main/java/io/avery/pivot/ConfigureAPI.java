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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * A configurator used to define the row fields, column fields, and measures of a {@link PivotGrid pivot}.
 *
 * <p>Row and column fields nest in order of definition: the first row field groups the outermost rows, the next one
 * groups within those, and so on. Measures produce value columns in order of definition. A field or measure that is
 * defined again keeps its original position.
 *
 * <pre>{@code
 *     grid.configure(config -> config
 *         .row(region)
 *         .row(city)
 *         .column(year)
 *         .measure(new Measure<>("Amount", Order::getAmount, Aggregate.SUM))
 *     );
 * }</pre>
 *
 * @param <T> the item type
 * @see PivotGrid#configure(java.util.function.Consumer)
 */
public class ConfigureAPI<T> {
    private final Map<Object, Integer> indexByRow = new HashMap<>();
    private final Map<Object, Integer> indexByColumn = new HashMap<>();
    private final Map<Object, Integer> indexByMeasure = new HashMap<>();
    private final List<Field<T>> rows = new ArrayList<>();
    private final List<Field<T>> columns = new ArrayList<>();
    private final List<Measure<T>> measures = new ArrayList<>();

    ConfigureAPI() {
    }

    /**
     * Defines the given field as the next row field.
     *
     * @param field the field
     * @return this configurator
     */
    public ConfigureAPI<T> row(Field<T> field) {
        return define(indexByRow, rows, Objects.requireNonNull(field));
    }

    /**
     * Defines a new row field with the given title, that groups items by the given function.
     *
     * @param title the field title
     * @param selector a function that selects the group key from an item
     * @return this configurator
     */
    public ConfigureAPI<T> row(String title, Function<? super T, ?> selector) {
        return row(new Field<>(title, selector));
    }

    /**
     * Defines each of the given fields as row fields, in order.
     *
     * @param fields the fields
     * @return this configurator
     */
    @SafeVarargs
    public final ConfigureAPI<T> rows(Field<T>... fields) {
        for (Field<T> field : fields)
            row(field);
        return this;
    }

    /**
     * Defines the given field as the next column field.
     *
     * @param field the field
     * @return this configurator
     */
    public ConfigureAPI<T> column(Field<T> field) {
        return define(indexByColumn, columns, Objects.requireNonNull(field));
    }

    /**
     * Defines a new column field with the given title, that groups items by the given function.
     *
     * @param title the field title
     * @param selector a function that selects the group key from an item
     * @return this configurator
     */
    public ConfigureAPI<T> column(String title, Function<? super T, ?> selector) {
        return column(new Field<>(title, selector));
    }

    /**
     * Defines each of the given fields as column fields, in order.
     *
     * @param fields the fields
     * @return this configurator
     */
    @SafeVarargs
    public final ConfigureAPI<T> columns(Field<T>... fields) {
        for (Field<T> field : fields)
            column(field);
        return this;
    }

    /**
     * Defines the given measure as the next measure.
     *
     * @param measure the measure
     * @return this configurator
     */
    public ConfigureAPI<T> measure(Measure<T> measure) {
        return define(indexByMeasure, measures, Objects.requireNonNull(measure));
    }

    /**
     * Defines a new measure with the given title, that applies the given aggregate to the values selected by the given
     * function.
     *
     * @param title the measure title
     * @param selector a function that selects the measured value from an item
     * @param aggregate the aggregate function
     * @return this configurator
     */
    public ConfigureAPI<T> measure(String title, Function<? super T, ?> selector, Aggregate aggregate) {
        return measure(new Measure<>(title, selector, aggregate));
    }

    private <D> ConfigureAPI<T> define(Map<Object, Integer> indexByDefinition, List<D> definitions, D definition) {
        int index = indexByDefinition.computeIfAbsent(definition, k -> definitions.size());
        if (index == definitions.size())
            definitions.add(definition);
        else
            definitions.set(index, definition);
        return this;
    }

    List<Field<T>> rows() {
        return rows;
    }

    List<Field<T>> columns() {
        return columns;
    }

    List<Measure<T>> measures() {
        return measures;
    }
}
