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
 * A grouping field on one {@link Axis axis} of a pivot. A field selects a group key from each item, and the distinct
 * keys partition the items at the field's level of the axis tree. Fields are ordered within an axis: the first field
 * groups at level 1, the second at level 2, and so on.
 *
 * <p>Fields use default object {@code equals()} and {@code hashCode()}. That is, two fields are only equal if they are
 * the same object.
 *
 * @param <T> the item type
 */
public final class Field<T> {
    private final String title;
    private final Function<? super T, ?> selector;
    private final String width;

    /**
     * Creates a new field with the given title and selector, and no width hint.
     *
     * @param title the field title, used by the field's string representation
     * @param selector a function that selects the group key from an item
     */
    public Field(String title, Function<? super T, ?> selector) {
        this(title, selector, null);
    }

    /**
     * Creates a new field with the given title, selector, and width hint.
     *
     * @param title the field title, used by the field's string representation
     * @param selector a function that selects the group key from an item
     * @param width a layout hint for header cells of this field, or {@code null}
     */
    public Field(String title, Function<? super T, ?> selector, String width) {
        this.title = Objects.requireNonNull(title);
        this.selector = Objects.requireNonNull(selector);
        this.width = width;
    }

    /**
     * Returns the group key selected by this field from the given item.
     *
     * @param item the item
     * @return the group key of the item
     */
    public Object get(T item) {
        return selector.apply(item);
    }

    /**
     * Returns the field title.
     *
     * @return the field title
     */
    public String title() {
        return title;
    }

    /**
     * Returns the width hint, or {@code null} if this field has none.
     *
     * @return the width hint
     */
    public String width() {
        return width;
    }

    /**
     * Returns the field title
     *
     * @return the field title
     */
    @Override
    public String toString() {
        return title;
    }
}
