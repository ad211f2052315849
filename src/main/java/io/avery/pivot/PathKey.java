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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * The identity of a root-to-node path in an axis tree: the group keys along the path, in order from the root. Drill-down
 * state is keyed by path, so a path keeps its state across recomputations for as long as its groups exist.
 *
 * <p>Paths compare element-wise by the group keys' own {@code equals()}. Keys that merely print the same, like
 * {@code 10} and {@code "10"}, make different paths.
 */
public final class PathKey {
    /**
     * The empty path, identifying the root of an axis tree.
     */
    public static final PathKey ROOT = new PathKey(new Object[0]);

    private final Object[] values;

    private PathKey(Object[] values) {
        this.values = values;
    }

    /**
     * Returns a path of the given group keys, in order from the root.
     *
     * @param values the group keys
     * @return a path of the given group keys
     */
    public static PathKey of(Object... values) {
        return values.length == 0 ? ROOT : new PathKey(values.clone());
    }

    /**
     * Returns a path of the given group keys, in order from the root.
     *
     * @param values the group keys
     * @return a path of the given group keys
     */
    public static PathKey of(List<?> values) {
        return values.isEmpty() ? ROOT : new PathKey(values.toArray());
    }

    /**
     * Returns the path that extends this path by the given group key.
     *
     * @param value the group key of the child
     * @return the child path
     */
    public PathKey child(Object value) {
        Object[] arr = Arrays.copyOf(values, values.length + 1);
        arr[values.length] = value;
        return new PathKey(arr);
    }

    /**
     * Returns an unmodifiable view of the group keys along this path.
     *
     * @return the group keys along this path
     */
    public List<Object> values() {
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    /**
     * Returns the number of group keys on this path. The root has depth 0.
     *
     * @return the depth of this path
     */
    public int depth() {
        return values.length;
    }

    /**
     * Returns the group key of the node this path identifies.
     *
     * @return the last group key on this path
     * @throws NoSuchElementException if this is the root path
     */
    public Object last() {
        if (values.length == 0)
            throw new NoSuchElementException("Root path has no group key");
        return values[values.length - 1];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PathKey))
            return false;
        return Arrays.equals(values, ((PathKey) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    /**
     * Returns the group keys along this path joined by {@code "|"}, with {@code null} keys rendered as the empty string.
     * Distinct paths may share a string representation.
     *
     * @return a string representation of this path
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        String delimiter = "";
        for (Object value : values) {
            sb.append(delimiter).append(Utils.title(value));
            delimiter = "|";
        }
        return sb.toString();
    }
}
