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
import java.util.List;
import java.util.Objects;

/**
 * Common utils
 */
class Utils {
    /**
     * Display form of a group key. Null renders as the empty string.
     */
    static String title(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    /**
     * Items whose selected keys equal the path values, field by field. Fields beyond the path, and path values beyond
     * the fields, are not consulted. Keys are selected as for grouping, so items whose selector fails match a
     * {@code null} path value.
     */
    static <T> List<T> filter(List<T> items, List<Field<T>> fields, List<?> path) {
        int n = Math.min(fields.size(), path.size());
        if (n == 0)
            return items;
        List<T> result = new ArrayList<>();
        for (T item : items) {
            boolean match = true;
            for (int i = 0; i < n && match; i++)
                match = Objects.equals(AxisTrees.keyOf(fields.get(i), item), path.get(i));
            if (match)
                result.add(item);
        }
        return result;
    }
}
