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

/**
 * The aggregate functions a {@link Measure measure} can apply to the items at one intersection of a pivot.
 *
 * <p>Functions that need numbers fall back to a non-numeric behavior when the measure's values are not numeric. See
 * {@link Aggregates#evaluate} for the full policy.
 */
public enum Aggregate {
    /** Sum of the values, or the item count if the values are not numeric. */
    SUM,
    /** Arithmetic mean of the values, or the item count if the values are not numeric. */
    AVERAGE,
    /** Number of items. */
    COUNT,
    /** Smallest value, or the first item if the values are not numeric. */
    MIN,
    /** Largest value, or the last item if the values are not numeric. */
    MAX,
    /** Value selected from the first item. */
    FIRST,
    /** Value selected from the last item. */
    LAST
}
