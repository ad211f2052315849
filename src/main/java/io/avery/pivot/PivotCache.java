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

import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * Holds the derived views of a pivot for one generation. The views are computed together on first access after an
 * invalidation, and are kept until the next invalidation.
 *
 * @param <T> the item type
 */
class PivotCache<T> {
    private long generation = 0;
    private Snapshot<T> snapshot = null;

    /**
     * The views of one generation, computed from a single row tree and a single column tree.
     */
    static final class Snapshot<T> {
        final AxisNode<T> rowTree;
        final AxisNode<T> columnTree;
        final List<List<HeaderCell>> columnHeaderRows;
        final List<BodyRow> bodyRows;
        final List<List<Object>> columnLeaves;

        Snapshot(AxisNode<T> rowTree, AxisNode<T> columnTree, List<List<HeaderCell>> columnHeaderRows,
                 List<BodyRow> bodyRows, List<List<Object>> columnLeaves) {
            this.rowTree = rowTree;
            this.columnTree = columnTree;
            for (int i = 0; i < columnHeaderRows.size(); i++)
                columnHeaderRows.set(i, Collections.unmodifiableList(columnHeaderRows.get(i)));
            this.columnHeaderRows = Collections.unmodifiableList(columnHeaderRows);
            this.bodyRows = Collections.unmodifiableList(bodyRows);
            this.columnLeaves = Collections.unmodifiableList(columnLeaves);
        }
    }

    /**
     * Returns the snapshot of the current generation, computing it with the given function if there is none.
     */
    Snapshot<T> get(Supplier<Snapshot<T>> compute) {
        if (snapshot == null)
            snapshot = compute.get();
        return snapshot;
    }

    /**
     * Drops the snapshot and starts a new generation.
     */
    long invalidate() {
        snapshot = null;
        return ++generation;
    }

    long generation() {
        return generation;
    }

    boolean isPopulated() {
        return snapshot != null;
    }
}
