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

/**
 * One body row of a pivot: a fully expanded row group, or a collapsed row group standing in for its whole subtree.
 *
 * <p>The row header cells run from the outermost group down to this row's group, padded with filler cells to the depth
 * of the deepest row. The value cells hold one value per measure for each column leaf, column-leaf major: the value
 * for column leaf {@code c} and measure {@code m} is at index {@code c * measureCount + m}.
 */
public final class BodyRow {
    private final PathKey rowPath;
    private final List<HeaderCell> rowHeaderCells;
    private final List<Object> valueCells;
    private final List<List<Object>> visibleColumnLeaves;
    private final int measureCount;

    BodyRow(PathKey rowPath, List<HeaderCell> rowHeaderCells, List<Object> valueCells,
            List<List<Object>> visibleColumnLeaves, int measureCount) {
        this.rowPath = rowPath;
        this.rowHeaderCells = Collections.unmodifiableList(rowHeaderCells);
        this.valueCells = Collections.unmodifiableList(valueCells);
        this.visibleColumnLeaves = Collections.unmodifiableList(visibleColumnLeaves);
        this.measureCount = measureCount;
    }

    /**
     * Returns the path of this row's group.
     *
     * @return the row path
     */
    public PathKey rowPath() {
        return rowPath;
    }

    public List<HeaderCell> rowHeaderCells() {
        return rowHeaderCells;
    }

    public List<Object> valueCells() {
        return valueCells;
    }

    /**
     * Returns the column leaf paths this row has values for, in value-cell order.
     *
     * @return the column leaf paths
     */
    public List<List<Object>> visibleColumnLeaves() {
        return visibleColumnLeaves;
    }

    /**
     * Returns the value for the given column leaf and measure.
     *
     * @param columnLeafIndex the index of the column leaf
     * @param measureIndex the index of the measure
     * @return the value, or {@code null} if the intersection has no items
     * @throws IndexOutOfBoundsException if either index is out of range
     */
    public Object valueAt(int columnLeafIndex, int measureIndex) {
        if (columnLeafIndex < 0 || columnLeafIndex >= visibleColumnLeaves.size())
            throw new IndexOutOfBoundsException("Column leaf index " + columnLeafIndex + " out of range "
                                                    + visibleColumnLeaves.size());
        if (measureIndex < 0 || measureIndex >= measureCount)
            throw new IndexOutOfBoundsException("Measure index " + measureIndex + " out of range " + measureCount);
        return valueCells.get(columnLeafIndex * measureCount + measureIndex);
    }

    @Override
    public String toString() {
        return "BodyRow{" + rowPath + " -> " + valueCells + '}';
    }
}
