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

/**
 * Assembles body rows from a row tree and the column leaves.
 */
class BodyRows {
    private BodyRows() {} // Prevent instantiation

    /**
     * Emits one row per fully expanded row leaf and per collapsed row group, in depth-first order. A collapsed group's
     * values are computed over every item in its subtree. Row header cells are padded to the deepest row.
     */
    static <T> List<BodyRow> build(AxisNode<T> rowRoot,
                                   int rowDepth,
                                   List<List<Object>> columnLeaves,
                                   List<Field<T>> columnFields,
                                   List<Measure<T>> measures) {
        List<AxisNode<T>> nodes = new ArrayList<>();
        List<List<HeaderCell>> headers = new ArrayList<>();
        for (AxisNode<T> child : rowRoot.children())
            collect(child, new ArrayList<>(), rowDepth, nodes, headers);
        HeaderFlattener.pad(headers);

        List<BodyRow> rows = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            AxisNode<T> node = nodes.get(i);
            List<Object> values = new ArrayList<>(columnLeaves.size() * measures.size());
            for (List<Object> columnPath : columnLeaves)
                for (Measure<T> measure : measures)
                    values.add(Aggregates.evaluate(node.items(), columnFields, columnPath, measure));
            rows.add(new BodyRow(node.pathKey(), headers.get(i), values, columnLeaves, measures.size()));
        }
        return rows;
    }

    private static <T> void collect(AxisNode<T> node,
                                    List<HeaderCell> prefix,
                                    int rowDepth,
                                    List<AxisNode<T>> nodes,
                                    List<List<HeaderCell>> headers) {
        List<HeaderCell> cells = new ArrayList<>(prefix);
        cells.add(HeaderFlattener.rowHeaderCell(node));
        if (!node.isCollapsed() && node.level() < rowDepth) {
            for (AxisNode<T> child : node.children())
                collect(child, cells, rowDepth, nodes, headers);
            return;
        }
        nodes.add(node);
        headers.add(cells);
    }
}
