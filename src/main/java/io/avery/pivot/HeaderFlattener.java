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
 * Flattens axis trees into header cells with spans.
 */
public class HeaderFlattener {
    private HeaderFlattener() {} // Prevent instantiation

    /**
     * Flattens a column tree into header rows, one per level. A node at level {@code n} lands in row {@code n - 1}, in
     * depth-first order. An interior node spans one row and as many columns as it has leaves. A leaf spans one column
     * and every remaining row down to the last level, so each row's column spans add up to the root's leaf count.
     *
     * @param root the root of the tree
     * @param depth the number of fields on the axis
     * @return the header rows, {@code depth} of them
     */
    public static List<List<HeaderCell>> flatten(AxisNode<?> root, int depth) {
        List<List<HeaderCell>> rows = new ArrayList<>(depth);
        for (int i = 0; i < depth; i++)
            rows.add(new ArrayList<>());
        for (AxisNode<?> child : root.children())
            flatten(child, rows, depth);
        return rows;
    }

    private static void flatten(AxisNode<?> node, List<List<HeaderCell>> rows, int depth) {
        int level = node.level() - 1;
        HeaderCell cell = node.isLeaf()
            ? new HeaderCell(node.value(), node.title(), level, node.width(), depth - level, 1, node.isCollapsed(),
                             node.pathKey())
            : new HeaderCell(node.value(), node.title(), level, node.width(), 1, node.leafCount(), node.isCollapsed(),
                             node.pathKey());
        rows.get(level).add(cell);
        for (AxisNode<?> child : node.children())
            flatten(child, rows, depth);
    }

    /**
     * Returns the row header cell for a node: it spans one column and as many rows as the node has leaves.
     *
     * @param node a non-root node
     * @return the row header cell
     */
    static HeaderCell rowHeaderCell(AxisNode<?> node) {
        return new HeaderCell(node.value(), node.title(), node.level() - 1, node.width(), node.leafCount(), 1,
                              node.isCollapsed(), node.pathKey());
    }

    /**
     * Pads each row's header cells with filler cells, up to the longest row.
     *
     * @param rows the row header cell lists to pad in place
     */
    static void pad(List<List<HeaderCell>> rows) {
        int maxDepth = 0;
        for (List<HeaderCell> row : rows)
            maxDepth = Math.max(maxDepth, row.size());
        for (List<HeaderCell> row : rows)
            while (row.size() < maxDepth)
                row.add(HeaderCell.filler(row.size()));
    }
}
