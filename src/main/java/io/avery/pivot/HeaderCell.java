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

/**
 * A render-ready header cell for one axis-tree node, carrying the spans the node covers in a tabular layout. Filler
 * cells, used to square off row headers of uneven depth, have a {@code null} value and path.
 */
public final class HeaderCell {
    private final Object value;
    private final String title;
    private final int level;
    private final String width;
    private final int rowSpan;
    private final int colSpan;
    private final boolean isCollapsed;
    private final PathKey pathKey;

    HeaderCell(Object value, String title, int level, String width, int rowSpan, int colSpan, boolean isCollapsed,
               PathKey pathKey) {
        this.value = value;
        this.title = title;
        this.level = level;
        this.width = width;
        this.rowSpan = rowSpan;
        this.colSpan = colSpan;
        this.isCollapsed = isCollapsed;
        this.pathKey = pathKey;
    }

    static HeaderCell filler(int level) {
        return new HeaderCell(null, "", level, null, 1, 1, false, null);
    }

    public Object value() {
        return value;
    }

    public String title() {
        return title;
    }

    /**
     * Returns the zero-based header level of this cell, ie its node's level minus one.
     *
     * @return the header level
     */
    public int level() {
        return level;
    }

    public String width() {
        return width;
    }

    public int rowSpan() {
        return rowSpan;
    }

    public int colSpan() {
        return colSpan;
    }

    public boolean isCollapsed() {
        return isCollapsed;
    }

    /**
     * Returns the path of this cell's node, or {@code null} for a filler cell.
     *
     * @return the node path
     */
    public PathKey pathKey() {
        return pathKey;
    }

    /**
     * Returns {@code true} if this cell only pads a row header.
     *
     * @return {@code true} if this is a filler cell
     */
    public boolean isFiller() {
        return pathKey == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof HeaderCell))
            return false;
        HeaderCell other = (HeaderCell) o;
        return level == other.level
            && rowSpan == other.rowSpan
            && colSpan == other.colSpan
            && isCollapsed == other.isCollapsed
            && Objects.equals(value, other.value)
            && Objects.equals(title, other.title)
            && Objects.equals(width, other.width)
            && Objects.equals(pathKey, other.pathKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, title, level, width, rowSpan, colSpan, isCollapsed, pathKey);
    }

    @Override
    public String toString() {
        return "HeaderCell{title=" + title + ", level=" + level + ", rowSpan=" + rowSpan + ", colSpan=" + colSpan
            + (isCollapsed ? ", collapsed" : "") + '}';
    }
}
