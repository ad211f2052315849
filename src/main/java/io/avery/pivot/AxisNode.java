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
 * A node of an axis tree. The root (level 0) stands for all items; each node below it stands for one group key at its
 * level, within the group of its parent.
 *
 * <p>A node with no children is a leaf: either a fully expanded group, or a collapsed group standing in for its whole
 * subtree. Leaves carry the exact items of their group. Nodes are immutable once built, and are discarded when the
 * pivot is recomputed.
 *
 * @param <T> the item type
 */
public final class AxisNode<T> {
    private final Object value;
    private final String title;
    private final int level;
    private final String width;
    private final List<AxisNode<T>> children;
    private final boolean isCollapsed;
    private final PathKey pathKey;
    private final List<T> items;
    private final int leafCount;

    AxisNode(Object value, String title, int level, String width, List<AxisNode<T>> children, boolean isCollapsed,
             PathKey pathKey, List<T> items) {
        this.value = value;
        this.title = title;
        this.level = level;
        this.width = width;
        this.children = Collections.unmodifiableList(children);
        this.isCollapsed = isCollapsed;
        this.pathKey = pathKey;
        this.items = Collections.unmodifiableList(items);
        int count = 0;
        for (AxisNode<T> child : children)
            count += child.leafCount;
        this.leafCount = children.isEmpty() ? 1 : count;
    }

    static <T> AxisNode<T> root(List<AxisNode<T>> children, List<T> items) {
        return new AxisNode<>(null, null, 0, null, children, false, PathKey.ROOT, items);
    }

    /**
     * Returns the group key of this node, or {@code null} for the root.
     *
     * @return the group key
     */
    public Object value() {
        return value;
    }

    /**
     * Returns the display form of the group key, or {@code null} for the root.
     *
     * @return the title
     */
    public String title() {
        return title;
    }

    /**
     * Returns the depth of this node. The root is at level 0.
     *
     * @return the level
     */
    public int level() {
        return level;
    }

    public String width() {
        return width;
    }

    public List<AxisNode<T>> children() {
        return children;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean isCollapsed() {
        return isCollapsed;
    }

    public PathKey pathKey() {
        return pathKey;
    }

    /**
     * Returns the items of this node's group if this node is a leaf. Other nodes return an empty list, except the
     * root, which returns every item.
     *
     * @return the items of this node's group
     */
    public List<T> items() {
        return items;
    }

    /**
     * Returns the number of leaves under this node, counting a leaf as 1.
     *
     * @return the leaf count
     */
    public int leafCount() {
        return leafCount;
    }

    @Override
    public String toString() {
        return "AxisNode[" + pathKey + (isCollapsed ? ", collapsed" : "") + ", children=" + children.size() + "]";
    }
}
