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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds and walks axis trees.
 */
public class AxisTrees {
    private static final Logger LOGGER = LoggerFactory.getLogger(AxisTrees.class);

    private AxisTrees() {} // Prevent instantiation

    /**
     * Groups the given items by the given fields into an axis tree. The first field partitions the items into the
     * children of the root, the second field partitions each child's items into its children, and so on. Groups appear
     * in order of their first item, and items keep their order within each group.
     *
     * <p>Grouping stops below a group that the given state reports as collapsed. A collapsed group, or a group at the
     * last field, is a leaf carrying its items. If there are no fields or no items, the root has no children.
     *
     * <p>An item whose field selector throws is grouped under a {@code null} key at that level.
     *
     * @param items the items
     * @param fields the fields, in level order
     * @param state the drill-down state of the axis
     * @param allowDrillDown whether drill-down is enabled; if not, every group is expanded
     * @return the root of the tree
     * @param <T> the item type
     */
    public static <T> AxisNode<T> build(List<T> items, List<Field<T>> fields, DrillDownState state,
                                        boolean allowDrillDown) {
        List<AxisNode<T>> children = fields.isEmpty() || items.isEmpty()
            ? Collections.emptyList()
            : group(items, fields, 0, PathKey.ROOT, state, allowDrillDown);
        return AxisNode.root(children, items);
    }

    private static <T> List<AxisNode<T>> group(List<T> items, List<Field<T>> fields, int index, PathKey path,
                                               DrillDownState state, boolean allowDrillDown) {
        Field<T> field = fields.get(index);
        Map<Object, List<T>> itemsByKey = new LinkedHashMap<>();
        for (T item : items)
            itemsByKey.computeIfAbsent(keyOf(field, item), k -> new ArrayList<>()).add(item);

        List<AxisNode<T>> nodes = new ArrayList<>(itemsByKey.size());
        itemsByKey.forEach((key, groupItems) -> {
            PathKey childPath = path.child(key);
            boolean isCollapsed = state.isCollapsed(childPath, allowDrillDown);
            boolean isLast = index + 1 >= fields.size();
            if (isCollapsed || isLast) {
                nodes.add(new AxisNode<>(key, Utils.title(key), index + 1, field.width(), Collections.emptyList(),
                                         isCollapsed, childPath, groupItems));
            } else {
                List<AxisNode<T>> children = group(groupItems, fields, index + 1, childPath, state, allowDrillDown);
                nodes.add(new AxisNode<>(key, Utils.title(key), index + 1, field.width(), children,
                                         false, childPath, Collections.emptyList()));
            }
        });
        return nodes;
    }

    /**
     * Selects the group key of an item. A failing selector yields a {@code null} key.
     */
    static <T> Object keyOf(Field<T> field, T item) {
        try {
            return field.get(item);
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to select {} of {}: {}", field, item, e.getMessage());
            return null;
        }
    }

    /**
     * Returns the group-key paths from the root to each leaf, in depth-first order. A root with no children has one
     * leaf path, the empty path.
     *
     * @param root the root of the tree
     * @return the leaf paths
     */
    public static List<List<Object>> leafPaths(AxisNode<?> root) {
        List<List<Object>> paths = new ArrayList<>();
        collectLeafPaths(root, paths);
        return paths;
    }

    private static void collectLeafPaths(AxisNode<?> node, List<List<Object>> paths) {
        if (node.isLeaf()) {
            paths.add(node.pathKey().values());
            return;
        }
        for (AxisNode<?> child : node.children())
            collectLeafPaths(child, paths);
    }

    /**
     * Returns the leaf nodes of the tree, in depth-first order. A root with no children is its own leaf.
     *
     * @param root the root of the tree
     * @return the leaf nodes
     * @param <T> the item type
     */
    public static <T> List<AxisNode<T>> leaves(AxisNode<T> root) {
        List<AxisNode<T>> leaves = new ArrayList<>();
        collectLeaves(root, leaves);
        return leaves;
    }

    private static <T> void collectLeaves(AxisNode<T> node, List<AxisNode<T>> leaves) {
        if (node.isLeaf()) {
            leaves.add(node);
            return;
        }
        for (AxisNode<T> child : node.children())
            collectLeaves(child, leaves);
    }

    /**
     * Finds the first node, in depth-first order, whose path renders as the given {@code "|"}-joined string. The root
     * is not considered.
     *
     * @param root the root of the tree
     * @param joined the joined form of a path, as by {@link PathKey#toString()}
     * @return the path of the first matching node, if any
     */
    public static Optional<PathKey> findPath(AxisNode<?> root, String joined) {
        for (AxisNode<?> child : root.children()) {
            if (child.pathKey().toString().equals(joined))
                return Optional.of(child.pathKey());
            Optional<PathKey> found = findPath(child, joined);
            if (found.isPresent())
                return found;
        }
        return Optional.empty();
    }
}
