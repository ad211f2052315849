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

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Collapse state of the groups on one axis, keyed by {@link PathKey path}.
 *
 * <p>A path with no entry is in the default state, which is collapsed. The first toggle of a path always records it as
 * expanded, and later toggles flip it. Entries are never removed, so a path keeps its state while its group is absent
 * from the data, and the state applies again if the group comes back.
 */
public class DrillDownState {
    private final Map<PathKey, Boolean> collapsedByPath = new HashMap<>();

    /**
     * Returns {@code true} if the group at the given path is collapsed. When drill-down is disabled no group is
     * collapsed, whatever the recorded state.
     *
     * @param path the group path
     * @param allowDrillDown whether drill-down is enabled
     * @return {@code true} if the group is collapsed
     */
    public boolean isCollapsed(PathKey path, boolean allowDrillDown) {
        if (!allowDrillDown)
            return false;
        Boolean collapsed = collapsedByPath.get(path);
        return collapsed == null || collapsed;
    }

    /**
     * Flips the recorded state of the given path, or records it as expanded if it has no entry yet.
     *
     * @param path the group path
     * @return the recorded collapse state after the toggle
     */
    public boolean toggle(PathKey path) {
        Objects.requireNonNull(path);
        return collapsedByPath.merge(path, false, (collapsed, ignored) -> !collapsed);
    }

    /**
     * Returns the recorded state of the given path, or {@code null} if the path has no entry.
     *
     * @param path the group path
     * @return the recorded collapse state, or {@code null}
     */
    public Boolean get(PathKey path) {
        return collapsedByPath.get(path);
    }

    /**
     * Returns the number of recorded paths.
     *
     * @return the number of recorded paths
     */
    public int size() {
        return collapsedByPath.size();
    }

    @Override
    public String toString() {
        return "DrillDownState" + collapsedByPath;
    }
}
