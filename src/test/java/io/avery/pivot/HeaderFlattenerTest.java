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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class HeaderFlattenerTest {
    private static final List<Field<Sale>> YEAR_REGION = Arrays.asList(Sale.YEAR, Sale.REGION);

    private static List<String> titles(List<HeaderCell> cells) {
        return cells.stream().map(HeaderCell::title).collect(Collectors.toList());
    }

    private static int colSpanSum(List<HeaderCell> cells) {
        return cells.stream().mapToInt(HeaderCell::colSpan).sum();
    }

    @Test
    void testFullyExpandedSpans() {
        AxisNode<Sale> root = AxisTrees.build(Sale.sample(), YEAR_REGION, new DrillDownState(), false);
        List<List<HeaderCell>> rows = HeaderFlattener.flatten(root, 2);
        assertEquals(2, rows.size());

        assertEquals(Arrays.asList("2023", "2024"), titles(rows.get(0)));
        assertEquals(Arrays.asList("East", "West", "West", "East", "North"), titles(rows.get(1)));

        HeaderCell y2023 = rows.get(0).get(0);
        assertEquals(2, y2023.colSpan());
        assertEquals(1, y2023.rowSpan());
        assertEquals(0, y2023.level());
        assertEquals(PathKey.of(2023), y2023.pathKey());
        assertEquals(3, rows.get(0).get(1).colSpan());

        HeaderCell east = rows.get(1).get(0);
        assertEquals(1, east.colSpan());
        assertEquals(1, east.rowSpan());
        assertEquals(1, east.level());
        assertEquals("140px", east.width());
    }

    @Test
    void testCollapsedNodeSpansRemainingRows() {
        DrillDownState state = new DrillDownState();
        state.toggle(PathKey.of(2024));
        AxisNode<Sale> root = AxisTrees.build(Sale.sample(), YEAR_REGION, state, true);
        List<List<HeaderCell>> rows = HeaderFlattener.flatten(root, 2);

        HeaderCell y2023 = rows.get(0).get(0);
        assertTrue(y2023.isCollapsed());
        assertEquals(2, y2023.rowSpan());
        assertEquals(1, y2023.colSpan());

        HeaderCell y2024 = rows.get(0).get(1);
        assertFalse(y2024.isCollapsed());
        assertEquals(1, y2024.rowSpan());
        assertEquals(3, y2024.colSpan());

        assertEquals(Arrays.asList("West", "East", "North"), titles(rows.get(1)));
    }

    @Test
    void testSpanConservation() {
        DrillDownState state = new DrillDownState();
        state.toggle(PathKey.of(2023));
        List<Field<Sale>> fields = Arrays.asList(Sale.YEAR, Sale.REGION, Sale.CITY);
        AxisNode<Sale> root = AxisTrees.build(Sale.sample(), fields, state, true);
        List<List<HeaderCell>> rows = HeaderFlattener.flatten(root, fields.size());
        // Leaves cover the rows below them, so each row's spans add up to the leaf count once leaves are counted into
        // every row they cover.
        for (int level = 0; level < rows.size(); level++) {
            int covered = 0;
            for (int upper = 0; upper <= level; upper++)
                for (HeaderCell cell : rows.get(upper))
                    if (upper == level || upper + cell.rowSpan() > level)
                        covered += cell.colSpan();
            assertEquals(root.leafCount(), covered);
        }
    }

    @Test
    void testEmptyTreeGivesEmptyLevels() {
        AxisNode<Sale> root = AxisTrees.build(Collections.emptyList(), YEAR_REGION, new DrillDownState(), true);
        List<List<HeaderCell>> rows = HeaderFlattener.flatten(root, 2);
        assertEquals(2, rows.size());
        assertTrue(rows.get(0).isEmpty());
        assertTrue(rows.get(1).isEmpty());
        assertTrue(HeaderFlattener.flatten(root, 0).isEmpty());
    }

    @Test
    void testTopLevelSpansAddUpToLeafCount() {
        AxisNode<Sale> root = AxisTrees.build(Sale.sample(), YEAR_REGION, new DrillDownState(), false);
        List<List<HeaderCell>> rows = HeaderFlattener.flatten(root, 2);
        assertEquals(root.leafCount(), colSpanSum(rows.get(0)));
        assertEquals(root.leafCount(), colSpanSum(rows.get(1)));
    }

    @Test
    void testPadSquaresOffRows() {
        List<List<HeaderCell>> rows = new ArrayList<>();
        rows.add(new ArrayList<>(Collections.singletonList(new HeaderCell("East", "East", 0, null, 1, 1, true,
                                                                          PathKey.of("East")))));
        rows.add(new ArrayList<>(Arrays.asList(
            new HeaderCell("West", "West", 0, null, 2, 1, false, PathKey.of("West")),
            new HeaderCell("Reno", "Reno", 1, null, 1, 1, true, PathKey.of("West", "Reno")))));
        HeaderFlattener.pad(rows);

        assertEquals(2, rows.get(0).size());
        assertEquals(2, rows.get(1).size());
        HeaderCell filler = rows.get(0).get(1);
        assertTrue(filler.isFiller());
        assertNull(filler.value());
        assertEquals("", filler.title());
        assertEquals(1, filler.level());
        assertEquals(1, filler.rowSpan());
        assertFalse(filler.isCollapsed());
    }
}
