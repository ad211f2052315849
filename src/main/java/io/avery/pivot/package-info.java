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

/**
 * Classes to cross-tabulate in-memory items into a pivot table: nested row groups crossed with nested column groups,
 * holding one aggregate value per measure at each intersection, with collapsible groups on both axes. For example:
 *
 * <pre>{@code
 *     Field<Sale> region = new Field<>("Region", Sale::getRegion);
 *     Field<Sale> city = new Field<>("City", Sale::getCity);
 *     Field<Sale> year = new Field<>("Year", Sale::getYear);
 *     Measure<Sale> total = new Measure<>("Amount", Sale::getAmount, Aggregate.SUM);
 *
 *     PivotGrid<Sale> grid = new PivotGrid<>();
 *     grid.setItems(sales);
 *     grid.configure(config -> config
 *         .rows(region, city)
 *         .column(year)
 *         .measure(total)
 *     );
 * }</pre>
 *
 * <p>Here each region becomes a row group, split into a row per city once the region is expanded; each year becomes a
 * column; and each cell holds the total amount of the sales in its region (or city) and year.
 *
 * <h2><a id="Fields">Fields and Measures</a></h2>
 *
 * <p>A {@code Field} selects a group key from each item, using a function supplied by the host. The distinct keys of the
 * first field on an axis partition the items into the top-level groups of that axis, the keys of the second field
 * partition each of those groups, and so on. A {@code Measure} selects a value from each item and reduces the values at
 * an intersection with an {@code Aggregate} function. Values that are not numeric change how some aggregates behave;
 * see {@link io.avery.pivot.Aggregates#evaluate(java.util.List, io.avery.pivot.Measure)}.
 *
 * <h2><a id="Trees">Axis Trees and Drill-Down</a></h2>
 *
 * <p>Each axis is grouped into a tree of {@code AxisNode}s. A node is identified across recomputations by its
 * {@code PathKey}: the group keys from the root down to it. The {@code DrillDownState} of an axis records which paths
 * are collapsed. Every group starts collapsed, the first toggle of a group expands it, and later toggles flip it. The
 * tree is not grouped below a collapsed node, so the node stands in for its subtree: a single body row, or a single
 * column, aggregated over all of the subtree's items.
 *
 * <h2><a id="Views">Views</a></h2>
 *
 * <p>A {@code PivotGrid} derives three views: column header rows of {@code HeaderCell}s with spans, the column leaf
 * paths, and the {@code BodyRow}s. The views are computed together and kept until an input changes, so a host may read
 * them repeatedly between changes. Totals over a whole row, a whole column, or all items are computed on request.
 */
package io.avery.pivot;
