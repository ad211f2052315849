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
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A pivot over a list of items: nested row groups crossed with nested column groups, with one value per measure at
 * each intersection, and drill-down on both axes.
 *
 * <p>The grid derives three views from its items and configuration: the {@link #getColumnHeaderRows() column header
 * rows}, the {@link #getColumnLeaves() column leaves}, and the {@link #getBodyRows() body rows}. The views are computed
 * together when first read, and kept until the items, the configuration, or the drill-down state change, or until
 * {@link #reload()}. Each such change notifies the registered change listeners, so the host can re-read the views.
 *
 * <p>With drill-down enabled (the default), every group starts collapsed. A collapsed row group produces a single body
 * row aggregated over its whole subtree, and a collapsed column group produces a single column leaf. Toggling a group
 * for the first time expands it.
 *
 * <p>A grid is not thread-safe. The host is expected to serialize calls, as a UI does with user actions.
 *
 * <pre>{@code
 *     PivotGrid<Order> grid = new PivotGrid<>();
 *     grid.setItems(orders);
 *     grid.configure(config -> config
 *         .row("Region", Order::getRegion)
 *         .column("Year", Order::getYear)
 *         .measure("Amount", Order::getAmount, Aggregate.SUM)
 *     );
 *     for (BodyRow row : grid.getBodyRows())
 *         render(row.rowHeaderCells(), row.valueCells());
 * }</pre>
 *
 * @param <T> the item type
 */
public class PivotGrid<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(PivotGrid.class);

    private List<T> items = Collections.emptyList();
    private final List<Field<T>> rowFields = new ArrayList<>();
    private final List<Field<T>> columnFields = new ArrayList<>();
    private final List<Measure<T>> measures = new ArrayList<>();
    private final DrillDownState rowState = new DrillDownState();
    private final DrillDownState columnState = new DrillDownState();
    private final PivotCache<T> cache = new PivotCache<>();
    private final List<Runnable> changeListeners = new ArrayList<>();
    private boolean allowDrillDown = true;
    private boolean showRowsTotals = false;
    private boolean showColumnsTotals = false;
    private String emptyText = "No records to display.";

    /**
     * Replaces the items. Items are grouped and aggregated in the given order.
     *
     * @param items the items
     */
    public void setItems(List<? extends T> items) {
        this.items = Collections.unmodifiableList(new ArrayList<T>(items));
        invalidate("items replaced");
    }

    public List<T> getItems() {
        return items;
    }

    /**
     * Replaces the row fields, column fields, and measures.
     *
     * @param rowFields the row fields, outermost first
     * @param columnFields the column fields, outermost first
     * @param measures the measures, in value-column order
     */
    public void configure(List<Field<T>> rowFields, List<Field<T>> columnFields, List<Measure<T>> measures) {
        configure(config -> {
            rowFields.forEach(config::row);
            columnFields.forEach(config::column);
            measures.forEach(config::measure);
        });
    }

    /**
     * Replaces the row fields, column fields, and measures with those defined by the given configurator consumer.
     *
     * @param config a consumer of the configurator
     */
    public void configure(Consumer<ConfigureAPI<T>> config) {
        ConfigureAPI<T> api = new ConfigureAPI<>();
        config.accept(api);
        rowFields.clear();
        rowFields.addAll(api.rows());
        columnFields.clear();
        columnFields.addAll(api.columns());
        measures.clear();
        measures.addAll(api.measures());
        invalidate("configuration replaced");
    }

    public void addRowField(Field<T> field) {
        add(rowFields, field, "row field");
    }

    public void addColumnField(Field<T> field) {
        add(columnFields, field, "column field");
    }

    public void addMeasure(Measure<T> measure) {
        add(measures, measure, "measure");
    }

    public void removeRowField(Field<T> field) {
        remove(rowFields, field, "row field");
    }

    public void removeColumnField(Field<T> field) {
        remove(columnFields, field, "column field");
    }

    public void removeMeasure(Measure<T> measure) {
        remove(measures, measure, "measure");
    }

    private <D> void add(List<D> definitions, D definition, String kind) {
        Objects.requireNonNull(definition);
        if (definitions.contains(definition))
            return;
        definitions.add(definition);
        invalidate(kind + " added: " + definition);
    }

    private <D> void remove(List<D> definitions, D definition, String kind) {
        Objects.requireNonNull(definition);
        if (definitions.remove(definition))
            invalidate(kind + " removed: " + definition);
    }

    public List<Field<T>> getRowFields() {
        return Collections.unmodifiableList(rowFields);
    }

    public List<Field<T>> getColumnFields() {
        return Collections.unmodifiableList(columnFields);
    }

    public List<Measure<T>> getMeasures() {
        return Collections.unmodifiableList(measures);
    }

    public boolean isAllowDrillDown() {
        return allowDrillDown;
    }

    /**
     * Enables or disables drill-down. While disabled, every group is expanded and toggles are ignored; recorded
     * drill-down state is kept, and applies again once drill-down is re-enabled.
     *
     * @param allowDrillDown whether drill-down is enabled
     */
    public void setAllowDrillDown(boolean allowDrillDown) {
        if (this.allowDrillDown == allowDrillDown)
            return;
        this.allowDrillDown = allowDrillDown;
        invalidate("drill-down " + (allowDrillDown ? "enabled" : "disabled"));
    }

    public boolean isShowRowsTotals() {
        return showRowsTotals;
    }

    /**
     * Records whether the host should show a totals column. The views do not depend on it.
     *
     * @param showRowsTotals whether to show row totals
     */
    public void setShowRowsTotals(boolean showRowsTotals) {
        this.showRowsTotals = showRowsTotals;
    }

    public boolean isShowColumnsTotals() {
        return showColumnsTotals;
    }

    public void setShowColumnsTotals(boolean showColumnsTotals) {
        this.showColumnsTotals = showColumnsTotals;
    }

    /**
     * Returns the text the host shows when there are no body rows.
     *
     * @return the empty text
     */
    public String getEmptyText() {
        return emptyText;
    }

    public void setEmptyText(String emptyText) {
        this.emptyText = Objects.requireNonNull(emptyText);
    }

    /**
     * Registers a listener to run after every invalidation of the views.
     *
     * @param listener the listener
     */
    public void addChangeListener(Runnable listener) {
        changeListeners.add(Objects.requireNonNull(listener));
    }

    public void removeChangeListener(Runnable listener) {
        changeListeners.remove(listener);
    }

    /**
     * Discards the views, so the next read recomputes them.
     */
    public void reload() {
        invalidate("reload");
    }

    /**
     * Returns the column header rows, one per column field. Each row holds the header cells of one level of the column
     * tree, in depth-first order, with column spans that add up to the number of column leaves.
     *
     * @return the column header rows
     */
    public List<List<HeaderCell>> getColumnHeaderRows() {
        return snapshot().columnHeaderRows;
    }

    /**
     * Returns the group-key paths of the column leaves, in order. Without column fields there is a single, empty, path.
     *
     * @return the column leaf paths
     */
    public List<List<Object>> getColumnLeaves() {
        return snapshot().columnLeaves;
    }

    /**
     * Returns the body rows. There are none if there are no items, no row fields, or no measures.
     *
     * @return the body rows
     */
    public List<BodyRow> getBodyRows() {
        return snapshot().bodyRows;
    }

    /**
     * Returns the row tree the body rows were built from. Its leaves are the fully expanded and collapsed row groups,
     * one per body row when there are row fields and measures.
     *
     * @return the root of the row tree
     */
    public AxisNode<T> getRowTree() {
        return snapshot().rowTree;
    }

    /**
     * Returns the column tree the column header rows and column leaves were built from.
     *
     * @return the root of the column tree
     */
    public AxisNode<T> getColumnTree() {
        return snapshot().columnTree;
    }

    /**
     * Returns the generation of the views, which increments on every invalidation.
     *
     * @return the generation
     */
    public long getGeneration() {
        return cache.generation();
    }

    /**
     * Toggles the row group at the given path. The first toggle of a group expands it; later toggles flip it. Has no
     * effect while drill-down is disabled.
     *
     * @param path the group path
     */
    public void toggleRowGroup(PathKey path) {
        toggle(Axis.ROW, path);
    }

    /**
     * Toggles the column group at the given path. The first toggle of a group expands it; later toggles flip it. Has
     * no effect while drill-down is disabled.
     *
     * @param path the group path
     */
    public void toggleColumnGroup(PathKey path) {
        toggle(Axis.COLUMN, path);
    }

    /**
     * Toggles the group at the given path on the given axis.
     *
     * @param axis the axis
     * @param path the group path
     */
    public void toggle(Axis axis, PathKey path) {
        Objects.requireNonNull(axis);
        Objects.requireNonNull(path);
        if (!allowDrillDown)
            return;
        boolean collapsed = stateOf(axis).toggle(path);
        LOGGER.debug("Toggled {} group [{}], collapsed={}", axis, path, collapsed);
        invalidate(axis + " group toggled");
    }

    /**
     * Returns {@code true} if the group at the given path on the given axis would be collapsed in the next
     * recomputation.
     *
     * @param axis the axis
     * @param path the group path
     * @return {@code true} if the group is collapsed
     */
    public boolean isCollapsed(Axis axis, PathKey path) {
        return stateOf(axis).isCollapsed(path, allowDrillDown);
    }

    /**
     * Finds the path of the first row group whose {@code "|"}-joined keys equal the given string.
     *
     * @param joined the joined form of a path
     * @return the path, if a current row group matches
     */
    public Optional<PathKey> findRowPath(String joined) {
        return AxisTrees.findPath(snapshot().rowTree, joined);
    }

    /**
     * Finds the path of the first column group whose {@code "|"}-joined keys equal the given string.
     *
     * @param joined the joined form of a path
     * @return the path, if a current column group matches
     */
    public Optional<PathKey> findColumnPath(String joined) {
        return AxisTrees.findPath(snapshot().columnTree, joined);
    }

    /**
     * Returns the measure evaluated over every item.
     *
     * @param measure the measure
     * @return the grand total, or {@code null} if there are no items
     */
    public Object getGrandTotal(Measure<T> measure) {
        return Aggregates.evaluate(items, measure);
    }

    /**
     * Returns the measure evaluated over the items of the given row's group, across all columns.
     *
     * @param row a body row
     * @param measure the measure
     * @return the row total, or {@code null} if the group has no items
     */
    public Object getRowTotal(BodyRow row, Measure<T> measure) {
        return Aggregates.evaluate(items, rowFields, row.rowPath().values(), measure);
    }

    /**
     * Returns the measure evaluated over the items of the given column group, across all rows.
     *
     * @param columnPath the group keys of a column group, outermost first
     * @param measure the measure
     * @return the column total, or {@code null} if the group has no items
     */
    public Object getColumnTotal(List<?> columnPath, Measure<T> measure) {
        return Aggregates.evaluate(items, columnFields, columnPath, measure);
    }

    private DrillDownState stateOf(Axis axis) {
        return axis == Axis.ROW ? rowState : columnState;
    }

    private PivotCache.Snapshot<T> snapshot() {
        return cache.get(this::compute);
    }

    private PivotCache.Snapshot<T> compute() {
        List<Field<T>> rows = new ArrayList<>(rowFields);
        List<Field<T>> columns = new ArrayList<>(columnFields);
        List<Measure<T>> values = new ArrayList<>(measures);

        AxisNode<T> columnTree = AxisTrees.build(items, columns, columnState, allowDrillDown);
        List<List<HeaderCell>> columnHeaderRows = HeaderFlattener.flatten(columnTree, columns.size());
        List<List<Object>> columnLeaves = AxisTrees.leafPaths(columnTree);

        AxisNode<T> rowTree = AxisTrees.build(items, rows, rowState, allowDrillDown);
        List<BodyRow> bodyRows = rows.isEmpty() || values.isEmpty()
            ? Collections.emptyList()
            : BodyRows.build(rowTree, rows.size(), columnLeaves, columns, values);

        LOGGER.debug("Computed generation {}: {} body rows, {} column leaves, {} measures",
                     cache.generation(), bodyRows.size(), columnLeaves.size(), values.size());
        return new PivotCache.Snapshot<>(rowTree, columnTree, columnHeaderRows, new ArrayList<>(bodyRows),
                                         columnLeaves);
    }

    private void invalidate(String reason) {
        long generation = cache.invalidate();
        LOGGER.debug("Invalidated pivot views ({}), generation {}", reason, generation);
        for (Runnable listener : new ArrayList<>(changeListeners))
            listener.run();
    }
}
