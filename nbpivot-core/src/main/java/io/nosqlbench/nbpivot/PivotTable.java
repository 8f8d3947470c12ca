package io.nosqlbench.nbpivot;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.nbpivot.aggregate.Aggregator;
import io.nosqlbench.nbpivot.aggregate.AggregatorRegistry;
import io.nosqlbench.nbpivot.config.PivotConfigurationException;
import io.nosqlbench.nbpivot.config.PivotOptions;
import io.nosqlbench.nbpivot.grouping.GroupRow;
import io.nosqlbench.nbpivot.grouping.GroupingEngine;
import io.nosqlbench.nbpivot.grouping.KeyCell;
import io.nosqlbench.nbpivot.grouping.PivotErrors;
import io.nosqlbench.nbpivot.grouping.PivotKey;
import io.nosqlbench.nbpivot.plan.AggregateColumn;
import io.nosqlbench.nbpivot.plan.ColumnPlanner;
import io.nosqlbench.nbpivot.plan.KeyColumn;
import io.nosqlbench.nbpivot.plan.OutputColumn;
import io.nosqlbench.nbpivot.plan.OutputColumns;
import io.nosqlbench.nbpivot.plan.RangeColumn;
import io.nosqlbench.nbpivot.status.eventing.StatusSink;
import io.nosqlbench.nbpivot.table.Column;
import io.nosqlbench.nbpivot.table.SourceTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * A pivot table derived from a {@link SourceTable}.
 *
 * <p>{@link #load()} plans the aggregate columns and groups the source rows as two concurrent
 * tasks over the same row snapshot, and returns a future that completes when both are done.
 * While rows are being grouped, {@link #isLoading()} is true and aggregate cells read as
 * {@link #IN_PROGRESS}. Once the load completes, aggregate values are cached per cell.
 *
 * <pre>{@code
 * PivotTable<Row> pivot = PivotTable.makePivot(source, List.of(region, amount), List.of(product));
 * pivot.load().join();
 * for (GroupRow<Row> row : pivot.rows()) {
 *     for (OutputColumn<Row> column : pivot.columns()) {
 *         System.out.print(pivot.format(row, column) + " ");
 *     }
 * }
 * }</pre>
 *
 * @param <R> the source row type
 */
public final class PivotTable<R> {

    private static final Logger logger = LogManager.getLogger(PivotTable.class);

    /// Read from an aggregate cell while grouping is still running.
    public static final Object IN_PROGRESS = new Object() {
        @Override
        public String toString() {
            return "...";
        }
    };

    private final SourceTable<R> source;
    private final List<Column<R>> groupByColumns;
    private final List<Column<R>> pivotColumns;
    private final PivotOptions options;
    private final AggregatorRegistry registry;
    private final List<StatusSink> sinks;
    private final Executor executor;
    private final Consumer<GroupRow<R>> rowCallback;

    private final List<GroupRow<R>> rows = new ArrayList<>();
    private final List<OutputColumn<R>> columns = new ArrayList<>();
    private final List<OutputColumn<R>> keyColumns = new CopyOnWriteArrayList<>();
    private final Set<OutputColumn<R>> cachedColumns = ConcurrentHashMap.newKeySet();
    private final Map<GroupRow<R>, Map<OutputColumn<R>, Optional<Object>>> cache = new ConcurrentHashMap<>();

    private volatile PivotErrors errors = new PivotErrors();
    private volatile String name;
    private volatile boolean loading;
    private volatile LoadRun current;
    private volatile CompletableFuture<Void> loaded;

    private PivotTable(Builder<R> builder) {
        this.source = Objects.requireNonNull(builder.source, "source");
        this.groupByColumns = List.copyOf(builder.groupBy);
        this.pivotColumns = List.copyOf(builder.pivot);
        this.options = builder.options;
        this.registry = builder.registry;
        this.sinks = List.copyOf(builder.sinks);
        this.executor = builder.executor;
        this.rowCallback = builder.rowCallback;
    }

    public static <R> Builder<R> builder(SourceTable<R> source) {
        return new Builder<>(source);
    }

    /**
     * Starts loading a pivot of the source with default options.
     *
     * @param source  the table to summarize
     * @param groupBy columns whose values, or bins, become rows
     * @param pivot   columns whose values become columns
     * @return the table, already loading
     * @throws PivotConfigurationException if the columns cannot be pivoted as requested
     */
    public static <R> PivotTable<R> makePivot(SourceTable<R> source, List<Column<R>> groupBy, List<Column<R>> pivot) {
        PivotTable<R> table = PivotTable.builder(source).groupBy(groupBy).pivot(pivot).build();
        table.load();
        return table;
    }

    /**
     * Clears the table and loads it from the current source rows. A load still running is
     * cancelled first, and nothing it produces afterwards reaches this table.
     *
     * @return a future completing when the columns are planned and the rows grouped; after
     * {@link #cancel()} it completes exceptionally, caused by a {@link java.util.concurrent.CancellationException}
     * @throws PivotConfigurationException before any work starts, if more than one group-by column
     *                                     would be binned or an aggregator name is unknown
     */
    public synchronized CompletableFuture<Void> load() {
        List<Column<R>> numericColumns = groupByColumns.stream().filter(this::isNumericRange).collect(Collectors.toList());
        if (numericColumns.size() > 1) {
            String names = numericColumns.stream().map(Column::name).collect(Collectors.joining(", "));
            logger.error("only one numeric column can be binned, got {}", names);
            throw new PivotConfigurationException("only one numeric column can be binned, got " + names);
        }
        Map<Column<R>, List<Aggregator>> aggregated =
            ColumnPlanner.aggregateColumns(source.columns(), pivotColumns, registry);

        Column<R> numericColumn = numericColumns.isEmpty() ? null : numericColumns.get(0);
        List<Column<R>> discreteColumns = new ArrayList<>();
        for (Column<R> column : groupByColumns) {
            if (column != numericColumn) {
                discreteColumns.add(column);
            }
        }

        LoadRun previous = current;
        if (previous != null) {
            previous.cancelled = true;
        }
        LoadRun run = new LoadRun();
        current = run;

        synchronized (this.rows) {
            this.rows.clear();
        }
        synchronized (this.columns) {
            this.columns.clear();
        }
        cache.clear();
        cachedColumns.clear();
        errors = run.errors;
        name = null;
        resetKeyColumns(numericColumn);

        List<R> snapshot = source.rows();
        ColumnPlanner<R> planner = new ColumnPlanner<>(source.name(), aggregated, pivotColumns, options)
            .withSinks(sinks)
            .withCancellation(() -> run.cancelled);
        GroupingEngine<R> engine = new GroupingEngine<>(discreteColumns, numericColumn, pivotColumns, options, run.errors)
            .withSinks(sinks)
            .withCancellation(() -> run.cancelled)
            .withRowCallback(rowCallback);

        ExecutorService owned = executor == null ? newExecutor(options.threads()) : null;
        Executor runOn = owned != null ? owned : executor;
        logger.debug("loading pivot of {} ({} rows) grouped by {} pivoted on {}", source.name(), snapshot.size(),
            names(groupByColumns), names(pivotColumns));

        loading = true;
        CompletableFuture<Void> planning = CompletableFuture.runAsync(() -> planner.plan(snapshot, new Sink(run)), runOn);
        CompletableFuture<Void> grouping = CompletableFuture.runAsync(() -> {
            try {
                engine.group(snapshot, row -> addRow(run, row));
            } finally {
                synchronized (this) {
                    if (current == run) {
                        loading = false;
                    }
                }
            }
        }, runOn);

        loaded = CompletableFuture.allOf(planning, grouping).whenComplete((ignored, failure) -> {
            if (owned != null) {
                owned.shutdown();
            }
            if (current != run) {
                logger.debug("superseded load of {} finished", source.name());
            } else if (failure == null) {
                afterLoad();
            } else {
                logger.info("pivot {} did not finish loading: {}", name(), failure.getMessage());
            }
        });
        return loaded;
    }

    /**
     * Stops a running load. Rows and columns already created stay in the table.
     */
    public void cancel() {
        LoadRun run = current;
        if (run != null) {
            run.cancelled = true;
        }
    }

    public boolean isLoading() {
        return loading;
    }

    /**
     * @return the future of the current load, or a completed future when {@link #load()} was never called
     */
    public CompletableFuture<Void> loaded() {
        CompletableFuture<Void> current = loaded;
        return current != null ? current : CompletableFuture.completedFuture(null);
    }

    /**
     * @return the planned name, or {@code <source>_pivot} when planning named nothing
     */
    public String name() {
        String planned = name;
        return planned != null ? planned : source.name() + "_pivot";
    }

    public SourceTable<R> source() {
        return source;
    }

    public List<GroupRow<R>> rows() {
        synchronized (rows) {
            return List.copyOf(rows);
        }
    }

    /**
     * @return key columns first, then aggregate columns in planned order
     */
    public List<OutputColumn<R>> columns() {
        List<OutputColumn<R>> all = new ArrayList<>(keyColumns);
        synchronized (columns) {
            all.addAll(columns);
        }
        return Collections.unmodifiableList(all);
    }

    public List<OutputColumn<R>> keyColumns() {
        return List.copyOf(keyColumns);
    }

    /**
     * @return the failures captured by the last load
     */
    public PivotErrors errors() {
        return errors;
    }

    /**
     * @param row    a row of this table
     * @param column a column of this table
     * @return the cell value, or {@link #IN_PROGRESS} for an aggregate cell while loading
     */
    public Object value(GroupRow<R> row, OutputColumn<R> column) {
        if (!(column instanceof AggregateColumn)) {
            return OutputColumns.evaluate(column, row);
        }
        if (loading) {
            return IN_PROGRESS;
        }
        if (!cachedColumns.contains(column)) {
            return OutputColumns.evaluate(column, row);
        }
        return cache.computeIfAbsent(row, r -> new ConcurrentHashMap<>())
            .computeIfAbsent(column, c -> Optional.ofNullable(OutputColumns.evaluate(c, row)))
            .orElse(null);
    }

    /**
     * @return the cell text, {@code ...} while the cell is in progress
     */
    public String format(GroupRow<R> row, OutputColumn<R> column) {
        Object value = value(row, column);
        if (value == IN_PROGRESS) {
            return IN_PROGRESS.toString();
        }
        return OutputColumns.format(column, value);
    }

    /**
     * Edits a discrete key of one row and writes the new value to every source row in the group.
     * The row keeps its place until the next load.
     *
     * @param row    a row of this table
     * @param column a key column of this table
     * @param value  the new value, coerced to the source column's type
     * @throws IllegalArgumentException if the column is not a discrete key column
     * @throws io.nosqlbench.nbpivot.table.ValueCoercionException if the value does not fit the column type
     */
    public void setKey(GroupRow<R> row, OutputColumn<R> column, Object value) {
        if (!(column instanceof KeyColumn<R> key)) {
            throw new IllegalArgumentException("column '" + column.name() + "' is not an editable key column");
        }
        Column<R> sourceColumn = key.sourceColumn();
        Object typed = sourceColumn.type().coerce(value);
        row.replaceDiscreteKey(key.keyIndex(), new KeyCell.Value(typed, sourceColumn.format(typed)));
        sourceColumn.setValues(row.sourceRows(), typed);
        cache.remove(row);
    }

    /**
     * @return all source rows of a group, named after the group's keys
     */
    public RowSubset<R> openRow(GroupRow<R> row) {
        String keys = row.discreteKeys().stream().map(KeyCell::display).collect(Collectors.joining("+"));
        return new RowSubset<>(source.name() + "_" + keys, row.sourceRows());
    }

    /**
     * @return the source rows behind one aggregate cell, named after its pivot value; for other
     * columns, the same as {@link #openRow}
     */
    public RowSubset<R> openCell(GroupRow<R> row, OutputColumn<R> column) {
        if (column instanceof AggregateColumn<R> aggregate && aggregate.isPivoted()) {
            PivotKey pivotKey = aggregate.pivotKey();
            return new RowSubset<>(source.name() + "_" + pivotKey.display(), row.pivotRows(pivotKey));
        }
        return openRow(row);
    }

    /**
     * Adds more aggregates of the same source column, and pivot value, right after an existing
     * aggregate column.
     *
     * @param column      an aggregate column of this table
     * @param aggregators aggregator names
     * @return the added columns
     * @throws PivotConfigurationException if the column is not an aggregate column or a name is unknown
     */
    public List<AggregateColumn<R>> addAggregateColumns(OutputColumn<R> column, List<String> aggregators) {
        if (!(column instanceof AggregateColumn<R> existing)) {
            throw new PivotConfigurationException("not an aggregation column");
        }
        Column<R> sourceColumn = existing.sourceColumn();
        List<AggregateColumn<R>> added = new ArrayList<>();
        for (Aggregator aggregator : registry.lookupAll(aggregators)) {
            String columnName = sourceColumn.name() + "_" + aggregator.getName();
            if (existing.isPivoted()) {
                columnName += "_" + ColumnPlanner.valueName(existing.pivotKey(), pivotColumns.size());
            }
            added.add(AggregateColumn.of(columnName, sourceColumn, aggregator, existing.pivotKey()));
        }
        synchronized (columns) {
            int at = columns.indexOf(existing);
            columns.addAll(at < 0 ? columns.size() : at + 1, added);
        }
        if (!loading && loaded().isDone()) {
            cachedColumns.addAll(added);
        }
        return added;
    }

    private boolean isNumericRange(Column<R> column) {
        return column.type().isNumeric() && options.numericBinning();
    }

    private void resetKeyColumns(Column<R> numericColumn) {
        keyColumns.clear();
        int discreteIndex = 0;
        for (Column<R> column : groupByColumns) {
            boolean numeric = column == numericColumn;
            if (!pivotColumns.contains(column)) {
                keyColumns.add(numeric ? RangeColumn.of(column) : KeyColumn.of(column, discreteIndex));
            }
            if (!numeric) {
                discreteIndex++;
            }
        }
    }

    private void addRow(LoadRun run, GroupRow<R> row) {
        synchronized (rows) {
            if (current == run) {
                rows.add(row);
            }
        }
    }

    private void afterLoad() {
        synchronized (columns) {
            for (OutputColumn<R> column : columns) {
                if (column instanceof AggregateColumn) {
                    cachedColumns.add(column);
                }
            }
        }
        logger.info("pivot {}: {} rows, {} columns, {} captured failures", name(), rows().size(),
            columns().size(), errors.count());
    }

    private static String names(List<? extends Column<?>> columns) {
        return columns.stream().map(Column::name).collect(Collectors.joining(",", "[", "]"));
    }

    private static ExecutorService newExecutor(int threads) {
        return Executors.newFixedThreadPool(threads, new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "pivot-loader-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
    }

    /// State owned by one call to [#load()]; a later load replaces it as current.
    private static final class LoadRun {
        private final PivotErrors errors = new PivotErrors();
        private volatile boolean cancelled;
    }

    private final class Sink implements ColumnPlanner.ColumnSink<R> {
        private final LoadRun run;

        private Sink(LoadRun run) {
            this.run = run;
        }

        @Override
        public void addColumn(OutputColumn<R> column) {
            synchronized (columns) {
                if (current == run) {
                    columns.add(column);
                }
            }
        }

        @Override
        public void offerName(String proposed) {
            synchronized (PivotTable.this) {
                if (current == run && name == null) {
                    name = proposed;
                }
            }
        }
    }

    /**
     * Configures a {@link PivotTable}.
     */
    public static final class Builder<R> {
        private final SourceTable<R> source;
        private List<Column<R>> groupBy = List.of();
        private List<Column<R>> pivot = List.of();
        private PivotOptions options = PivotOptions.DEFAULTS;
        private AggregatorRegistry registry = AggregatorRegistry.standard();
        private List<StatusSink> sinks = List.of();
        private Executor executor;
        private Consumer<GroupRow<R>> rowCallback;

        private Builder(SourceTable<R> source) {
            this.source = source;
        }

        public Builder<R> groupBy(List<Column<R>> columns) {
            this.groupBy = List.copyOf(columns);
            return this;
        }

        public Builder<R> pivot(List<Column<R>> columns) {
            this.pivot = List.copyOf(columns);
            return this;
        }

        public Builder<R> options(PivotOptions pivotOptions) {
            this.options = Objects.requireNonNull(pivotOptions, "options");
            return this;
        }

        public Builder<R> registry(AggregatorRegistry aggregatorRegistry) {
            this.registry = Objects.requireNonNull(aggregatorRegistry, "registry");
            return this;
        }

        public Builder<R> sinks(List<StatusSink> statusSinks) {
            this.sinks = List.copyOf(statusSinks);
            return this;
        }

        /**
         * @param loadExecutor runs the two load tasks; when unset each load uses its own pool of
         *                     {@link PivotOptions#threads()} threads
         */
        public Builder<R> executor(Executor loadExecutor) {
            this.executor = loadExecutor;
            return this;
        }

        public Builder<R> rowCallback(Consumer<GroupRow<R>> callback) {
            this.rowCallback = callback;
            return this;
        }

        public PivotTable<R> build() {
            return new PivotTable<>(this);
        }
    }
}
