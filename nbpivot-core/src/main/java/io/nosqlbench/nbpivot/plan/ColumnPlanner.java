package io.nosqlbench.nbpivot.plan;

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
import io.nosqlbench.nbpivot.config.PivotOptions;
import io.nosqlbench.nbpivot.grouping.PivotKey;
import io.nosqlbench.nbpivot.status.StatusEmitter;
import io.nosqlbench.nbpivot.status.eventing.RunState;
import io.nosqlbench.nbpivot.status.eventing.StatusSink;
import io.nosqlbench.nbpivot.status.eventing.StatusSource;
import io.nosqlbench.nbpivot.status.eventing.StatusUpdate;
import io.nosqlbench.nbpivot.table.Column;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Plans the aggregate columns of a pivot.
 *
 * <p>Without pivot columns, each aggregated source column gets one column per aggregator,
 * named {@code <column>_<aggregator>}. With pivot columns, the source is scanned once per pivot
 * column to discover its distinct values in first-seen order, and each value gets one column per
 * aggregated column and aggregator. Names carry only as much as is needed to tell them apart:
 *
 * <ul>
 *   <li>one aggregated column with one aggregator: {@code <value>}</li>
 *   <li>one aggregated column with several aggregators: {@code <aggregator>_<value>}</li>
 *   <li>several aggregated columns: {@code <column>_<aggregator>_<value>}</li>
 * </ul>
 *
 * <p>With more than one pivot column, {@code <value>} becomes {@code <pivotcolumn>_<value>}.
 *
 * @param <R> the source row type
 */
public final class ColumnPlanner<R> implements StatusSource<ColumnPlanner<R>> {

    private static final Logger logger = LogManager.getLogger(ColumnPlanner.class);

    /**
     * Receives planned columns as they are discovered.
     */
    public interface ColumnSink<R> {
        void addColumn(OutputColumn<R> column);

        /**
         * Proposes a table name. Only the first proposal is kept.
         */
        void offerName(String name);
    }

    private final String sourceName;
    private final Map<Column<R>, List<Aggregator>> aggregateColumns;
    private final List<Column<R>> pivotColumns;
    private final PivotOptions options;

    private List<StatusSink> sinks = List.of();
    private BooleanSupplier cancelled = () -> false;

    private volatile long completed;
    private volatile long total;
    private volatile RunState state = RunState.PENDING;

    /**
     * @param sourceName       the source table name, used to derive the pivot table name
     * @param aggregateColumns the aggregated columns with their aggregators, in column order,
     *                         as resolved by {@link #aggregateColumns}
     * @param pivotColumns     the pivot columns
     * @param options          progress settings
     */
    public ColumnPlanner(String sourceName, Map<Column<R>, List<Aggregator>> aggregateColumns,
                         List<Column<R>> pivotColumns, PivotOptions options) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.aggregateColumns = Collections.unmodifiableMap(new LinkedHashMap<>(aggregateColumns));
        this.pivotColumns = List.copyOf(pivotColumns);
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Resolves which source columns are aggregated and how.
     *
     * <p>Columns marked with aggregator names are aggregated with those. When no column is marked
     * but there are pivot columns, the pivot columns themselves are counted.
     *
     * @param sourceColumns the source table's columns
     * @param pivotColumns  the pivot columns
     * @param registry      where aggregator names are looked up
     * @return the aggregated columns in source column order, possibly empty
     * @throws io.nosqlbench.nbpivot.config.PivotConfigurationException if a name is unknown
     */
    public static <R> Map<Column<R>, List<Aggregator>> aggregateColumns(List<? extends Column<R>> sourceColumns,
                                                                        List<? extends Column<R>> pivotColumns,
                                                                        AggregatorRegistry registry) {
        Map<Column<R>, List<Aggregator>> marked = new LinkedHashMap<>();
        for (Column<R> column : sourceColumns) {
            if (!column.aggregatorNames().isEmpty()) {
                marked.put(column, registry.lookupAll(column.aggregatorNames()));
            }
        }
        if (marked.isEmpty()) {
            for (Column<R> column : pivotColumns) {
                marked.put(column, List.of(registry.count()));
            }
        }
        return marked;
    }

    /**
     * @param pivotKey   a discovered pivot value
     * @param pivotCount the number of pivot columns
     * @return the pivot value's part of a generated column name
     */
    public static String valueName(PivotKey pivotKey, int pivotCount) {
        return pivotCount > 1 ? pivotKey.column() + "_" + pivotKey.display() : pivotKey.display();
    }

    public ColumnPlanner<R> withSinks(List<StatusSink> statusSinks) {
        this.sinks = List.copyOf(statusSinks);
        return this;
    }

    public ColumnPlanner<R> withCancellation(BooleanSupplier cancellation) {
        this.cancelled = Objects.requireNonNull(cancellation, "cancellation");
        return this;
    }

    /**
     * Plans the aggregate columns.
     *
     * @param rows the source snapshot, scanned once per pivot column
     * @param sink receives the columns in output order
     * @throws CancellationException if cancelled during the scan
     */
    public void plan(List<R> rows, ColumnSink<R> sink) {
        total = (long) rows.size() * pivotColumns.size();
        completed = 0;
        state = RunState.RUNNING;
        StatusEmitter<ColumnPlanner<R>> emitter = new StatusEmitter<>(this, sinks, options.progressInterval());
        emitter.started();
        try {
            if (aggregateColumns.isEmpty()) {
                logger.debug("no aggregated columns, pivot of {} has key columns only", sourceName);
            } else if (pivotColumns.isEmpty()) {
                planUnpivoted(sink);
            } else {
                for (Column<R> pivotColumn : pivotColumns) {
                    planPivoted(pivotColumn, rows, sink, emitter);
                }
            }
            state = RunState.SUCCESS;
        } catch (CancellationException e) {
            state = RunState.CANCELLED;
            throw e;
        } catch (RuntimeException e) {
            state = RunState.FAILED;
            throw e;
        } finally {
            emitter.finished(state);
        }
    }

    private void planUnpivoted(ColumnSink<R> sink) {
        aggregateColumns.forEach((column, aggregators) -> {
            for (Aggregator aggregator : aggregators) {
                sink.addColumn(AggregateColumn.of(column.name() + "_" + aggregator.getName(), column, aggregator, null));
            }
        });
    }

    private void planPivoted(Column<R> pivotColumn, List<R> rows, ColumnSink<R> sink, StatusEmitter<ColumnPlanner<R>> emitter) {
        StringBuilder pivotNames = new StringBuilder();
        for (Column<R> column : pivotColumns) {
            pivotNames.append(column.name());
        }
        String baseName = sourceName + "_pivot_" + pivotNames;

        Set<Object> seen = new HashSet<>();
        for (R row : rows) {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("pivot value discovery cancelled after " + completed + " of " + total);
            }
            completed++;
            emitter.advance(completed);

            PivotKey pivotKey = PivotKey.of(pivotColumn, row);
            if (!seen.add(pivotKey.value())) {
                continue;
            }
            String valueName = valueName(pivotKey, pivotColumns.size());

            for (Map.Entry<Column<R>, List<Aggregator>> entry : aggregateColumns.entrySet()) {
                Column<R> column = entry.getKey();
                List<Aggregator> aggregators = entry.getValue();
                for (Aggregator aggregator : aggregators) {
                    String aggregateName = aggregateColumns.size() > 1
                        ? column.name() + "_" + aggregator.getName()
                        : aggregator.getName();
                    String columnName;
                    if (aggregators.size() > 1 || aggregateColumns.size() > 1) {
                        columnName = aggregateName + "_" + valueName;
                        sink.offerName(baseName);
                    } else {
                        columnName = valueName;
                        sink.offerName(baseName + "_" + aggregateName);
                    }
                    sink.addColumn(AggregateColumn.of(columnName, column, aggregator, pivotKey));
                }
            }
        }
        logger.debug("discovered {} values of pivot column {}", seen.size(), pivotColumn.name());
    }

    @Override
    public StatusUpdate<ColumnPlanner<R>> getTaskStatus() {
        return new StatusUpdate<>(completed, total, state, this);
    }

    @Override
    public String getTaskName() {
        return "pivoting";
    }
}
