package io.nosqlbench.nbpivot.grouping;

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

import io.nosqlbench.nbpivot.binning.Bin;
import io.nosqlbench.nbpivot.binning.BinLookupException;
import io.nosqlbench.nbpivot.binning.NumericBins;
import io.nosqlbench.nbpivot.config.PivotOptions;
import io.nosqlbench.nbpivot.status.StatusEmitter;
import io.nosqlbench.nbpivot.status.eventing.RunState;
import io.nosqlbench.nbpivot.status.eventing.StatusSink;
import io.nosqlbench.nbpivot.status.eventing.StatusSource;
import io.nosqlbench.nbpivot.status.eventing.StatusUpdate;
import io.nosqlbench.nbpivot.table.Column;
import io.nosqlbench.nbpivot.table.ValueCoercionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Partitions source rows into {@link GroupRow}s in a single pass.
 *
 * <p>Rows are grouped by the formatted values of the discrete columns and, when a numeric
 * column is given, by the bin its value falls in. The first time a discrete key tuple is seen,
 * one group row per bin is created up front, in bin order, so empty bins still show up. Rows
 * whose numeric value is missing, fails coercion, or has no bin go to error groups that are
 * created when first needed, one per distinct {@link BinningError}.
 *
 * <p>Within each group, rows are further split by the value of every pivot column.
 *
 * <p>Per-value failures never stop the pass. They are recorded in the shared
 * {@link PivotErrors} and logged at debug level, with a single warning at the end.
 *
 * <pre>{@code
 * GroupingEngine<Row> engine = new GroupingEngine<>(List.of(region), amount, List.of(product),
 *     PivotOptions.DEFAULTS, errors);
 * List<GroupRow<Row>> rows = engine.group(source.rows(), r -> {});
 * }</pre>
 *
 * @param <R> the source row type
 */
public final class GroupingEngine<R> implements StatusSource<GroupingEngine<R>> {

    private static final Logger logger = LogManager.getLogger(GroupingEngine.class);

    private final List<Column<R>> discreteColumns;
    private final Column<R> numericColumn;
    private final List<Column<R>> pivotColumns;
    private final PivotOptions options;
    private final PivotErrors errors;

    private List<StatusSink> sinks = List.of();
    private BooleanSupplier cancelled = () -> false;
    private Consumer<GroupRow<R>> rowCallback;

    private volatile long completed;
    private volatile long total;
    private volatile RunState state = RunState.PENDING;
    private volatile NumericBins bins = NumericBins.compute(List.of(), 1, false);

    /**
     * @param discreteColumns group-by columns keyed by formatted value
     * @param numericColumn   the group-by column to bin, or null
     * @param pivotColumns    columns whose values split each group
     * @param options         bin count and progress settings
     * @param errors          where per-value failures are recorded
     */
    public GroupingEngine(List<Column<R>> discreteColumns, Column<R> numericColumn, List<Column<R>> pivotColumns,
                          PivotOptions options, PivotErrors errors) {
        this.discreteColumns = List.copyOf(discreteColumns);
        this.numericColumn = numericColumn;
        this.pivotColumns = List.copyOf(pivotColumns);
        this.options = Objects.requireNonNull(options, "options");
        this.errors = Objects.requireNonNull(errors, "errors");
    }

    public GroupingEngine<R> withSinks(List<StatusSink> statusSinks) {
        this.sinks = List.copyOf(statusSinks);
        return this;
    }

    /**
     * @param cancellation checked before each row; the pass stops when it returns true
     */
    public GroupingEngine<R> withCancellation(BooleanSupplier cancellation) {
        this.cancelled = Objects.requireNonNull(cancellation, "cancellation");
        return this;
    }

    /**
     * @param callback invoked with the group row each source row was placed in
     */
    public GroupingEngine<R> withRowCallback(Consumer<GroupRow<R>> callback) {
        this.rowCallback = callback;
        return this;
    }

    /**
     * Groups the rows.
     *
     * @param rows   the source snapshot
     * @param addRow receives each group row as it is created, in output order
     * @return all group rows created, in output order
     * @throws CancellationException if cancelled before the pass finished; rows created so far
     *                               have already been handed to {@code addRow}
     */
    public List<GroupRow<R>> group(List<R> rows, Consumer<GroupRow<R>> addRow) {
        total = rows.size();
        completed = 0;
        state = RunState.RUNNING;
        StatusEmitter<GroupingEngine<R>> emitter = new StatusEmitter<>(this, sinks, options.progressInterval());
        emitter.started();

        int failuresBefore = errors.count();
        List<GroupRow<R>> created = new ArrayList<>();
        Consumer<GroupRow<R>> register = groupRow -> {
            created.add(groupRow);
            addRow.accept(groupRow);
        };

        try {
            if (numericColumn != null) {
                bins = computeBins(rows);
                logger.debug("binned {} into {}", numericColumn.name(), bins);
            }
            Map<List<Object>, Group<R>> groups = new HashMap<>();
            for (R row : rows) {
                if (cancelled.getAsBoolean()) {
                    throw new CancellationException("grouping cancelled after " + completed + " of " + total + " rows");
                }
                List<KeyCell> keys = discreteKeys(row);
                List<Object> tuple = new ArrayList<>(keys.size());
                for (KeyCell key : keys) {
                    tuple.add(key.groupingKey());
                }

                Group<R> group = groups.get(tuple);
                if (group == null) {
                    group = new Group<>();
                    groups.put(tuple, group);
                    for (Bin bin : bins.bins()) {
                        GroupRow<R> binRow = new GroupRow<>(keys, NumericKey.Range.of(bin));
                        group.binned.add(binRow);
                        register.accept(binRow);
                    }
                }

                GroupRow<R> target = resolve(group, keys, row, register);
                target.add(row);
                Set<String> failedColumns = failedColumns(keys, target.numericKey());
                for (Column<R> pivotColumn : pivotColumns) {
                    PivotKey pivotKey = PivotKey.of(pivotColumn, row);
                    // a pivot column that is also a group-by key was already recorded for this row
                    if (pivotKey.isError() && !failedColumns.contains(pivotColumn.name())) {
                        errors.record((BinningError) pivotKey.value());
                    }
                    target.addPivot(pivotKey, row);
                }
                if (rowCallback != null) {
                    rowCallback.accept(target);
                }
                completed++;
                emitter.advance(completed);
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

        int failed = errors.count() - failuresBefore;
        if (failed > 0) {
            logger.warn("{} values could not be binned or keyed while grouping {} rows", failed, rows.size());
        }
        return created;
    }

    /**
     * @return the bins computed by the last pass, empty when no numeric column is binned
     */
    public NumericBins bins() {
        return bins;
    }

    @Override
    public StatusUpdate<GroupingEngine<R>> getTaskStatus() {
        return new StatusUpdate<>(completed, total, state, this);
    }

    @Override
    public String getTaskName() {
        return "grouping";
    }

    private NumericBins computeBins(List<R> rows) {
        List<Double> values = new ArrayList<>(rows.size());
        for (R row : rows) {
            try {
                Object typed = numericColumn.getTypedValue(row);
                if (typed != null) {
                    double value = numericColumn.type().toNumber(typed);
                    if (Double.isFinite(value)) {
                        values.add(value);
                    }
                }
            } catch (ValueCoercionException e) {
                // reported once per row by the grouping pass
            }
        }
        return NumericBins.compute(values, options.binCountFor(rows.size()), numericColumn.type().isIntegral());
    }

    private List<KeyCell> discreteKeys(R row) {
        List<KeyCell> keys = new ArrayList<>(discreteColumns.size());
        for (Column<R> column : discreteColumns) {
            keys.add(keyCell(column, row));
        }
        return keys;
    }

    private KeyCell keyCell(Column<R> column, R row) {
        Object typed;
        try {
            typed = column.getTypedValue(row);
        } catch (ValueCoercionException e) {
            BinningError error = BinningError.of(column.name(), BinningError.Kind.COERCION, e);
            capture(error, e);
            return new KeyCell.Failed(e.getRawValue(), error);
        }
        try {
            return new KeyCell.Value(typed, column.format(typed));
        } catch (RuntimeException e) {
            BinningError error = BinningError.of(column.name(), BinningError.Kind.FORMAT, e);
            capture(error, e);
            return new KeyCell.Failed(typed, error);
        }
    }

    private static Set<String> failedColumns(List<KeyCell> keys, NumericKey numericKey) {
        Set<String> failed = new HashSet<>();
        for (KeyCell key : keys) {
            if (key instanceof KeyCell.Failed cell) {
                failed.add(cell.error().column());
            }
        }
        if (numericKey instanceof NumericKey.Unbinned unbinned) {
            failed.add(unbinned.error().column());
        }
        return failed;
    }

    private GroupRow<R> resolve(Group<R> group, List<KeyCell> keys, R row, Consumer<GroupRow<R>> register) {
        if (numericColumn == null) {
            if (group.single == null) {
                group.single = new GroupRow<>(keys, NumericKey.NONE);
                register.accept(group.single);
            }
            return group.single;
        }

        String name = numericColumn.name();
        double value;
        try {
            Object typed = numericColumn.getTypedValue(row);
            if (typed == null) {
                return unbinned(group, keys, BinningError.missing(name), register);
            }
            value = numericColumn.type().toNumber(typed);
        } catch (ValueCoercionException e) {
            BinningError error = BinningError.of(name, BinningError.Kind.COERCION, e);
            capture(error, e);
            return unbinned(group, keys, error, register);
        }
        if (!Double.isFinite(value)) {
            BinningError error = new BinningError(name, BinningError.Kind.COERCION, "not a finite number: " + value);
            errors.record(error);
            return unbinned(group, keys, error, register);
        }

        try {
            return group.binned.get(bins.locate(value));
        } catch (BinLookupException e) {
            BinningError error = BinningError.of(name, BinningError.Kind.INTERNAL, e);
            capture(error, e);
            return unbinned(group, keys, error, register);
        }
    }

    private GroupRow<R> unbinned(Group<R> group, List<KeyCell> keys, BinningError error, Consumer<GroupRow<R>> register) {
        GroupRow<R> errorRow = group.unbinned.get(error);
        if (errorRow == null) {
            errorRow = new GroupRow<>(keys, new NumericKey.Unbinned(error));
            group.unbinned.put(error, errorRow);
            register.accept(errorRow);
        }
        return errorRow;
    }

    private void capture(BinningError error, Throwable cause) {
        logger.debug("grouping: {}", error, cause);
        errors.capture(error, cause);
    }

    /// The group rows of one discrete key tuple.
    private static final class Group<R> {
        private final List<GroupRow<R>> binned = new ArrayList<>();
        private final Map<BinningError, GroupRow<R>> unbinned = new LinkedHashMap<>();
        private GroupRow<R> single;
    }
}
