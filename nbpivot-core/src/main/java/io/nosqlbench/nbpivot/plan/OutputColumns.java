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

import io.nosqlbench.nbpivot.grouping.BinningError;
import io.nosqlbench.nbpivot.grouping.GroupRow;
import io.nosqlbench.nbpivot.grouping.KeyCell;
import io.nosqlbench.nbpivot.grouping.NumericKey;

import java.util.List;

/**
 * Reads and renders output column values.
 */
public final class OutputColumns {

    private OutputColumns() {
    }

    /**
     * @return for a key column the typed key or its {@link BinningError}; for a range column the
     * {@link NumericKey}; for an aggregate column the aggregated value
     */
    public static <R> Object evaluate(OutputColumn<R> column, GroupRow<R> row) {
        if (column instanceof KeyColumn<R> key) {
            KeyCell cell = row.discreteKey(key.keyIndex());
            if (cell instanceof KeyCell.Failed failed) {
                return failed.error();
            }
            return cell.typedValue();
        }
        if (column instanceof RangeColumn<R>) {
            return row.numericKey();
        }
        AggregateColumn<R> aggregate = (AggregateColumn<R>) column;
        return aggregate.aggregator().aggregate(aggregate.sourceColumn(), rowsFor(aggregate, row));
    }

    /**
     * @return the rows an aggregate column reduces for the given group
     */
    public static <R> List<R> rowsFor(AggregateColumn<R> column, GroupRow<R> row) {
        return column.isPivoted() ? row.pivotRows(column.pivotKey()) : row.sourceRows();
    }

    /**
     * @param value a value returned by {@link #evaluate}
     * @return the cell text
     */
    public static <R> String format(OutputColumn<R> column, Object value) {
        if (value instanceof BinningError error) {
            return error.display();
        }
        if (column instanceof RangeColumn<R> range) {
            return ((NumericKey) value).format(range.sourceColumn());
        }
        if (column instanceof KeyColumn<R> key) {
            return key.sourceColumn().format(value);
        }
        return column.type().format(value, column.formatString());
    }
}
