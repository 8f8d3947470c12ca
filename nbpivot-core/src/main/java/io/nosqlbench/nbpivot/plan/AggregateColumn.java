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
import io.nosqlbench.nbpivot.grouping.PivotKey;
import io.nosqlbench.nbpivot.table.Column;
import io.nosqlbench.nbpivot.table.ColumnType;

import java.util.Objects;

/**
 * An aggregator applied to one source column over a group's rows, or over the group's rows
 * carrying one pivot value.
 *
 * @param name         the generated column name
 * @param sourceColumn the column the aggregator reads
 * @param aggregator   the reduction
 * @param pivotKey     the pivot value selecting rows, or null to use all of the group's rows
 * @param type         the aggregator's result type, or the source column's type
 * @param formatString the source column's format pattern when the type is inherited
 */
public record AggregateColumn<R>(String name, Column<R> sourceColumn, Aggregator aggregator, PivotKey pivotKey,
                                 ColumnType type, String formatString) implements OutputColumn<R> {

    public AggregateColumn {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(sourceColumn, "sourceColumn");
        Objects.requireNonNull(aggregator, "aggregator");
        Objects.requireNonNull(type, "type");
    }

    /**
     * Builds a column whose type and format follow the aggregator, or the source column when the
     * aggregator keeps the source type.
     */
    public static <R> AggregateColumn<R> of(String name, Column<R> sourceColumn, Aggregator aggregator, PivotKey pivotKey) {
        ColumnType type = aggregator.getResultType().orElse(sourceColumn.type());
        String format = aggregator.getResultType().isPresent() ? null : sourceColumn.formatString();
        return new AggregateColumn<>(name, sourceColumn, aggregator, pivotKey, type, format);
    }

    public boolean isPivoted() {
        return pivotKey != null;
    }

    @Override
    public int width() {
        return 0;
    }
}
