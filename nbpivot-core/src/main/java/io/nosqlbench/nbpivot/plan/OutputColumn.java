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

import io.nosqlbench.nbpivot.table.Column;
import io.nosqlbench.nbpivot.table.ColumnType;

/**
 * A column of a pivot table. Each variant names what it reads from a
 * {@link io.nosqlbench.nbpivot.grouping.GroupRow}; {@link OutputColumns#evaluate} does the reading.
 *
 * @param <R> the source row type
 */
public sealed interface OutputColumn<R> permits KeyColumn, RangeColumn, AggregateColumn {

    String name();

    /**
     * @return the source column this column is derived from
     */
    Column<R> sourceColumn();

    ColumnType type();

    int width();

    String formatString();
}
