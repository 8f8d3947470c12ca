package io.nosqlbench.nbpivot.aggregate;

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

import java.util.List;
import java.util.Optional;

/**
 * A named pure function reducing a list of rows, read through one column, to a single value.
 */
public interface Aggregator {

    String getName();

    /**
     * @return the type of the aggregated value, or empty when it has the source column's type
     */
    Optional<ColumnType> getResultType();

    /**
     * @param column the column the rows are read through
     * @param rows   the rows to reduce, possibly empty
     * @param <R>    the row type
     * @return the aggregate value, or null when it is undefined for the given rows
     */
    <R> Object aggregate(Column<R> column, List<R> rows);
}
