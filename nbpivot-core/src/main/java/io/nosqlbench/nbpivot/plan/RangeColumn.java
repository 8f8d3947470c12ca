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

/// The binned numeric group-by key, shown as a range.
///
/// @param name the column name, the same as the source column's
/// @param sourceColumn the binned column
/// @param width the display width, twice the source column's so both edges fit
public record RangeColumn<R>(String name, Column<R> sourceColumn, int width) implements OutputColumn<R> {

    public static <R> RangeColumn<R> of(Column<R> sourceColumn) {
        return new RangeColumn<>(sourceColumn.name(), sourceColumn, sourceColumn.width() * 2);
    }

    @Override
    public ColumnType type() {
        return ColumnType.ANY;
    }

    @Override
    public String formatString() {
        return null;
    }
}
