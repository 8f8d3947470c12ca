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

import io.nosqlbench.nbpivot.table.Column;
import io.nosqlbench.nbpivot.table.ValueCoercionException;

/// A pivot column's value in one source row, as used to key pivot row lists and generated
/// columns.
///
/// The value is the column's typed value, which may be null, or the [BinningError] raised while
/// reading it, so that rows failing coercion still land in a pivot list of their own.
///
/// @param column the pivot column name
/// @param value the typed value or error
public record PivotKey(String column, Object value) {

    /// Read the pivot key of a row.
    /// @param column the pivot column
    /// @param row the source row
    /// @param <R> the row type
    /// @return the row's key for that column
    public static <R> PivotKey of(Column<R> column, R row) {
        try {
            return new PivotKey(column.name(), column.getTypedValue(row));
        } catch (ValueCoercionException e) {
            return new PivotKey(column.name(), BinningError.of(column.name(), BinningError.Kind.COERCION, e));
        }
    }

    public boolean isError() {
        return value instanceof BinningError;
    }

    /// @return the text naming this value in generated column names
    public String display() {
        if (value instanceof BinningError error) {
            return error.kind() == BinningError.Kind.MISSING ? "" : "#ERR";
        }
        return String.valueOf(value);
    }
}
