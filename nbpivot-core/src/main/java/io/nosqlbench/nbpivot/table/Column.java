package io.nosqlbench.nbpivot.table;

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

import java.util.Collection;
import java.util.List;

/**
 * A typed column of a {@link SourceTable}.
 *
 * <p>Implementations supply raw value access and the setter; coercion and formatting default
 * to the column's {@link ColumnType} but may be overridden.
 *
 * @param <R> the row type of the owning table
 */
public interface Column<R> {

    String name();

    ColumnType type();

    /**
     * @return the display width in characters, or 0 when unset
     */
    int width();

    /**
     * @return a {@link String#format} pattern for numeric values, or null
     */
    String formatString();

    /**
     * @return the raw value of this column in the given row
     */
    Object getValue(R row);

    /**
     * @return the value of this column in the given row, converted to {@link #type()}
     * @throws ValueCoercionException if the raw value cannot be converted
     */
    default Object getTypedValue(R row) {
        return type().coerce(getValue(row));
    }

    /**
     * @param typed a typed value of this column
     * @return the display text for the value
     */
    default String format(Object typed) {
        return type().format(typed, formatString());
    }

    void setValue(R row, Object value);

    default void setValues(Collection<R> rows, Object value) {
        for (R row : rows) {
            setValue(row, value);
        }
    }

    /**
     * Names of aggregators this column is marked for. An empty list means the column is not
     * aggregated.
     */
    default List<String> aggregatorNames() {
        return List.of();
    }
}
