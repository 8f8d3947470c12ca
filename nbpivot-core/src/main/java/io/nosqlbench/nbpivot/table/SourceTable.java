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

import java.util.List;

/**
 * The table a pivot is computed from.
 *
 * @param <R> the row type
 */
public interface SourceTable<R> {

    String name();

    /**
     * @return the visible columns, in display order
     */
    List<Column<R>> columns();

    /**
     * Returns a snapshot of the rows. Later additions to the table are not reflected in the
     * returned list.
     */
    List<R> rows();

    /**
     * @return the number of rows, used as the total for progress reporting
     */
    default int rowCount() {
        return rows().size();
    }

    /**
     * @param name a column name
     * @return the visible column with that name
     * @throws IllegalArgumentException if there is no such column
     */
    default Column<R> column(String name) {
        for (Column<R> column : columns()) {
            if (column.name().equals(name)) {
                return column;
            }
        }
        throw new IllegalArgumentException("no column named '" + name + "' in " + name());
    }
}
