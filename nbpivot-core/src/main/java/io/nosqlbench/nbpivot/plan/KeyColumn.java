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

/// A discrete group-by key.
///
/// @param name the column name, the same as the source column's
/// @param sourceColumn the group-by column
/// @param keyIndex the position of this key among the group row's discrete keys
/// @param type the display type
/// @param width the display width
/// @param formatString the numeric format pattern, or null
public record KeyColumn<R>(String name, Column<R> sourceColumn, int keyIndex, ColumnType type, int width,
                           String formatString) implements OutputColumn<R> {

    public static <R> KeyColumn<R> of(Column<R> sourceColumn, int keyIndex) {
        return new KeyColumn<>(sourceColumn.name(), sourceColumn, keyIndex, sourceColumn.type(),
            sourceColumn.width(), sourceColumn.formatString());
    }
}
