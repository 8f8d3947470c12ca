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
import java.util.Map;
import java.util.Objects;

/// A column over rows held as maps from column name to raw value.
///
/// @param name the column name, also the key into each row map
/// @param type the column type
/// @param width display width, 0 when unset
/// @param formatString optional numeric format pattern
/// @param aggregatorNames aggregators this column is marked for
public record MapColumn(String name, ColumnType type, int width, String formatString,
                        List<String> aggregatorNames) implements Column<Map<String, Object>> {

    public MapColumn {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        aggregatorNames = List.copyOf(Objects.requireNonNullElse(aggregatorNames, List.of()));
    }

    public MapColumn(String name, ColumnType type) {
        this(name, type, 0, null, List.of());
    }

    /// @return a copy of this column marked for the given aggregators
    public MapColumn withAggregators(String... aggregators) {
        return new MapColumn(name, type, width, formatString, List.of(aggregators));
    }

    /// @return a copy of this column with a different numeric format
    public MapColumn withFormat(String format) {
        return new MapColumn(name, type, width, format, aggregatorNames);
    }

    /// @return a copy of this column with a different display width
    public MapColumn withWidth(int displayWidth) {
        return new MapColumn(name, type, displayWidth, formatString, aggregatorNames);
    }

    @Override
    public Object getValue(Map<String, Object> row) {
        return row.get(name);
    }

    @Override
    public void setValue(Map<String, Object> row, Object value) {
        row.put(name, value);
    }
}
