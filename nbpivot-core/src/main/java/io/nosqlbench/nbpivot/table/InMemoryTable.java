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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A table held entirely in memory, with rows as mutable maps keyed by column name.
 *
 * <pre>{@code
 * InMemoryTable sales = InMemoryTable.builder("sales")
 *     .column("region", ColumnType.STRING)
 *     .column(new MapColumn("amount", ColumnType.INT).withAggregators("sum"))
 *     .row("east", 10)
 *     .row("west", 7)
 *     .build();
 * }</pre>
 *
 * <p>Row appends are synchronized so a table can be filled while snapshots are taken, but
 * cell updates through {@link Column#setValue} are not.
 */
public final class InMemoryTable implements SourceTable<Map<String, Object>> {

    private final String name;
    private final List<Column<Map<String, Object>>> columns;
    private final List<Map<String, Object>> rows;

    private InMemoryTable(String name, List<Column<Map<String, Object>>> columns, List<Map<String, Object>> rows) {
        this.name = name;
        this.columns = List.copyOf(columns);
        this.rows = new ArrayList<>(rows);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<Column<Map<String, Object>>> columns() {
        return columns;
    }

    @Override
    public synchronized List<Map<String, Object>> rows() {
        return Collections.unmodifiableList(new ArrayList<>(rows));
    }

    @Override
    public synchronized int rowCount() {
        return rows.size();
    }

    /**
     * Appends a row given as values in column order.
     *
     * @return the new row
     */
    public synchronized Map<String, Object> addRow(Object... values) {
        Map<String, Object> row = toRow(columns, values);
        rows.add(row);
        return row;
    }

    private static Map<String, Object> toRow(List<Column<Map<String, Object>>> columns, Object[] values) {
        if (values.length > columns.size()) {
            throw new IllegalArgumentException("row has " + values.length + " values but table has "
                + columns.size() + " columns");
        }
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            row.put(columns.get(i).name(), i < values.length ? values[i] : null);
        }
        return row;
    }

    @Override
    public String toString() {
        return "InMemoryTable{" + name + ", " + columns.size() + " columns, " + rowCount() + " rows}";
    }

    /**
     * Collects columns and rows for an {@link InMemoryTable}.
     */
    public static final class Builder {
        private final String name;
        private final List<Column<Map<String, Object>>> columns = new ArrayList<>();
        private final List<Object[]> pending = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder column(String columnName, ColumnType type) {
            return column(new MapColumn(columnName, type));
        }

        public Builder column(Column<Map<String, Object>> column) {
            for (Column<Map<String, Object>> existing : columns) {
                if (existing.name().equals(column.name())) {
                    throw new IllegalArgumentException("duplicate column name '" + column.name() + "'");
                }
            }
            columns.add(column);
            return this;
        }

        /**
         * Adds a row given as values in column order. Missing trailing values are null.
         */
        public Builder row(Object... values) {
            pending.add(values.clone());
            return this;
        }

        public InMemoryTable build() {
            List<Map<String, Object>> rows = new ArrayList<>(pending.size());
            for (Object[] values : pending) {
                rows.add(toRow(columns, values));
            }
            return new InMemoryTable(name, columns, rows);
        }
    }
}
