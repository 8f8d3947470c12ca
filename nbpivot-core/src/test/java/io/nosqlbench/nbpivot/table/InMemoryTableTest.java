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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class InMemoryTableTest {

    @Test
    void rowsAreSnapshots() {
        InMemoryTable table = InMemoryTable.builder("t")
            .column("a", ColumnType.STRING)
            .column(new MapColumn("b", ColumnType.INT).withAggregators("sum"))
            .row("x", 1)
            .build();

        List<Map<String, Object>> before = table.rows();
        table.addRow("y");

        assertThat(before).hasSize(1);
        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.rows().get(1)).containsEntry("a", "y").containsEntry("b", null);
        assertThat(table.column("b").aggregatorNames()).containsExactly("sum");
    }

    @Test
    void rejectsUnknownAndDuplicateColumns() {
        InMemoryTable table = InMemoryTable.builder("t").column("a", ColumnType.STRING).build();

        assertThatThrownBy(() -> table.column("nope")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> InMemoryTable.builder("t").column("a", ColumnType.STRING).column("a", ColumnType.INT))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("duplicate");
        assertThatThrownBy(() -> table.addRow("1", "2")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void columnsReadAndWriteRowMaps() {
        InMemoryTable table = InMemoryTable.builder("t").column("n", ColumnType.INT).row("5").row("6").build();
        Column<Map<String, Object>> n = table.column("n");

        assertThat(n.getTypedValue(table.rows().get(0))).isEqualTo(5L);
        n.setValues(table.rows(), 9L);
        assertThat(table.rows()).allSatisfy(row -> assertThat(row).containsEntry("n", 9L));
    }
}
