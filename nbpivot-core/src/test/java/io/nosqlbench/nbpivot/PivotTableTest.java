package io.nosqlbench.nbpivot;

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

import io.nosqlbench.nbpivot.config.PivotConfigurationException;
import io.nosqlbench.nbpivot.config.PivotOptions;
import io.nosqlbench.nbpivot.grouping.GroupRow;
import io.nosqlbench.nbpivot.plan.AggregateColumn;
import io.nosqlbench.nbpivot.plan.KeyColumn;
import io.nosqlbench.nbpivot.plan.OutputColumn;
import io.nosqlbench.nbpivot.plan.RangeColumn;
import io.nosqlbench.nbpivot.status.eventing.StatusSink;
import io.nosqlbench.nbpivot.status.eventing.StatusSource;
import io.nosqlbench.nbpivot.status.eventing.StatusUpdate;
import io.nosqlbench.nbpivot.table.Column;
import io.nosqlbench.nbpivot.table.ColumnType;
import io.nosqlbench.nbpivot.table.InMemoryTable;
import io.nosqlbench.nbpivot.table.MapColumn;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class PivotTableTest {

    private static InMemoryTable sales() {
        return InMemoryTable.builder("sales")
            .column("region", ColumnType.STRING)
            .column("product", ColumnType.STRING)
            .column("amount", ColumnType.INT)
            .row("east", "b", "1")
            .row("east", "a", "2")
            .row("west", "b", "3")
            .row("east", "b", "4")
            .row("west", "c", "5")
            .row("east", "b", "6")
            .row("west", "a", "7")
            .row("east", "c", "8")
            .row("west", "b", "9")
            .row("east", "a", "10")
            .build();
    }

    private static List<List<String>> render(PivotTable<Map<String, Object>> pivot) {
        List<List<String>> lines = new ArrayList<>();
        for (GroupRow<Map<String, Object>> row : pivot.rows()) {
            List<String> cells = new ArrayList<>();
            for (OutputColumn<Map<String, Object>> column : pivot.columns()) {
                cells.add(pivot.format(row, column));
            }
            lines.add(cells);
        }
        return lines;
    }

    private static List<String> columnNames(PivotTable<Map<String, Object>> pivot) {
        return pivot.columns().stream().map(OutputColumn::name).toList();
    }

    @Test
    void countsPivotValuesPerGroup() {
        InMemoryTable table = sales();
        PivotTable<Map<String, Object>> pivot = PivotTable.makePivot(table,
            List.of(table.column("region")), List.of(table.column("product")));
        pivot.loaded().join();

        assertThat(pivot.name()).isEqualTo("sales_pivot_product_count");
        assertThat(columnNames(pivot)).containsExactly("region", "b", "a", "c");
        assertThat(pivot.keyColumns()).hasSize(1).allSatisfy(c -> assertThat(c).isInstanceOf(KeyColumn.class));
        assertThat(render(pivot)).containsExactly(
            List.of("east", "3", "2", "1"),
            List.of("west", "2", "1", "1"));
        assertThat(pivot.isLoading()).isFalse();
        assertThat(pivot.errors().count()).isZero();
    }

    @Test
    void binsTheNumericGroupByColumn() {
        InMemoryTable table = InMemoryTable.builder("sales")
            .column("product", ColumnType.STRING)
            .column(new MapColumn("amount", ColumnType.INT).withWidth(4))
            .row("b", "1").row("a", "2").row("b", "3").row("b", "4").row("c", "5")
            .row("b", "6").row("a", "7").row("c", "8").row("b", "9").row("a", "10")
            .build();
        PivotTable<Map<String, Object>> pivot = PivotTable.builder(table)
            .groupBy(List.of(table.column("amount")))
            .pivot(List.of(table.column("product")))
            .build();
        pivot.load().join();

        assertThat(pivot.keyColumns()).singleElement().isInstanceOf(RangeColumn.class);
        assertThat(pivot.keyColumns().get(0).width()).isEqualTo(8);
        // ten rows: three bins of width 3, the maximum lands in the last bin
        assertThat(render(pivot)).containsExactly(
            List.of("1 - 4", "2", "1", "0"),
            List.of("4 - 7", "2", "0", "1"),
            List.of("7 - 10", "1", "2", "1"));
    }

    @Test
    void unpivotedAggregatesUseAllGroupRows() {
        InMemoryTable table = InMemoryTable.builder("sales")
            .column("region", ColumnType.STRING)
            .column(new MapColumn("amount", ColumnType.INT).withAggregators("sum", "max"))
            .row("east", "1").row("west", "2").row("east", "3")
            .build();
        PivotTable<Map<String, Object>> pivot = PivotTable.makePivot(table, List.of(table.column("region")), List.of());
        pivot.loaded().join();

        assertThat(pivot.name()).isEqualTo("sales_pivot");
        assertThat(columnNames(pivot)).containsExactly("region", "amount_sum", "amount_max");
        assertThat(render(pivot)).containsExactly(List.of("east", "4", "3"), List.of("west", "2", "2"));
    }

    @Test
    void twoBinnedColumnsAreRejectedBeforeLoading() {
        InMemoryTable table = sales();
        MapColumn second = new MapColumn("amount2", ColumnType.FLOAT);
        PivotTable<Map<String, Object>> pivot = PivotTable.builder(table)
            .groupBy(List.of(table.column("amount"), second))
            .build();

        assertThatThrownBy(pivot::load)
            .isInstanceOf(PivotConfigurationException.class)
            .hasMessageContaining("only one numeric column");
        assertThat(pivot.rows()).isEmpty();
        assertThat(pivot.columns()).isEmpty();
    }

    @Test
    void withoutBinningNumericColumnsAreDiscrete() {
        InMemoryTable table = InMemoryTable.builder("t")
            .column("a", ColumnType.INT).column("b", ColumnType.FLOAT)
            .row("1", "1.5").row("1", "1.5").row("2", "1.5")
            .build();
        PivotTable<Map<String, Object>> pivot = PivotTable.builder(table)
            .groupBy(List.of(table.column("a"), table.column("b")))
            .options(PivotOptions.DEFAULTS.withNumericBinning(false))
            .build();
        pivot.load().join();

        assertThat(pivot.rows()).extracting(GroupRow::size).containsExactly(2, 1);
        assertThat(render(pivot)).containsExactly(List.of("1", "1.50"), List.of("2", "1.50"));
    }

    @Test
    void failedValuesAreCountedInTheirOwnGroup() {
        InMemoryTable table = InMemoryTable.builder("readings")
            .column(new MapColumn("sensor", ColumnType.STRING).withAggregators("count"))
            .column("value", ColumnType.INT)
            .row("s1", "1").row("s2", "2").row("s3", "3").row("s4", "oops").row("s5", "oops").row("s6", null)
            .build();
        PivotTable<Map<String, Object>> pivot = PivotTable.makePivot(table, List.of(table.column("value")), List.of());
        pivot.loaded().join();

        assertThat(render(pivot)).containsExactly(
            List.of("1", "1"),
            List.of("2", "1"),
            List.of("3", "1"),
            List.of("#ERR", "2"),
            List.of("", "1"));
        assertThat(pivot.errors().count()).isEqualTo(2);
    }

    @Test
    void reloadingGivesTheSameTable() {
        InMemoryTable table = sales();
        PivotTable<Map<String, Object>> pivot = PivotTable.builder(table)
            .groupBy(List.of(table.column("region"), table.column("amount")))
            .pivot(List.of(table.column("product")))
            .build();

        pivot.load().join();
        List<List<String>> first = render(pivot);
        List<Object> firstKeys = pivot.rows().stream().map(r -> (Object) r.numericKey()).toList();
        pivot.load().join();

        assertThat(render(pivot)).isEqualTo(first);
        assertThat(pivot.rows().stream().map(r -> (Object) r.numericKey()).toList()).isEqualTo(firstKeys);
    }

    @Test
    void reloadingWhileLoadingKeepsOnlyTheLatestLoad() {
        InMemoryTable table = sales();
        Deque<Runnable> queued = new ArrayDeque<>();
        PivotTable<Map<String, Object>> pivot = PivotTable.builder(table)
            .groupBy(List.of(table.column("region")))
            .pivot(List.of(table.column("product")))
            .executor(queued::add)
            .build();

        CompletableFuture<Void> first = pivot.load();
        CompletableFuture<Void> second = pivot.load();
        assertThat(queued).hasSize(4);

        // the first load's planning and grouping tasks
        queued.poll().run();
        queued.poll().run();
        assertThat(first).isCompletedExceptionally();
        assertThat(pivot.isLoading()).isTrue();
        assertThat(pivot.rows()).isEmpty();
        assertThat(pivot.columns()).extracting(OutputColumn::name).containsExactly("region");

        while (!queued.isEmpty()) {
            queued.poll().run();
        }

        second.join();
        assertThat(pivot.isLoading()).isFalse();
        assertThat(pivot.rows()).hasSize(2);
        assertThat(columnNames(pivot)).containsExactly("region", "b", "a", "c");
        assertThat(render(pivot)).containsExactly(
            List.of("east", "3", "2", "1"),
            List.of("west", "2", "1", "1"));
    }

    @Test
    void aggregateCellsAreInProgressWhileGrouping() {
        InMemoryTable table = sales();
        AtomicReference<PivotTable<Map<String, Object>>> ref = new AtomicReference<>();
        List<String> seen = new ArrayList<>();
        PivotTable<Map<String, Object>> pivot = PivotTable.builder(table)
            .groupBy(List.of(table.column("region")))
            .pivot(List.of(table.column("product")))
            .executor(Runnable::run)
            .rowCallback(row -> {
                PivotTable<Map<String, Object>> p = ref.get();
                seen.add(p.isLoading() + " " + p.format(row, p.columns().get(1)));
            })
            .build();
        ref.set(pivot);

        CompletableFuture<Void> loaded = pivot.load();

        assertThat(loaded).isCompleted();
        assertThat(seen).hasSize(10).containsOnly("true ...");
        assertThat(pivot.format(pivot.rows().get(0), pivot.columns().get(1))).isEqualTo("3");
    }

    @Test
    void cancelKeepsWhatWasGrouped() {
        InMemoryTable table = sales();
        AtomicReference<PivotTable<Map<String, Object>>> ref = new AtomicReference<>();
        PivotTable<Map<String, Object>> pivot = PivotTable.builder(table)
            .groupBy(List.of(table.column("region")))
            .executor(Runnable::run)
            .rowCallback(row -> ref.get().cancel())
            .build();
        ref.set(pivot);

        CompletableFuture<Void> loaded = pivot.load();

        assertThat(loaded).isCompletedExceptionally();
        assertThatThrownBy(loaded::join).isInstanceOf(CompletionException.class);
        assertThat(pivot.rows()).hasSize(1);
        assertThat(pivot.isLoading()).isFalse();
    }

    @Test
    void opensRowsAndCells() {
        InMemoryTable table = sales();
        PivotTable<Map<String, Object>> pivot = PivotTable.makePivot(table,
            List.of(table.column("region")), List.of(table.column("product")));
        pivot.loaded().join();
        GroupRow<Map<String, Object>> east = pivot.rows().get(0);

        RowSubset<Map<String, Object>> all = pivot.openRow(east);
        RowSubset<Map<String, Object>> b = pivot.openCell(east, pivot.columns().get(1));

        assertThat(all.name()).isEqualTo("sales_east");
        assertThat(all.size()).isEqualTo(6);
        assertThat(b.name()).isEqualTo("sales_b");
        assertThat(b.rows()).hasSize(3).allSatisfy(row -> assertThat(row).containsEntry("product", "b"));
        assertThat(pivot.openCell(east, pivot.columns().get(0)).rows()).hasSize(6);
    }

    @Test
    void editingAKeyWritesThroughToTheSource() {
        InMemoryTable table = sales();
        PivotTable<Map<String, Object>> pivot = PivotTable.makePivot(table,
            List.of(table.column("region")), List.of(table.column("product")));
        pivot.loaded().join();
        GroupRow<Map<String, Object>> east = pivot.rows().get(0);

        pivot.setKey(east, pivot.columns().get(0), "north");

        assertThat(pivot.format(east, pivot.columns().get(0))).isEqualTo("north");
        assertThat(table.rows()).filteredOn(row -> "north".equals(row.get("region"))).hasSize(6);
        assertThat(table.rows()).filteredOn(row -> "east".equals(row.get("region"))).isEmpty();
        assertThatThrownBy(() -> pivot.setKey(east, pivot.columns().get(1), "x"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void addsAggregatesNextToAnExistingColumn() {
        InMemoryTable table = sales();
        PivotTable<Map<String, Object>> pivot = PivotTable.makePivot(table,
            List.of(table.column("region")), List.of(table.column("product")));
        pivot.loaded().join();
        OutputColumn<Map<String, Object>> b = pivot.columns().get(1);

        List<AggregateColumn<Map<String, Object>>> added = pivot.addAggregateColumns(b, List.of("distinct", "list"));

        assertThat(added).extracting(AggregateColumn::name).containsExactly("product_distinct_b", "product_list_b");
        assertThat(columnNames(pivot)).containsExactly("region", "b", "product_distinct_b", "product_list_b", "a", "c");
        assertThat(pivot.format(pivot.rows().get(0), added.get(0))).isEqualTo("1");
        assertThat(pivot.value(pivot.rows().get(0), added.get(1))).isEqualTo(List.of("b", "b", "b"));
        assertThatThrownBy(() -> pivot.addAggregateColumns(pivot.columns().get(0), List.of("sum")))
            .isInstanceOf(PivotConfigurationException.class)
            .hasMessage("not an aggregation column");
    }

    @Test
    void reportsProgressOfBothTasks() {
        InMemoryTable table = sales();
        List<String> finished = Collections.synchronizedList(new ArrayList<>());
        StatusSink sink = new StatusSink() {
            @Override
            public void taskStarted(StatusSource<?> task) {
            }

            @Override
            public void taskUpdate(StatusSource<?> task, StatusUpdate<?> status) {
            }

            @Override
            public void taskFinished(StatusSource<?> task, StatusUpdate<?> finalStatus) {
                finished.add(task.getTaskName() + " " + finalStatus.runstate.getLabel());
            }
        };
        PivotTable<Map<String, Object>> pivot = PivotTable.builder(table)
            .groupBy(List.of(table.column("region")))
            .pivot(List.of(table.column("product")))
            .sinks(List.of(sink))
            .build();

        pivot.load().join();

        assertThat(finished).containsExactlyInAnyOrder("pivoting done", "grouping done");
    }

    @Test
    void keyColumnsSkipPivotColumns() {
        InMemoryTable table = sales();
        List<Column<Map<String, Object>>> both = List.of(table.column("product"), table.column("region"));
        PivotTable<Map<String, Object>> pivot = PivotTable.builder(table)
            .groupBy(both)
            .pivot(List.of(table.column("product")))
            .build();
        pivot.load().join();

        assertThat(pivot.keyColumns()).extracting(OutputColumn::name).containsExactly("region");
        KeyColumn<Map<String, Object>> region = (KeyColumn<Map<String, Object>>) pivot.keyColumns().get(0);
        assertThat(region.keyIndex()).isEqualTo(1);
        assertThat(pivot.format(pivot.rows().get(0), region)).isEqualTo("east");
    }
}
