package io.nosqlbench.nbpivot.command.input;

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

import io.nosqlbench.nbpivot.table.ColumnType;
import io.nosqlbench.nbpivot.table.InMemoryTable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class DelimitedTableReaderTest {

    @TempDir
    Path tempDir;

    private Path write(String fileName, String content) throws IOException {
        Path file = tempDir.resolve(fileName);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void readsQuotedFieldsAndInfersTypes() throws IOException {
        Path file = write("sales.csv",
            "region,note,qty,price,empty\r\n"
                + "east,\"a, b\",1,1.5,\r\n"
                + "\r\n"
                + "west,\"say \"\"hi\"\"\",2,2,\r\n"
                + "north,\"two\nlines\",,3.25,\r\n");

        InMemoryTable table = new DelimitedTableReader(',').read(file);

        assertThat(table.name()).isEqualTo("sales");
        assertThat(table.columns()).extracting(c -> c.name() + ":" + c.type())
            .containsExactly("region:STRING", "note:STRING", "qty:INT", "price:FLOAT", "empty:STRING");
        assertThat(table.rows()).hasSize(3);
        assertThat(table.rows().get(0)).containsEntry("note", "a, b").containsEntry("empty", null);
        assertThat(table.rows().get(1)).containsEntry("note", "say \"hi\"");
        assertThat(table.rows().get(2)).containsEntry("note", "two\nlines").containsEntry("qty", null);
    }

    @Test
    void tsvFilesDefaultToTabs() throws IOException {
        Path file = write("readings.tsv", "sensor\tvalue\ns1\t1,5\n");

        InMemoryTable table = new DelimitedTableReader(DelimitedTableReader.defaultDelimiter(file)).read(file);

        assertThat(DelimitedTableReader.defaultDelimiter(tempDir.resolve("x.csv"))).isEqualTo(',');
        assertThat(table.name()).isEqualTo("readings");
        assertThat(table.rows().get(0)).containsEntry("value", "1,5");
        assertThat(table.column("value").type()).isEqualTo(ColumnType.STRING);
    }

    @Test
    void assignedTypesAndAggregatorsOverrideInference() throws IOException {
        Path file = write("t.csv", "a,b\n1,x\n2,y\n");

        InMemoryTable table = new DelimitedTableReader(',')
            .withType("a", ColumnType.STRING)
            .withAggregators("b", List.of("count", "distinct"))
            .read(file);

        assertThat(table.column("a").type()).isEqualTo(ColumnType.STRING);
        assertThat(table.column("b").aggregatorNames()).containsExactly("count", "distinct");
        assertThat(table.column("a").aggregatorNames()).isEmpty();
    }

    @Test
    void rejectsMalformedInput() throws IOException {
        DelimitedTableReader reader = new DelimitedTableReader(',');

        assertThatThrownBy(() -> reader.read(write("ragged.csv", "a,b,c\n1,2\n")))
            .isInstanceOf(IOException.class)
            .hasMessageContaining(":2: expected 3 fields, got 2");
        assertThatThrownBy(() -> reader.read(write("open.csv", "a,b\n1,\"never closed\n")))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("unterminated quoted field");
        assertThatThrownBy(() -> reader.read(write("empty.csv", "")))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("no header line");
        assertThatThrownBy(() -> new DelimitedTableReader(',').withType("zzz", ColumnType.INT).read(write("ok.csv", "a\n1\n")))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("no column named 'zzz'");
        assertThatThrownBy(() -> new DelimitedTableReader('"'))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
