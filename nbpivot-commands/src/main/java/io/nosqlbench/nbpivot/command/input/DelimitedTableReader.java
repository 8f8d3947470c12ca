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
import io.nosqlbench.nbpivot.table.MapColumn;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/// Reads a delimited text file with a header line into an [InMemoryTable].
///
/// Fields may be double-quoted, in which case they may contain the delimiter, line breaks, and
/// quotes written as `""`. Cells are kept as the raw text, or null when empty, so coercion to the
/// column type happens when the pivot reads them.
///
/// Column types are inferred from the non-empty cells unless assigned:
/// - `INT` when every cell parses as a long
/// - `FLOAT` when every cell parses as a double
/// - `STRING` otherwise, or when a column has no non-empty cells
public final class DelimitedTableReader {

    private static final Logger logger = LogManager.getLogger(DelimitedTableReader.class);

    private final char delimiter;
    private final Map<String, ColumnType> types = new HashMap<>();
    private final Map<String, List<String>> aggregators = new HashMap<>();

    public DelimitedTableReader(char delimiter) {
        if (delimiter == '"' || delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("cannot use " + printable(delimiter) + " as a delimiter");
        }
        this.delimiter = delimiter;
    }

    /// @param path an input file
    /// @return tab for `.tsv` files, comma otherwise
    public static char defaultDelimiter(Path path) {
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase();
        return fileName.endsWith(".tsv") ? '\t' : ',';
    }

    /// Assigns a type to a column instead of inferring it.
    public DelimitedTableReader withType(String column, ColumnType type) {
        types.put(column, type);
        return this;
    }

    /// Marks a column for aggregation.
    public DelimitedTableReader withAggregators(String column, List<String> names) {
        aggregators.put(column, List.copyOf(names));
        return this;
    }

    /// @param path the file to read
    /// @return a table named after the file, without its extension
    /// @throws IOException if the file cannot be read, has no header, has a row with the wrong
    /// number of fields, or names an assigned column that does not exist
    public InMemoryTable read(Path path) throws IOException {
        String text = Files.readString(path, StandardCharsets.UTF_8);
        List<List<String>> records = parse(text, path);
        if (records.isEmpty()) {
            throw new IOException(path + ": no header line");
        }
        List<String> header = records.get(0);
        List<List<String>> body = records.subList(1, records.size());

        for (String assigned : types.keySet()) {
            requireColumn(header, assigned, path);
        }
        for (String assigned : aggregators.keySet()) {
            requireColumn(header, assigned, path);
        }

        InMemoryTable.Builder builder = InMemoryTable.builder(tableName(path));
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i);
            ColumnType type = types.containsKey(name) ? types.get(name) : inferType(body, i);
            MapColumn column = new MapColumn(name, type);
            if (aggregators.containsKey(name)) {
                column = column.withAggregators(aggregators.get(name).toArray(new String[0]));
            }
            builder.column(column);
        }
        for (List<String> fields : body) {
            Object[] values = new Object[fields.size()];
            for (int i = 0; i < values.length; i++) {
                String field = fields.get(i);
                values[i] = field.isEmpty() ? null : field;
            }
            builder.row(values);
        }
        InMemoryTable table = builder.build();
        logger.debug("read {} from {}", table, path);
        return table;
    }

    private List<List<String>> parse(String text, Path path) throws IOException {
        List<List<String>> records = new ArrayList<>();
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        boolean wasQuoted = false;
        int line = 1;
        int recordLine = 1;
        int width = -1;

        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    if (c == '\n') {
                        line++;
                    }
                    field.append(c);
                }
            } else if (c == '"' && field.length() == 0 && !wasQuoted) {
                quoted = true;
                wasQuoted = true;
            } else if (c == delimiter) {
                fields.add(field.toString());
                field.setLength(0);
                wasQuoted = false;
            } else if (c == '\n' || c == '\r') {
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                fields.add(field.toString());
                width = endRecord(records, fields, width, recordLine, path);
                fields = new ArrayList<>();
                field.setLength(0);
                wasQuoted = false;
                line++;
                recordLine = line;
            } else {
                field.append(c);
            }
            i++;
        }
        if (quoted) {
            throw new IOException(path + ":" + recordLine + ": unterminated quoted field");
        }
        if (field.length() > 0 || !fields.isEmpty() || wasQuoted) {
            fields.add(field.toString());
            endRecord(records, fields, width, recordLine, path);
        }
        return records;
    }

    private static int endRecord(List<List<String>> records, List<String> fields, int width, int line, Path path)
        throws IOException {
        if (fields.size() == 1 && fields.get(0).isEmpty()) {
            return width;
        }
        if (width >= 0 && fields.size() != width) {
            throw new IOException(path + ":" + line + ": expected " + width + " fields, got " + fields.size());
        }
        records.add(fields);
        return fields.size();
    }

    private static ColumnType inferType(List<List<String>> body, int column) {
        boolean seen = false;
        boolean allLong = true;
        boolean allDouble = true;
        for (List<String> fields : body) {
            String value = fields.get(column).trim();
            if (value.isEmpty()) {
                continue;
            }
            seen = true;
            if (allLong && !parsesAsLong(value)) {
                allLong = false;
            }
            if (allDouble && !parsesAsDouble(value)) {
                allDouble = false;
            }
            if (!allDouble) {
                break;
            }
        }
        if (!seen) {
            return ColumnType.STRING;
        }
        return allLong ? ColumnType.INT : allDouble ? ColumnType.FLOAT : ColumnType.STRING;
    }

    private static boolean parsesAsLong(String value) {
        try {
            Long.parseLong(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean parsesAsDouble(String value) {
        try {
            Double.parseDouble(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static void requireColumn(List<String> header, String column, Path path) throws IOException {
        if (!header.contains(column)) {
            throw new IOException(path + ": no column named '" + column + "', columns are " + header);
        }
    }

    private static String tableName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static String printable(char c) {
        return c == '\n' ? "\\n" : c == '\r' ? "\\r" : "'" + c + "'";
    }
}
