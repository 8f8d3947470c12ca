package io.nosqlbench.nbpivot.command.common;

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

import picocli.CommandLine;

import java.util.Arrays;
import java.util.List;

/**
 * A {@code column=value[,value...]} command line argument, used to assign types and aggregators
 * to input columns.
 *
 * @param column the column name
 * @param values the assigned values, never empty
 */
public record ColumnAssignment(String column, List<String> values) {

    public ColumnAssignment {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("column name cannot be empty");
        }
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("no values assigned to column '" + column + "'");
        }
        values = List.copyOf(values);
    }

    /**
     * Picocli type converter for {@code column=a,b} arguments.
     */
    public static class Converter implements CommandLine.ITypeConverter<ColumnAssignment> {

        @Override
        public ColumnAssignment convert(String value) {
            int eq = value == null ? -1 : value.indexOf('=');
            if (eq < 1 || eq == value.length() - 1) {
                throw new CommandLine.TypeConversionException(
                    "expected column=value[,value...], got '" + value + "'");
            }
            List<String> values = Arrays.stream(value.substring(eq + 1).split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
            if (values.isEmpty()) {
                throw new CommandLine.TypeConversionException("no values in '" + value + "'");
            }
            return new ColumnAssignment(value.substring(0, eq).trim(), values);
        }
    }
}
