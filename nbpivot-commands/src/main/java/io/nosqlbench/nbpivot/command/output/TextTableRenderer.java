package io.nosqlbench.nbpivot.command.output;

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

import io.nosqlbench.nbpivot.PivotTable;
import io.nosqlbench.nbpivot.grouping.GroupRow;
import io.nosqlbench.nbpivot.grouping.PivotErrors;
import io.nosqlbench.nbpivot.plan.OutputColumn;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a loaded pivot table as left-aligned text columns, followed by a summary of the
 * failures captured while grouping.
 */
public final class TextTableRenderer {

    private static final String GAP = "  ";

    public <R> void render(PivotTable<R> pivot, PrintStream out) {
        List<OutputColumn<R>> columns = pivot.columns();
        List<GroupRow<R>> rows = pivot.rows();

        int[] widths = new int[columns.size()];
        List<String[]> cells = new ArrayList<>(rows.size());
        for (int c = 0; c < columns.size(); c++) {
            widths[c] = Math.max(columns.get(c).name().length(), columns.get(c).width());
        }
        for (GroupRow<R> row : rows) {
            String[] line = new String[columns.size()];
            for (int c = 0; c < columns.size(); c++) {
                line[c] = pivot.format(row, columns.get(c));
                widths[c] = Math.max(widths[c], line[c].length());
            }
            cells.add(line);
        }

        out.println(pivot.name());
        String[] header = new String[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            header[c] = columns.get(c).name();
        }
        out.println(line(header, widths));
        for (String[] line : cells) {
            out.println(line(line, widths));
        }

        PivotErrors errors = pivot.errors();
        if (!errors.isEmpty()) {
            out.println();
            out.println(errors.count() + " values could not be binned or keyed:");
            for (String summary : errors.summary()) {
                out.println(GAP + summary);
            }
        }
    }

    private static String line(String[] values, int[] widths) {
        StringBuilder sb = new StringBuilder();
        for (int c = 0; c < values.length; c++) {
            if (c > 0) {
                sb.append(GAP);
            }
            sb.append(values[c]);
            if (c < values.length - 1) {
                sb.append(" ".repeat(widths[c] - values[c].length()));
            }
        }
        return sb.toString();
    }
}
