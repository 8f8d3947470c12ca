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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import io.nosqlbench.nbpivot.PivotTable;
import io.nosqlbench.nbpivot.grouping.GroupRow;
import io.nosqlbench.nbpivot.plan.OutputColumn;

import java.io.PrintStream;
import java.util.List;

/// Writes a loaded pivot table as one json document:
///
/// ```json
/// {"name": "sales_pivot_product", "columns": ["region", "a", "b"],
///  "rows": [{"region": "east", "a": 2, "b": 1}], "errors": []}
/// ```
///
/// Numeric and boolean cells keep their type, missing values are `null`, and all other cells
/// are written as their display text.
public final class JsonTableWriter {

    private static final Gson gson = new GsonBuilder()
        .setPrettyPrinting()
        .serializeNulls()
        .serializeSpecialFloatingPointValues()
        .create();

    public <R> void write(PivotTable<R> pivot, PrintStream out) {
        out.println(gson.toJson(toJson(pivot)));
    }

    <R> JsonObject toJson(PivotTable<R> pivot) {
        List<OutputColumn<R>> columns = pivot.columns();
        JsonObject document = new JsonObject();
        document.addProperty("name", pivot.name());

        JsonArray names = new JsonArray();
        for (OutputColumn<R> column : columns) {
            names.add(column.name());
        }
        document.add("columns", names);

        JsonArray rows = new JsonArray();
        for (GroupRow<R> row : pivot.rows()) {
            JsonObject json = new JsonObject();
            for (OutputColumn<R> column : columns) {
                json.add(column.name(), cell(pivot, row, column));
            }
            rows.add(json);
        }
        document.add("rows", rows);

        JsonArray errors = new JsonArray();
        for (String summary : pivot.errors().summary()) {
            errors.add(summary);
        }
        document.add("errors", errors);
        return document;
    }

    private static <R> JsonElement cell(PivotTable<R> pivot, GroupRow<R> row, OutputColumn<R> column) {
        Object value = pivot.value(row, column);
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof Number number) {
            return new JsonPrimitive(number);
        }
        if (value instanceof Boolean bool) {
            return new JsonPrimitive(bool);
        }
        return new JsonPrimitive(pivot.format(row, column));
    }
}
