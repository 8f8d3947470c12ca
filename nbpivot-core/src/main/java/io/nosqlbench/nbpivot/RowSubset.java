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

import java.util.List;
import java.util.Objects;

/// A read-only named view of source rows, opened from a pivot row or cell.
///
/// @param name the view name, derived from the source name and the group or pivot value
/// @param rows the source rows
public record RowSubset<R>(String name, List<R> rows) {

    public RowSubset {
        Objects.requireNonNull(name, "name");
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }
}
