package io.nosqlbench.nbpivot.grouping;

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

import io.nosqlbench.nbpivot.table.Column;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One output row of a pivot: the group key plus the source rows it summarizes.
 *
 * <p>A group row is appended to only by the grouping pass that created it. Getters return
 * snapshots so that readers on other threads see a consistent, if partial, view while the
 * pass is still running. Equality is identity: two groups with equal keys are still
 * distinct rows.
 *
 * @param <R> the source row type
 */
public final class GroupRow<R> {

    private final List<KeyCell> discreteKeys;
    private final NumericKey numericKey;
    private final List<R> sourceRows = new ArrayList<>();
    private final Map<PivotKey, List<R>> pivotRows = new LinkedHashMap<>();

    public GroupRow(List<KeyCell> discreteKeys, NumericKey numericKey) {
        this.discreteKeys = new ArrayList<>(Objects.requireNonNull(discreteKeys, "discreteKeys"));
        this.numericKey = Objects.requireNonNull(numericKey, "numericKey");
    }

    synchronized void add(R row) {
        sourceRows.add(row);
    }

    synchronized void addPivot(PivotKey key, R row) {
        pivotRows.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
    }

    public synchronized List<KeyCell> discreteKeys() {
        return List.copyOf(discreteKeys);
    }

    public synchronized KeyCell discreteKey(int index) {
        return discreteKeys.get(index);
    }

    /**
     * Replaces one discrete key in place. Group membership does not change.
     */
    public synchronized void replaceDiscreteKey(int index, KeyCell key) {
        discreteKeys.set(index, Objects.requireNonNull(key, "key"));
    }

    public NumericKey numericKey() {
        return numericKey;
    }

    public synchronized List<R> sourceRows() {
        return Collections.unmodifiableList(new ArrayList<>(sourceRows));
    }

    public synchronized int size() {
        return sourceRows.size();
    }

    /**
     * @return a snapshot of the rows of this group by pivot value, in first-seen order
     */
    public synchronized Map<PivotKey, List<R>> pivotRows() {
        Map<PivotKey, List<R>> copy = new LinkedHashMap<>();
        pivotRows.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }

    public synchronized List<R> pivotRows(PivotKey key) {
        List<R> rows = pivotRows.get(key);
        return rows == null ? List.of() : List.copyOf(rows);
    }

    /**
     * @param pivotColumn a pivot column of this grouping
     * @param value       a typed value of that column, or a {@link BinningError}
     * @return the rows of this group carrying that value, empty when there are none
     */
    public List<R> pivotRows(Column<R> pivotColumn, Object value) {
        return pivotRows(new PivotKey(pivotColumn.name(), value));
    }

    @Override
    public synchronized String toString() {
        return "GroupRow{" + discreteKeys + ", " + numericKey + ", " + sourceRows.size() + " rows}";
    }
}
