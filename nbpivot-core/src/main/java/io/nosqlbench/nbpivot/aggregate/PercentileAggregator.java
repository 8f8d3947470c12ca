package io.nosqlbench.nbpivot.aggregate;

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
import io.nosqlbench.nbpivot.table.ColumnType;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The value below which the given percentage of a group's numeric values fall, interpolated
 * linearly between ranks. Named {@code p<percent>}, e.g. {@code p95}.
 */
public final class PercentileAggregator implements Aggregator {

    private final int percent;

    public PercentileAggregator(int percent) {
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("percentile must be within [0, 100], got " + percent);
        }
        this.percent = percent;
    }

    public int getPercent() {
        return percent;
    }

    @Override
    public String getName() {
        return "p" + percent;
    }

    @Override
    public Optional<ColumnType> getResultType() {
        return Optional.empty();
    }

    @Override
    public <R> Object aggregate(Column<R> column, List<R> rows) {
        double[] numbers = AggregateValues.numbers(column, rows);
        if (numbers.length == 0) {
            return null;
        }
        Arrays.sort(numbers);
        return column.type().fromNumber(AggregateValues.percentile(numbers, percent));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PercentileAggregator && ((PercentileAggregator) o).percent == percent;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(percent);
    }

    @Override
    public String toString() {
        return getName();
    }
}
