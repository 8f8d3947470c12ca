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
import io.nosqlbench.nbpivot.table.ValueCoercionException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Value extraction and ordering shared by the aggregators.
 */
final class AggregateValues {

    /**
     * Orders numbers numerically, other comparables of the same class naturally, and anything
     * else by its string form.
     */
    static final Comparator<Object> ORDER = AggregateValues::compare;

    private AggregateValues() {
    }

    /**
     * @return the typed values of the column over the rows, skipping missing values and values
     * that cannot be coerced
     */
    static <R> List<Object> typedValues(Column<R> column, List<R> rows) {
        List<Object> values = new ArrayList<>(rows.size());
        for (R row : rows) {
            Object value;
            try {
                value = column.getTypedValue(row);
            } catch (ValueCoercionException e) {
                continue;
            }
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    /**
     * @return the numeric positions of the column's values over the rows, skipping values
     * without one
     */
    static <R> double[] numbers(Column<R> column, List<R> rows) {
        List<Object> values = typedValues(column, rows);
        double[] numbers = new double[values.size()];
        int count = 0;
        for (Object value : values) {
            if (value instanceof Number || value instanceof LocalDate) {
                numbers[count++] = column.type().toNumber(value);
            }
        }
        if (count == numbers.length) {
            return numbers;
        }
        double[] trimmed = new double[count];
        System.arraycopy(numbers, 0, trimmed, 0, count);
        return trimmed;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compare(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof Comparable && a.getClass() == b.getClass()) {
            return ((Comparable) a).compareTo(b);
        }
        return a.toString().compareTo(b.toString());
    }

    /**
     * Linear interpolation between the closest ranks.
     *
     * @param sorted  ascending values, not empty
     * @param percent the percentile in [0, 100]
     */
    static double percentile(double[] sorted, double percent) {
        double k = (sorted.length - 1) * (percent / 100.0d);
        int f = (int) Math.floor(k);
        int c = (int) Math.ceil(k);
        if (f == c) {
            return sorted[f];
        }
        return sorted[f] * (c - k) + sorted[c] * (k - f);
    }
}
