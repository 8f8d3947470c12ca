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
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The built-in aggregators.
 *
 * <p>All of them except {@link #COUNT} ignore missing values and values that fail coercion.
 */
public enum StandardAggregator implements Aggregator {

    /**
     * Number of rows, including rows whose value is missing.
     */
    COUNT("count", ColumnType.INT) {
        @Override
        <R> Object reduce(Column<R> column, List<R> rows) {
            return (long) rows.size();
        }
    },

    DISTINCT("distinct", ColumnType.INT) {
        @Override
        <R> Object reduce(Column<R> column, List<R> rows) {
            return (long) new HashSet<>(AggregateValues.typedValues(column, rows)).size();
        }
    },

    /**
     * Sum of the numeric values; whole for integral columns, 0 for no values.
     */
    SUM("sum", null) {
        @Override
        <R> Object reduce(Column<R> column, List<R> rows) {
            double[] numbers = AggregateValues.numbers(column, rows);
            if (column.type().isIntegral()) {
                long total = 0L;
                for (double n : numbers) {
                    total += (long) n;
                }
                return total;
            }
            double total = 0.0d;
            for (double n : numbers) {
                total += n;
            }
            return total;
        }
    },

    AVG("avg", ColumnType.FLOAT) {
        @Override
        <R> Object reduce(Column<R> column, List<R> rows) {
            double[] numbers = AggregateValues.numbers(column, rows);
            if (numbers.length == 0) {
                return null;
            }
            return Arrays.stream(numbers).sum() / numbers.length;
        }
    },

    MIN("min", null) {
        @Override
        <R> Object reduce(Column<R> column, List<R> rows) {
            List<Object> values = AggregateValues.typedValues(column, rows);
            return values.isEmpty() ? null : Collections.min(values, AggregateValues.ORDER);
        }
    },

    MAX("max", null) {
        @Override
        <R> Object reduce(Column<R> column, List<R> rows) {
            List<Object> values = AggregateValues.typedValues(column, rows);
            return values.isEmpty() ? null : Collections.max(values, AggregateValues.ORDER);
        }
    },

    MEDIAN("median", null) {
        @Override
        <R> Object reduce(Column<R> column, List<R> rows) {
            double[] numbers = AggregateValues.numbers(column, rows);
            if (numbers.length == 0) {
                return null;
            }
            Arrays.sort(numbers);
            return column.type().fromNumber(AggregateValues.percentile(numbers, 50.0d));
        }
    },

    /**
     * Most frequent value; the first one seen wins a tie.
     */
    MODE("mode", null) {
        @Override
        <R> Object reduce(Column<R> column, List<R> rows) {
            Map<Object, Integer> counts = new LinkedHashMap<>();
            for (Object value : AggregateValues.typedValues(column, rows)) {
                counts.merge(value, 1, Integer::sum);
            }
            Object mode = null;
            int best = 0;
            for (Map.Entry<Object, Integer> entry : counts.entrySet()) {
                if (entry.getValue() > best) {
                    best = entry.getValue();
                    mode = entry.getKey();
                }
            }
            return mode;
        }
    },

    /**
     * Sample standard deviation; undefined for fewer than two values.
     */
    STDEV("stdev", ColumnType.FLOAT) {
        @Override
        <R> Object reduce(Column<R> column, List<R> rows) {
            double[] numbers = AggregateValues.numbers(column, rows);
            if (numbers.length < 2) {
                return null;
            }
            double mean = Arrays.stream(numbers).sum() / numbers.length;
            double m2 = 0.0d;
            for (double n : numbers) {
                double diff = n - mean;
                m2 += diff * diff;
            }
            return Math.sqrt(m2 / (numbers.length - 1));
        }
    },

    LIST("list", ColumnType.ANY) {
        @Override
        <R> Object reduce(Column<R> column, List<R> rows) {
            return List.copyOf(AggregateValues.typedValues(column, rows));
        }
    };

    private final String label;
    private final ColumnType resultType;

    StandardAggregator(String label, ColumnType resultType) {
        this.label = label;
        this.resultType = resultType;
    }

    abstract <R> Object reduce(Column<R> column, List<R> rows);

    @Override
    public String getName() {
        return label;
    }

    @Override
    public Optional<ColumnType> getResultType() {
        return Optional.ofNullable(resultType);
    }

    @Override
    public <R> Object aggregate(Column<R> column, List<R> rows) {
        return reduce(column, rows);
    }
}
