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

import io.nosqlbench.nbpivot.binning.Bin;
import io.nosqlbench.nbpivot.table.Column;

import java.util.Objects;

/**
 * The position of a {@link GroupRow} along the binned numeric group-by column.
 */
public sealed interface NumericKey permits NumericKey.Range, NumericKey.Unbinned {

    /**
     * The key shared by all rows of a group when no numeric column is binned.
     */
    Range NONE = new Range(0.0d, 0.0d);

    /**
     * @param column the binned source column
     * @return the cell text: {@code low - high}, a single value for a point range, or the
     * error's display text
     */
    String format(Column<?> column);

    /// A bin of the numeric column.
    /// @param low the lower edge
    /// @param high the upper edge
    record Range(double low, double high) implements NumericKey {

        public static Range of(Bin bin) {
            return new Range(bin.low(), bin.high());
        }

        public boolean isPoint() {
            return low == high;
        }

        @Override
        public String format(Column<?> column) {
            String lowText = column.format(column.type().fromNumber(low));
            if (isPoint()) {
                return lowText;
            }
            return lowText + " - " + column.format(column.type().fromNumber(high));
        }
    }

    /// Rows whose numeric value could not be binned.
    /// @param error why the value could not be binned
    record Unbinned(BinningError error) implements NumericKey {
        public Unbinned {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public String format(Column<?> column) {
            return error.display();
        }
    }
}
