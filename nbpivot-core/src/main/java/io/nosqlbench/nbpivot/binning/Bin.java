package io.nosqlbench.nbpivot.binning;

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

/// A numeric interval of a binned group-by column.
///
/// Equal-width bins include their low edge and exclude their high edge, except the last bin
/// which also includes the column's maximum. A point bin has `low == high`.
///
/// @param low the lower edge
/// @param high the upper edge
public record Bin(double low, double high) {

    public Bin {
        if (high < low) {
            throw new IllegalArgumentException("bin high " + high + " is below low " + low);
        }
    }

    /// @return true when this bin holds exactly one value
    public boolean isPoint() {
        return low == high;
    }

    public double width() {
        return high - low;
    }
}
