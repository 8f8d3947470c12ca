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

/**
 * A value could not be placed in a bin computed from the same column's values. This indicates
 * an inconsistency between the range scan and the grouping pass, not bad input.
 */
public class BinLookupException extends RuntimeException {

    private final double value;

    public BinLookupException(double value, String message) {
        super(message);
        this.value = value;
    }

    public double getValue() {
        return value;
    }
}
