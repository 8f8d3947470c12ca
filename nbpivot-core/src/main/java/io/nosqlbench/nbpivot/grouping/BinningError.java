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

import java.util.Objects;

/// The error variant of a grouping key: why a value could not be keyed or binned.
///
/// Equal errors share one error group, so every row failing the same way on the same column
/// is counted together.
///
/// @param column the name of the column the value came from
/// @param kind the failure category
/// @param message a description of the failure, usually the coercion message
public record BinningError(String column, Kind kind, String message) {

    /// Failure categories.
    public enum Kind {
        /// the value was null or blank
        MISSING,
        /// the value could not be converted to the column type
        COERCION,
        /// the typed value could not be rendered as text
        FORMAT,
        /// the value should have matched a precomputed bin but did not
        INTERNAL
    }

    public BinningError {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(kind, "kind");
        message = Objects.requireNonNullElse(message, "");
    }

    public static BinningError missing(String column) {
        return new BinningError(column, Kind.MISSING, "no value");
    }

    public static BinningError of(String column, Kind kind, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new BinningError(column, kind, message);
    }

    /// @return the cell text for this error: empty for a missing value, `#ERR` otherwise
    public String display() {
        return kind == Kind.MISSING ? "" : "#ERR";
    }

    @Override
    public String toString() {
        return column + ": " + kind.name().toLowerCase() + " (" + message + ")";
    }
}
