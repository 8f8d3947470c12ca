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

/**
 * One discrete group key of a {@link GroupRow}: either a typed value with its formatted text,
 * or the error that prevented keying it.
 *
 * <p>Rows are grouped by {@link #groupingKey()}, which is the formatted text for values and
 * the {@link BinningError} itself for failures.
 */
public sealed interface KeyCell permits KeyCell.Value, KeyCell.Failed {

    /**
     * @return the object rows are grouped by
     */
    Object groupingKey();

    /**
     * @return the typed value, or the raw value for a failed cell when there is one
     */
    Object typedValue();

    String display();

    record Value(Object typed, String formatted) implements KeyCell {
        public Value {
            Objects.requireNonNull(formatted, "formatted");
        }

        @Override
        public Object groupingKey() {
            return formatted;
        }

        @Override
        public Object typedValue() {
            return typed;
        }

        @Override
        public String display() {
            return formatted;
        }
    }

    /**
     * @param raw   the value that failed, or null when no value could be read at all
     * @param error the failure
     */
    record Failed(Object raw, BinningError error) implements KeyCell {
        public Failed {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public Object groupingKey() {
            return error;
        }

        @Override
        public Object typedValue() {
            return raw;
        }

        @Override
        public String display() {
            return error.display();
        }
    }
}
