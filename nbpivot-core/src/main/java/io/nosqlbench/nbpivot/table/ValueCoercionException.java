package io.nosqlbench.nbpivot.table;

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
 * Thrown when a raw cell value cannot be converted to its column's {@link ColumnType}.
 */
public class ValueCoercionException extends RuntimeException {

    private final ColumnType type;
    private final transient Object rawValue;

    public ValueCoercionException(ColumnType type, Object rawValue, String message) {
        this(type, rawValue, message, null);
    }

    public ValueCoercionException(ColumnType type, Object rawValue, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.rawValue = rawValue;
    }

    public ColumnType getType() {
        return type;
    }

    public Object getRawValue() {
        return rawValue;
    }
}
