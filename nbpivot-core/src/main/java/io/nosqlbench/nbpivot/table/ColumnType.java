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

import java.lang.reflect.Array;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.IllegalFormatException;
import java.util.Locale;
import java.util.Map;

/**
 * Type tags for source columns.
 *
 * <p>Each type knows how to coerce raw cell values, how to map typed values onto the number
 * line for binning, and how to render typed values as text.
 *
 * <ul>
 *   <li><b>ANY</b> - values pass through unchanged</li>
 *   <li><b>STRING</b> - values are rendered with {@link Object#toString()}</li>
 *   <li><b>INT</b> - whole numbers held as {@link Long}</li>
 *   <li><b>FLOAT</b> - real numbers held as {@link Double}</li>
 *   <li><b>DATE</b> - ISO-8601 calendar dates held as {@link LocalDate}, binned by epoch day</li>
 *   <li><b>LENGTH</b> - the size of a string, collection, map or array, held as {@link Long}</li>
 * </ul>
 */
public enum ColumnType {
    ANY(false, false),
    STRING(false, false),
    INT(true, true),
    FLOAT(true, false),
    DATE(true, false),
    LENGTH(true, true);

    private final boolean numeric;
    private final boolean integral;

    ColumnType(boolean numeric, boolean integral) {
        this.numeric = numeric;
        this.integral = integral;
    }

    /**
     * @return true if values of this type can be placed on the number line and binned
     */
    public boolean isNumeric() {
        return numeric;
    }

    /**
     * @return true if this type only holds whole numbers
     */
    public boolean isIntegral() {
        return integral;
    }

    /**
     * Converts a raw cell value to this type.
     *
     * <p>{@code null} stays {@code null}. For the numeric types a blank string is also treated
     * as a missing value and yields {@code null}.
     *
     * @param raw the raw value
     * @return the typed value, or null when the value is missing
     * @throws ValueCoercionException if the value cannot be represented in this type
     */
    public Object coerce(Object raw) {
        if (raw == null) {
            return null;
        }
        switch (this) {
            case ANY:
                return raw;
            case STRING:
                return raw.toString();
            case INT:
                return toLong(raw);
            case FLOAT:
                return toDouble(raw);
            case DATE:
                return toDate(raw);
            case LENGTH:
                return toLength(raw);
            default:
                throw new IllegalStateException("unhandled column type " + this);
        }
    }

    /**
     * Maps a typed value of this type onto the number line.
     *
     * @param typed a value previously returned by {@link #coerce(Object)}
     * @return the numeric position of the value
     * @throws ValueCoercionException if the value has no numeric position
     */
    public double toNumber(Object typed) {
        if (typed instanceof Number) {
            return ((Number) typed).doubleValue();
        }
        if (typed instanceof LocalDate) {
            return ((LocalDate) typed).toEpochDay();
        }
        throw new ValueCoercionException(this, typed, "not a numeric value: '" + typed + "'");
    }

    /**
     * Maps a position on the number line back to a value of this type, for rendering bin edges.
     *
     * @param value a position, such as a bin edge
     * @return a typed value for display
     */
    public Object fromNumber(double value) {
        switch (this) {
            case INT:
            case LENGTH:
                if (value == Math.rint(value) && !Double.isInfinite(value)) {
                    return (long) value;
                }
                return value;
            case DATE:
                return LocalDate.ofEpochDay((long) Math.floor(value));
            default:
                return value;
        }
    }

    /**
     * Renders a typed value as text.
     *
     * @param typed        the value, may be null
     * @param formatString an optional {@link String#format} pattern for numeric values
     * @return the rendered value, or an empty string for null
     */
    public String format(Object typed, String formatString) {
        if (typed == null) {
            return "";
        }
        if (typed instanceof Number) {
            return formatNumber((Number) typed, formatString);
        }
        return typed.toString();
    }

    private String formatNumber(Number number, String formatString) {
        boolean whole = number instanceof Long || number instanceof Integer
            || number instanceof Short || number instanceof Byte;
        if (formatString != null && !formatString.isBlank()) {
            try {
                return String.format(Locale.ROOT, formatString, number);
            } catch (IllegalFormatException e) {
                // %d cannot render a fractional value, %f cannot render a long
                if (whole) {
                    try {
                        return String.format(Locale.ROOT, formatString, number.doubleValue());
                    } catch (IllegalFormatException ignored) {
                        return number.toString();
                    }
                }
            }
        }
        if (whole) {
            return number.toString();
        }
        return String.format(Locale.ROOT, "%.2f", number.doubleValue());
    }

    private Long toLong(Object raw) {
        if (raw instanceof Long) {
            return (Long) raw;
        }
        if (raw instanceof Number) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new ValueCoercionException(this, raw, "invalid literal for int: '" + raw + "'");
            }
            return ((Number) raw).longValue();
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new ValueCoercionException(this, raw, "invalid literal for int: '" + text + "'", e);
        }
    }

    private Double toDouble(Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new ValueCoercionException(this, raw, "could not convert string to float: '" + text + "'", e);
        }
    }

    private LocalDate toDate(Object raw) {
        if (raw instanceof LocalDate) {
            return (LocalDate) raw;
        }
        if (raw instanceof Number) {
            return LocalDate.ofEpochDay(((Number) raw).longValue());
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new ValueCoercionException(this, raw, "not an ISO date: '" + text + "'", e);
        }
    }

    private Long toLength(Object raw) {
        if (raw instanceof CharSequence) {
            return (long) ((CharSequence) raw).length();
        }
        if (raw instanceof Collection) {
            return (long) ((Collection<?>) raw).size();
        }
        if (raw instanceof Map) {
            return (long) ((Map<?, ?>) raw).size();
        }
        if (raw.getClass().isArray()) {
            return (long) Array.getLength(raw);
        }
        throw new ValueCoercionException(this, raw, "object of type " + raw.getClass().getSimpleName() + " has no len()");
    }
}
