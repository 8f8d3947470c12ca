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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class ColumnTypeTest {

    @Test
    void coercesRawText() {
        assertThat(ColumnType.INT.coerce(" 42 ")).isEqualTo(42L);
        assertThat(ColumnType.FLOAT.coerce("2.5")).isEqualTo(2.5d);
        assertThat(ColumnType.DATE.coerce("2024-02-29")).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(ColumnType.STRING.coerce(7)).isEqualTo("7");
        assertThat(ColumnType.ANY.coerce(List.of(1))).isEqualTo(List.of(1));
    }

    @Test
    void blankNumericValuesAreMissing() {
        assertThat(ColumnType.INT.coerce("  ")).isNull();
        assertThat(ColumnType.FLOAT.coerce("")).isNull();
        assertThat(ColumnType.INT.coerce(null)).isNull();
        assertThat(ColumnType.STRING.coerce("")).isEqualTo("");
    }

    @Test
    void zeroIsAValue() {
        assertThat(ColumnType.INT.coerce("0")).isEqualTo(0L);
        assertThat(ColumnType.FLOAT.coerce(0)).isEqualTo(0.0d);
    }

    @Test
    void coercionFailuresCarryTheRawValue() {
        assertThatThrownBy(() -> ColumnType.INT.coerce("abc"))
            .isInstanceOf(ValueCoercionException.class)
            .hasMessageContaining("abc")
            .satisfies(e -> assertThat(((ValueCoercionException) e).getRawValue()).isEqualTo("abc"));
        assertThatThrownBy(() -> ColumnType.DATE.coerce("yesterday"))
            .isInstanceOf(ValueCoercionException.class);
        assertThatThrownBy(() -> ColumnType.LENGTH.coerce(12))
            .isInstanceOf(ValueCoercionException.class);
    }

    @Test
    void lengthMeasuresContainers() {
        assertThat(ColumnType.LENGTH.coerce("abcd")).isEqualTo(4L);
        assertThat(ColumnType.LENGTH.coerce(List.of(1, 2))).isEqualTo(2L);
        assertThat(ColumnType.LENGTH.coerce(Map.of("k", 1))).isEqualTo(1L);
        assertThat(ColumnType.LENGTH.coerce(new int[3])).isEqualTo(3L);
    }

    @Test
    void numberLineRoundTripsForDisplay() {
        assertThat(ColumnType.DATE.toNumber(LocalDate.of(1970, 1, 11))).isEqualTo(10.0d);
        assertThat(ColumnType.DATE.fromNumber(10.7d)).isEqualTo(LocalDate.of(1970, 1, 11));
        assertThat(ColumnType.INT.fromNumber(4.0d)).isEqualTo(4L);
        assertThat(ColumnType.INT.fromNumber(3.5d)).isEqualTo(3.5d);
        assertThat(ColumnType.FLOAT.fromNumber(4.0d)).isEqualTo(4.0d);
    }

    @Test
    void formatsValues() {
        assertThat(ColumnType.INT.format(12L, null)).isEqualTo("12");
        assertThat(ColumnType.FLOAT.format(1.0d / 3.0d, null)).isEqualTo("0.33");
        assertThat(ColumnType.FLOAT.format(2.5d, "%.3f")).isEqualTo("2.500");
        assertThat(ColumnType.INT.format(7L, "%.1f")).isEqualTo("7.0");
        assertThat(ColumnType.STRING.format(null, null)).isEmpty();
        assertThat(ColumnType.INT.isIntegral()).isTrue();
        assertThat(ColumnType.DATE.isNumeric()).isTrue();
        assertThat(ColumnType.STRING.isNumeric()).isFalse();
    }
}
