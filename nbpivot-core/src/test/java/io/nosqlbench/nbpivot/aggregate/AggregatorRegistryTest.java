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

import io.nosqlbench.nbpivot.config.PivotConfigurationException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class AggregatorRegistryTest {

    private final AggregatorRegistry registry = AggregatorRegistry.standard();

    @Test
    void resolvesNamesAndAliases() {
        assertThat(registry.lookup("sum")).containsExactly(StandardAggregator.SUM);
        assertThat(registry.lookup("mean")).containsExactly(StandardAggregator.AVG);
        assertThat(registry.count()).isEqualTo(StandardAggregator.COUNT);
        assertThat(registry.names()).contains("count", "distinct", "median", "q3", "q10");
    }

    @Test
    void quantileGroupsExpandToPercentiles() {
        assertThat(registry.lookup("q4")).extracting(Aggregator::getName).containsExactly("p25", "p50", "p75");
        assertThat(registry.lookup("q3")).extracting(Aggregator::getName).containsExactly("p33", "p67");
        assertThat(registry.lookup("q10")).hasSize(9);
    }

    @Test
    void percentilesResolveOnDemand() {
        assertThat(registry.lookup("p95")).containsExactly(new PercentileAggregator(95));
        assertThat(registry.lookupAll(List.of("count", "p5"))).extracting(Aggregator::getName)
            .containsExactly("count", "p5");
    }

    @Test
    void unknownNamesAreConfigurationErrors() {
        assertThatThrownBy(() -> registry.lookup("p101"))
            .isInstanceOf(PivotConfigurationException.class);
        assertThatThrownBy(() -> registry.lookup("total"))
            .isInstanceOf(PivotConfigurationException.class)
            .hasMessageContaining("no aggregator named 'total'");
    }

    @Test
    void customRegistries() {
        AggregatorRegistry custom = AggregatorRegistry.builder()
            .register(StandardAggregator.MAX)
            .group("range", List.of(StandardAggregator.MIN, StandardAggregator.MAX))
            .build();

        assertThat(custom.lookup("range")).hasSize(2);
        assertThat(custom.count()).isEqualTo(StandardAggregator.COUNT);
        assertThatThrownBy(() -> custom.lookup("sum")).isInstanceOf(PivotConfigurationException.class);
    }
}
