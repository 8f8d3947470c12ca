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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An immutable table of aggregators by name.
 *
 * <p>A name resolves to one or more aggregators: {@code q4} for instance expands to
 * {@code p25, p50, p75}. Percentiles {@code p0} through {@code p100} resolve on demand without
 * being registered.
 *
 * <pre>{@code
 * AggregatorRegistry registry = AggregatorRegistry.standard();
 * List<Aggregator> aggs = registry.lookup("q4");
 * }</pre>
 */
public final class AggregatorRegistry {

    private static final Pattern PERCENTILE = Pattern.compile("p(\\d{1,3})");
    private static final AggregatorRegistry STANDARD = buildStandard();

    private final Map<String, List<Aggregator>> byName;

    private AggregatorRegistry(Map<String, List<Aggregator>> byName) {
        this.byName = Collections.unmodifiableMap(new LinkedHashMap<>(byName));
    }

    /**
     * @return the built-in aggregators plus the quantile groups q3, q4, q5 and q10
     */
    public static AggregatorRegistry standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static AggregatorRegistry buildStandard() {
        Builder builder = new Builder();
        for (StandardAggregator aggregator : StandardAggregator.values()) {
            builder.register(aggregator);
        }
        builder.alias("mean", StandardAggregator.AVG);
        for (int q : new int[]{3, 4, 5, 10}) {
            builder.quantiles(q);
        }
        return builder.build();
    }

    /**
     * @param name an aggregator or aggregator group name
     * @return the aggregators the name stands for, in order
     * @throws PivotConfigurationException if the name is unknown
     */
    public List<Aggregator> lookup(String name) {
        Objects.requireNonNull(name, "name");
        String key = name.trim();
        List<Aggregator> found = byName.get(key);
        if (found != null) {
            return found;
        }
        Matcher m = PERCENTILE.matcher(key);
        if (m.matches() && Integer.parseInt(m.group(1)) <= 100) {
            return List.of(new PercentileAggregator(Integer.parseInt(m.group(1))));
        }
        throw new PivotConfigurationException("no aggregator named '" + name + "', known: " + byName.keySet());
    }

    /**
     * Resolves several names and concatenates their aggregators in order.
     */
    public List<Aggregator> lookupAll(List<String> names) {
        List<Aggregator> all = new ArrayList<>();
        for (String name : names) {
            all.addAll(lookup(name));
        }
        return all;
    }

    /**
     * @return the aggregator used when pivot columns are given but nothing is marked for aggregation
     */
    public Aggregator count() {
        List<Aggregator> count = byName.get("count");
        if (count == null || count.size() != 1) {
            return StandardAggregator.COUNT;
        }
        return count.get(0);
    }

    public Set<String> names() {
        return byName.keySet();
    }

    /**
     * Collects named aggregators into an {@link AggregatorRegistry}.
     */
    public static final class Builder {
        private final Map<String, List<Aggregator>> byName = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(Aggregator aggregator) {
            byName.put(aggregator.getName(), List.of(aggregator));
            return this;
        }

        public Builder alias(String name, Aggregator aggregator) {
            byName.put(name, List.of(aggregator));
            return this;
        }

        public Builder group(String name, List<Aggregator> aggregators) {
            if (aggregators.isEmpty()) {
                throw new IllegalArgumentException("aggregator group '" + name + "' is empty");
            }
            byName.put(name, List.copyOf(aggregators));
            return this;
        }

        /**
         * Registers {@code q<n>}, the n-1 percentiles that split values into n equal parts.
         */
        public Builder quantiles(int n) {
            List<Aggregator> percentiles = new ArrayList<>(n - 1);
            for (int i = 1; i < n; i++) {
                percentiles.add(new PercentileAggregator((int) Math.round(100.0d * i / n)));
            }
            return group("q" + n, percentiles);
        }

        public AggregatorRegistry build() {
            return new AggregatorRegistry(byName);
        }
    }
}
