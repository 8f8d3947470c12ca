package io.nosqlbench.nbpivot.command;

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

import io.nosqlbench.nbpivot.aggregate.Aggregator;
import io.nosqlbench.nbpivot.aggregate.AggregatorRegistry;
import picocli.CommandLine;

import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/// List the aggregators that can be used with `pivot -a`
///
/// Each line shows a name and its result type. Names that expand to several aggregators, such
/// as the quantile groups, list what they expand to. Percentiles `p0` through `p100` are
/// available without being listed.
@CommandLine.Command(name = "aggregators",
    header = "List available aggregators",
    mixinStandardHelpOptions = true)
public class CMD_aggregators implements Callable<Integer> {

    private final AggregatorRegistry registry;

    public CMD_aggregators() {
        this(AggregatorRegistry.standard());
    }

    CMD_aggregators(AggregatorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        PrintStream out = System.out;
        int width = registry.names().stream().mapToInt(String::length).max().orElse(0);
        for (String name : registry.names()) {
            List<Aggregator> aggregators = registry.lookup(name);
            String description;
            if (aggregators.size() == 1 && aggregators.get(0).getName().equals(name)) {
                description = resultType(aggregators.get(0));
            } else {
                description = aggregators.stream()
                    .map(a -> a.getName() + " (" + resultType(a) + ")")
                    .collect(Collectors.joining(", "));
            }
            out.println(name + " ".repeat(width - name.length() + 2) + description);
        }
        out.println("p0 .. p100" + " ".repeat(Math.max(2, width - 8)) + "percentile (source type)");
        out.flush();
        return 0;
    }

    private static String resultType(Aggregator aggregator) {
        return aggregator.getResultType().map(t -> t.name().toLowerCase()).orElse("source type");
    }
}
