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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The failures captured while loading a pivot. Recording never throws, so a load keeps going
 * whatever the data looks like; callers read the report after the fact.
 *
 * <p>Every failure is kept, but only the first {@value #MAX_EXCEPTIONS} exceptions are; later
 * ones are counted in {@link #droppedExceptions()}.
 */
public final class PivotErrors {

    public static final int MAX_EXCEPTIONS = 100;

    private final List<BinningError> failures = new ArrayList<>();
    private final List<Throwable> exceptions = new ArrayList<>();
    private int droppedExceptions;

    public synchronized void record(BinningError error) {
        failures.add(error);
    }

    /**
     * Records a failure together with the exception that raised it.
     */
    public synchronized void capture(BinningError error, Throwable cause) {
        failures.add(error);
        if (exceptions.size() < MAX_EXCEPTIONS) {
            exceptions.add(cause);
        } else {
            droppedExceptions++;
        }
    }

    public synchronized List<BinningError> failures() {
        return List.copyOf(failures);
    }

    /**
     * @return the first {@value #MAX_EXCEPTIONS} captured exceptions
     */
    public synchronized List<Throwable> exceptions() {
        return List.copyOf(exceptions);
    }

    public synchronized int droppedExceptions() {
        return droppedExceptions;
    }

    public synchronized int count() {
        return failures.size();
    }

    public synchronized boolean isEmpty() {
        return failures.isEmpty();
    }

    public synchronized void clear() {
        failures.clear();
        exceptions.clear();
        droppedExceptions = 0;
    }

    /**
     * @return one line per distinct failure with the number of times it occurred
     */
    public synchronized List<String> summary() {
        Map<BinningError, Integer> counts = new LinkedHashMap<>();
        for (BinningError failure : failures) {
            counts.merge(failure, 1, Integer::sum);
        }
        List<String> lines = new ArrayList<>(counts.size());
        counts.forEach((error, n) -> lines.add(n + " x " + error));
        return lines;
    }
}
