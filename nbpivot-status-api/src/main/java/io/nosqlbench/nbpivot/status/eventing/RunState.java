package io.nosqlbench.nbpivot.status.eventing;

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
 * Execution phase of a tracked load task.
 *
 * <p>Tasks move from {@link #PENDING} to {@link #RUNNING} and end in exactly one of the
 * terminal states {@link #SUCCESS}, {@link #FAILED} or {@link #CANCELLED}.
 */
public enum RunState {
    /**
     * Created, not yet started.
     */
    PENDING("pending"),

    /**
     * Actively scanning rows.
     */
    RUNNING("running"),

    /**
     * Completed every row.
     */
    SUCCESS("done"),

    /**
     * Stopped by an unexpected error. Progress reflects the rows handled before the failure.
     */
    FAILED("failed"),

    /**
     * Stopped on request. Anything produced before cancellation stays visible.
     */
    CANCELLED("cancelled");

    private final String label;

    RunState(String label) {
        this.label = label;
    }

    /**
     * @return a short lower case label for log and console output
     */
    public String getLabel() {
        return label;
    }

    /**
     * @return true for {@link #SUCCESS}, {@link #FAILED} and {@link #CANCELLED}
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == CANCELLED;
    }
}
