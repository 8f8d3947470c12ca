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

import java.util.Locale;

/**
 * Immutable snapshot of a task's progress at one point in time.
 *
 * <p>Progress is the ratio of {@code completed} to {@code total} work units, kept
 * within {@code [0.0, 1.0]}. A task that does not know its total reports {@code total == 0}
 * and a progress of {@code 0.0} until it finishes.
 *
 * <pre>{@code
 * public StatusUpdate<GroupingPass> getTaskStatus() {
 *     return new StatusUpdate<>(rowsSeen, rowCount, state, this);
 * }
 * }</pre>
 *
 * @param <T> the type of task being reported on
 */
public final class StatusUpdate<T> {
    public final long completed;
    public final long total;
    public final double progress;
    public final RunState runstate;
    public final long timestamp;
    public final T tracked;

    /**
     * Creates an update with no tracked object reference.
     *
     * @param completed work units done so far
     * @param total     expected work units, or 0 when unknown
     * @param runstate  the current execution state
     */
    public StatusUpdate(long completed, long total, RunState runstate) {
        this(completed, total, runstate, null);
    }

    /**
     * Creates an update stamped with the current time.
     *
     * @param completed work units done so far
     * @param total     expected work units, or 0 when unknown
     * @param runstate  the current execution state
     * @param tracked   the reporting task (may be null)
     */
    public StatusUpdate(long completed, long total, RunState runstate, T tracked) {
        this.completed = Math.max(0L, completed);
        this.total = Math.max(0L, total);
        this.runstate = runstate;
        this.timestamp = System.currentTimeMillis();
        this.tracked = tracked;
        this.progress = computeProgress(this.completed, this.total, runstate);
    }

    private static double computeProgress(long completed, long total, RunState runstate) {
        if (runstate == RunState.SUCCESS) {
            return 1.0d;
        }
        if (total == 0L) {
            return 0.0d;
        }
        return Math.min(1.0d, (double) completed / (double) total);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s %d/%d (%.1f%%)", runstate.getLabel(), completed, total, progress * 100.0d);
    }
}
