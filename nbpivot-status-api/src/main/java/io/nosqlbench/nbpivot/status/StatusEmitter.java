package io.nosqlbench.nbpivot.status;

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

import io.nosqlbench.nbpivot.status.eventing.RunState;
import io.nosqlbench.nbpivot.status.eventing.StatusSink;
import io.nosqlbench.nbpivot.status.eventing.StatusSource;
import io.nosqlbench.nbpivot.status.eventing.StatusUpdate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Pushes the lifecycle of one {@link StatusSource} task to a fixed set of {@link StatusSink}s.
 *
 * <p>The owning task calls {@link #started()}, then {@link #advance(long)} once per unit of
 * work, then {@link #finished(RunState)}. Updates are only forwarded every {@code interval}
 * units so that per-row reporting does not dominate the cost of a scan.
 *
 * <p>A failing sink is logged and skipped; it never interrupts the task or the other sinks.
 *
 * <p>Not thread safe: an emitter belongs to the single thread running its task.
 *
 * @param <T> the task type
 */
public final class StatusEmitter<T extends StatusSource<T>> {

    private static final Logger logger = LogManager.getLogger(StatusEmitter.class);

    private final T task;
    private final List<StatusSink> sinks;
    private final long interval;
    private long lastReported;
    private boolean finished;

    /**
     * @param task     the task being reported on
     * @param sinks    receivers of the task's events, snapshotted at construction
     * @param interval the minimum number of work units between forwarded updates
     */
    public StatusEmitter(T task, List<StatusSink> sinks, long interval) {
        this.task = Objects.requireNonNull(task, "task");
        this.sinks = List.copyOf(Objects.requireNonNullElse(sinks, List.of()));
        if (interval < 1) {
            throw new IllegalArgumentException("interval must be at least 1, got " + interval);
        }
        this.interval = interval;
    }

    public void started() {
        notifySinks(sink -> sink.taskStarted(task), "notifying sink of task start");
    }

    /**
     * Forwards the task's current status when at least {@code interval} units completed since
     * the last forwarded update.
     *
     * @param completed the task's completed work units so far
     */
    public void advance(long completed) {
        if (completed - lastReported < interval) {
            return;
        }
        lastReported = completed;
        StatusUpdate<T> status = task.getTaskStatus();
        notifySinks(sink -> sink.taskUpdate(task, status), "notifying sink of task update");
    }

    /**
     * Reports the final status. Calls after the first are ignored.
     *
     * @param finalState a terminal state
     */
    public void finished(RunState finalState) {
        if (finished) {
            return;
        }
        if (!finalState.isTerminal()) {
            throw new IllegalArgumentException("not a terminal state: " + finalState);
        }
        finished = true;
        StatusUpdate<T> last = task.getTaskStatus();
        StatusUpdate<T> status = new StatusUpdate<>(last.completed, last.total, finalState, task);
        notifySinks(sink -> sink.taskFinished(task, status), "notifying sink of task finish");
    }

    private void notifySinks(Consumer<StatusSink> sinkAction, String errorContext) {
        for (StatusSink sink : sinks) {
            try {
                sinkAction.accept(sink);
            } catch (RuntimeException e) {
                logger.warn("Error {} for {}: {}", errorContext, task.getTaskName(), e.getMessage(), e);
            }
        }
    }
}
