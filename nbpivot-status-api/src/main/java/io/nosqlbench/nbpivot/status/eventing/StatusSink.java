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
 * Receives lifecycle and progress events from {@link StatusSource} tasks.
 *
 * <p>Events for one task arrive in order on the task's own thread: one
 * {@link #taskStarted}, any number of {@link #taskUpdate} calls, then one {@link #taskFinished}.
 * Sinks shared by concurrent tasks must tolerate interleaved events from different tasks.
 */
public interface StatusSink {

    void taskStarted(StatusSource<?> task);

    void taskUpdate(StatusSource<?> task, StatusUpdate<?> status);

    /**
     * @param task        the finishing task
     * @param finalStatus its last status, always in a terminal {@link RunState}
     */
    void taskFinished(StatusSource<?> task, StatusUpdate<?> finalStatus);
}
