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
 * A task that can describe its own progress.
 *
 * <p>Implementations must make {@link #getTaskStatus()} safe to call from a thread other
 * than the one doing the work; volatile counters are sufficient.
 *
 * @param <T> the implementing type, so updates carry a typed reference back to the task
 */
public interface StatusSource<T extends StatusSource<T>> {

    /**
     * @return a fresh snapshot of this task's progress and state
     */
    StatusUpdate<T> getTaskStatus();

    /**
     * @return the name used for this task in sinks and log output
     */
    default String getTaskName() {
        return getClass().getSimpleName();
    }
}
