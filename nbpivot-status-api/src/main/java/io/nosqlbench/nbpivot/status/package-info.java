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
 * Progress reporting for long running scans.
 *
 * <p>A task implements {@link io.nosqlbench.nbpivot.status.eventing.StatusSource} and owns a
 * {@link io.nosqlbench.nbpivot.status.StatusEmitter}, which forwards its lifecycle to any number of
 * {@link io.nosqlbench.nbpivot.status.eventing.StatusSink}s:
 *
 * <pre>{@code
 * StatusEmitter<GroupingPass> emitter = new StatusEmitter<>(pass, List.of(new LoggerStatusSink()), 1000);
 * emitter.started();
 * for (Row row : rows) {
 *     place(row);
 *     emitter.advance(++seen);
 * }
 * emitter.finished(RunState.SUCCESS);
 * }</pre>
 */
package io.nosqlbench.nbpivot.status;
