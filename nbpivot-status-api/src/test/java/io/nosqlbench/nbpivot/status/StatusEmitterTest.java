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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class StatusEmitterTest {

    private static final class CountingTask implements StatusSource<CountingTask> {
        long done;
        final long total;
        RunState state = RunState.RUNNING;

        CountingTask(long total) {
            this.total = total;
        }

        @Override
        public StatusUpdate<CountingTask> getTaskStatus() {
            return new StatusUpdate<>(done, total, state, this);
        }

        @Override
        public String getTaskName() {
            return "counting";
        }
    }

    private static final class RecordingSink implements StatusSink {
        final List<String> events = new ArrayList<>();
        final List<StatusUpdate<?>> updates = new ArrayList<>();

        @Override
        public void taskStarted(StatusSource<?> task) {
            events.add("start " + task.getTaskName());
        }

        @Override
        public void taskUpdate(StatusSource<?> task, StatusUpdate<?> status) {
            events.add("update " + status.completed);
            updates.add(status);
        }

        @Override
        public void taskFinished(StatusSource<?> task, StatusUpdate<?> finalStatus) {
            events.add("finish " + finalStatus.runstate.getLabel());
            updates.add(finalStatus);
        }
    }

    @Test
    void forwardsUpdatesOnlyEveryInterval() {
        CountingTask task = new CountingTask(10);
        RecordingSink sink = new RecordingSink();
        StatusEmitter<CountingTask> emitter = new StatusEmitter<>(task, List.of(sink), 4);

        emitter.started();
        for (int i = 1; i <= 10; i++) {
            task.done = i;
            emitter.advance(i);
        }
        emitter.finished(RunState.SUCCESS);

        assertThat(sink.events).containsExactly("start counting", "update 4", "update 8", "finish done");
        StatusUpdate<?> last = sink.updates.get(sink.updates.size() - 1);
        assertThat(last.progress).isEqualTo(1.0d);
        assertThat(last.tracked).isSameAs(task);
    }

    @Test
    void finishesOnlyOnce() {
        CountingTask task = new CountingTask(3);
        RecordingSink sink = new RecordingSink();
        StatusEmitter<CountingTask> emitter = new StatusEmitter<>(task, List.of(sink), 1);

        emitter.finished(RunState.CANCELLED);
        emitter.finished(RunState.SUCCESS);

        assertThat(sink.events).containsExactly("finish cancelled");
    }

    @Test
    void rejectsNonTerminalFinishAndBadInterval() {
        CountingTask task = new CountingTask(3);
        StatusEmitter<CountingTask> emitter = new StatusEmitter<>(task, List.of(), 1);

        assertThatThrownBy(() -> emitter.finished(RunState.RUNNING))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new StatusEmitter<>(task, List.of(), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failingSinkDoesNotStopOthers() {
        CountingTask task = new CountingTask(2);
        RecordingSink sink = new RecordingSink();
        StatusSink broken = new StatusSink() {
            @Override
            public void taskStarted(StatusSource<?> t) {
                throw new IllegalStateException("broken sink");
            }

            @Override
            public void taskUpdate(StatusSource<?> t, StatusUpdate<?> status) {
                throw new IllegalStateException("broken sink");
            }

            @Override
            public void taskFinished(StatusSource<?> t, StatusUpdate<?> finalStatus) {
                throw new IllegalStateException("broken sink");
            }
        };
        StatusEmitter<CountingTask> emitter = new StatusEmitter<>(task, List.of(broken, sink), 1);

        emitter.started();
        task.done = 1;
        emitter.advance(1);
        emitter.finished(RunState.FAILED);

        assertThat(sink.events).containsExactly("start counting", "update 1", "finish failed");
    }
}
