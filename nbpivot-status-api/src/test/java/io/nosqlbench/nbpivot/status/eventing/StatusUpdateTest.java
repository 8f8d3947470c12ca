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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
public class StatusUpdateTest {

    @Test
    public void progressIsClampedRatio() {
        assertEquals(0.25d, new StatusUpdate<>(25, 100, RunState.RUNNING).progress, 1e-9);
        assertEquals(1.0d, new StatusUpdate<>(150, 100, RunState.RUNNING).progress, 1e-9);
        assertEquals(0.0d, new StatusUpdate<>(-5, 100, RunState.RUNNING).progress, 1e-9);
    }

    @Test
    public void unknownTotalReportsZeroUntilDone() {
        assertEquals(0.0d, new StatusUpdate<>(40, 0, RunState.RUNNING).progress, 1e-9);
        assertEquals(1.0d, new StatusUpdate<>(40, 0, RunState.SUCCESS).progress, 1e-9);
    }

    @Test
    public void terminalStates() {
        assertTrue(RunState.SUCCESS.isTerminal());
        assertTrue(RunState.FAILED.isTerminal());
        assertTrue(RunState.CANCELLED.isTerminal());
        assertFalse(RunState.PENDING.isTerminal());
        assertFalse(RunState.RUNNING.isTerminal());
        assertEquals("running 1/4 (25.0%)", new StatusUpdate<>(1, 4, RunState.RUNNING).toString());
    }
}
