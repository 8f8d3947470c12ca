package io.nosqlbench.nbpivot.status.sinks;

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
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.Objects;

/**
 * Writes task events as Log4j 2 log lines.
 *
 * <p>Message formats:
 * <ul>
 *   <li>{@code Task started: grouping}</li>
 *   <li>{@code Task update: grouping [45.0%] 450/1000 - running}</li>
 *   <li>{@code Task finished: grouping - done}</li>
 * </ul>
 *
 * <p>Tasks that end {@link RunState#FAILED} are logged at {@code WARN} regardless of the
 * configured level.
 */
public class LoggerStatusSink implements StatusSink {

    private final Logger logger;
    private final Level level;

    public LoggerStatusSink() {
        this(LogManager.getLogger(LoggerStatusSink.class));
    }

    public LoggerStatusSink(Logger logger) {
        this(logger, Level.INFO);
    }

    public LoggerStatusSink(Logger logger, Level level) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.level = Objects.requireNonNullElse(level, Level.INFO);
    }

    public LoggerStatusSink(String loggerName, Level level) {
        this(LogManager.getLogger(loggerName), level);
    }

    @Override
    public void taskStarted(StatusSource<?> task) {
        log(level, "Task started: " + task.getTaskName());
    }

    @Override
    public void taskUpdate(StatusSource<?> task, StatusUpdate<?> status) {
        log(level, String.format(Locale.ROOT, "Task update: %s [%.1f%%] %d/%d - %s",
            task.getTaskName(), status.progress * 100, status.completed, status.total,
            status.runstate.getLabel()));
    }

    @Override
    public void taskFinished(StatusSource<?> task, StatusUpdate<?> finalStatus) {
        Level effective = finalStatus.runstate == RunState.FAILED ? Level.WARN : level;
        log(effective, "Task finished: " + task.getTaskName() + " - " + finalStatus.runstate.getLabel());
    }

    private void log(Level effectiveLevel, String message) {
        if (logger.isEnabled(effectiveLevel)) {
            logger.log(effectiveLevel, message);
        }
    }
}
