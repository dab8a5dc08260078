/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.effectlog.sinks;

import io.nosqlbench.effectlog.EffectContext;
import io.nosqlbench.effectlog.eventing.Disposition;
import io.nosqlbench.effectlog.eventing.EventHandler;
import io.nosqlbench.effectlog.eventing.LogEvent;
import io.nosqlbench.effectlog.eventing.LogLevel;
import io.nosqlbench.effectlog.eventing.ProgressEvent;
import io.nosqlbench.effectlog.eventing.ProgressPhase;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * An event handler that writes events to a Log4j 2 logger, for processes whose output
 * is managed by the logging configuration rather than a console.
 *
 * <p>Log events are logged at the Log4j level matching their severity:</p>
 * <ul>
 *   <li>100 and above: ERROR</li>
 *   <li>50 and above: WARN</li>
 *   <li>10 and above: INFO</li>
 *   <li>0 and above: DEBUG</li>
 *   <li>below 0: TRACE</li>
 * </ul>
 *
 * <p>Progress bars are logged when they start and finish, at the progress level
 * (DEBUG unless configured otherwise):</p>
 * <ul>
 *   <li>"Progress started: [description] (#id, total N)"</li>
 *   <li>"Progress finished: [description] (#id, current/total)"</li>
 * </ul>
 * <p>Intermediate progress is not logged.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (EffectContext context = new EffectContext("batch");
 *      HandlerRegistration logging = context.install(new LoggerEventHandler("app.batch"))) {
 *     context.info("nightly batch started");
 * }
 * }</pre>
 *
 * <p>By default the handler forwards events marked as handled, so a text writer further
 * out still renders them. A consuming handler stops them instead.
 *
 * @see EffectContext#install(EventHandler)
 * @see LoggerFallbackPolicy
 * @since 4.0.0
 */
public class LoggerEventHandler implements EventHandler {

    private final Logger logger;
    private final Level progressLevel;
    private final boolean consume;

    public LoggerEventHandler() {
        this(LogManager.getLogger(LoggerEventHandler.class));
    }

    public LoggerEventHandler(String loggerName) {
        this(LogManager.getLogger(loggerName));
    }

    public LoggerEventHandler(Logger logger) {
        this(logger, Level.DEBUG, false);
    }

    /**
     * @param logger the target logger
     * @param progressLevel level for progress start and finish messages, DEBUG if null
     * @param consume whether to stop events after logging them
     */
    public LoggerEventHandler(Logger logger, Level progressLevel, boolean consume) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.progressLevel = Objects.requireNonNullElse(progressLevel, Level.DEBUG);
        this.consume = consume;
    }

    /**
     * Maps a severity onto the nearest Log4j level at or below it.
     *
     * @param level the event severity
     * @return the Log4j level
     */
    public static Level toLog4jLevel(LogLevel level) {
        int value = level.getValue();
        if (value >= LogLevel.ERROR.getValue()) {
            return Level.ERROR;
        }
        if (value >= LogLevel.WARNING.getValue()) {
            return Level.WARN;
        }
        if (value >= LogLevel.INFO.getValue()) {
            return Level.INFO;
        }
        if (value >= LogLevel.DEBUG.getValue()) {
            return Level.DEBUG;
        }
        return Level.TRACE;
    }

    @Override
    public Disposition<LogEvent> onLog(LogEvent event) {
        Level level = toLog4jLevel(event.getLevel());
        if (logger.isEnabled(level)) {
            logger.log(level, event.getText());
        }
        return consume ? Disposition.consumed() : Disposition.forwardHandled(event);
    }

    @Override
    public Disposition<ProgressEvent> onProgress(ProgressEvent event) {
        if (logger.isEnabled(progressLevel)) {
            if (event.getPhase() == ProgressPhase.START) {
                logger.log(progressLevel, "Progress started: {} (#{}, total {})",
                        event.getDescription(), event.getSequenceId(),
                        event.hasTotal() ? String.valueOf(event.getTotal().getAsLong()) : "unknown");
            } else if (event.getPhase() == ProgressPhase.FINISH) {
                logger.log(progressLevel, "Progress finished: {} (#{}, {})",
                        event.getDescription(), event.getSequenceId(), countOf(event));
            }
        }
        return consume ? Disposition.consumed() : Disposition.forwardHandled(event);
    }

    private static String countOf(ProgressEvent event) {
        if (event.hasTotal()) {
            return event.getCurrent() + "/" + event.getTotal().getAsLong();
        }
        return String.valueOf(event.getCurrent());
    }

    public Logger getLogger() {
        return logger;
    }
}
