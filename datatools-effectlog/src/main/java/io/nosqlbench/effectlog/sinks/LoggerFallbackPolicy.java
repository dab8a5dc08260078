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

import io.nosqlbench.effectlog.eventing.EventDispatcher;
import io.nosqlbench.effectlog.eventing.FallbackPolicy;
import io.nosqlbench.effectlog.eventing.LogEvent;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * A fallback that hands unhandled log events to a Log4j 2 logger instead of re-emitting
 * them, so messages emitted with no writer installed still reach the process log.
 * Each event is logged at its mapped level, prefixed with a note that nothing handled it.
 *
 * <pre>{@code
 * EffectContext context = new EffectContext("worker", new LoggerFallbackPolicy());
 * context.warning("disk nearly full");   // logged via Log4j at WARN
 * }</pre>
 *
 * @see LoggerEventHandler#toLog4jLevel(io.nosqlbench.effectlog.eventing.LogLevel)
 * @since 4.0.0
 */
public class LoggerFallbackPolicy implements FallbackPolicy {

    private final Logger logger;

    public LoggerFallbackPolicy() {
        this(LogManager.getLogger(LoggerFallbackPolicy.class));
    }

    public LoggerFallbackPolicy(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public void onUnhandledLog(LogEvent event, EventDispatcher dispatcher) {
        Level level = LoggerEventHandler.toLog4jLevel(event.getLevel());
        if (logger.isEnabled(level)) {
            logger.log(level, "No handler processed log message (level={}): {}",
                    event.getLevel().getName(), event.getText());
        }
    }
}
