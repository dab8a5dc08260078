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
import io.nosqlbench.effectlog.RecordingHandler;
import io.nosqlbench.effectlog.eventing.Disposition;
import io.nosqlbench.effectlog.eventing.LogEvent;
import io.nosqlbench.effectlog.eventing.LogLevel;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class LoggerEventHandlerTest {

    @Test
    void mapsSeveritiesOntoLog4jLevels() {
        assertEquals(Level.ERROR, LoggerEventHandler.toLog4jLevel(LogLevel.ERROR));
        assertEquals(Level.ERROR, LoggerEventHandler.toLog4jLevel(LogLevel.of(500)));
        assertEquals(Level.WARN, LoggerEventHandler.toLog4jLevel(LogLevel.of(75)));
        assertEquals(Level.WARN, LoggerEventHandler.toLog4jLevel(LogLevel.WARNING));
        assertEquals(Level.INFO, LoggerEventHandler.toLog4jLevel(LogLevel.INFO));
        assertEquals(Level.DEBUG, LoggerEventHandler.toLog4jLevel(LogLevel.of(5)));
        assertEquals(Level.TRACE, LoggerEventHandler.toLog4jLevel(LogLevel.of(-1)));
    }

    @Test
    void logsEventsAndProgressBoundaries() {
        String name = "test.effectlog.handler";
        RecordingHandler outer = new RecordingHandler(false);
        try (CapturingAppender appender = CapturingAppender.attach(name);
             EffectContext context = new EffectContext("log4j")) {
            context.install(outer);
            context.install(new LoggerEventHandler(name));

            context.warning("low disk");
            context.forEachWithProgress(List.of("a", "b"), "copy", s -> { });

            assertEquals(List.of(
                    "WARN low disk",
                    "DEBUG Progress started: copy (#1, total 2)",
                    "DEBUG Progress finished: copy (#1, 2/2)"), appender.lines());
            assertEquals(1, outer.getLogs().size());
            assertFalse(outer.getLogs().get(0).isFallback());
        }
    }

    @Test
    void consumingHandlerStopsEvents() {
        LoggerEventHandler consuming = new LoggerEventHandler(LogManager.getLogger("test.effectlog.consume"), Level.INFO, true);
        Disposition<LogEvent> disposition = consuming.onLog(LogEvent.of(LogLevel.INFO, "x"));
        assertTrue(disposition.isConsumed());
    }

    @Test
    void fallbackPolicyLogsInsteadOfReemitting() {
        String name = "test.effectlog.fallback";
        RecordingHandler observer = new RecordingHandler(false);
        try (CapturingAppender appender = CapturingAppender.attach(name);
             EffectContext context = new EffectContext("fallback", new LoggerFallbackPolicy(LogManager.getLogger(name)))) {
            context.install(observer);

            context.error("unrendered");

            assertEquals(1, observer.getLogs().size());
            assertEquals(List.of("ERROR No handler processed log message (level=ERROR): unrendered"),
                    appender.lines());
        }
    }

    @Test
    void fallbackPolicyLeavesMessagesUnbuiltBelowTheLoggerLevel() {
        String name = "test.effectlog.fallback.quiet";
        AtomicInteger calls = new AtomicInteger();
        Supplier<String> expensive = () -> "built " + calls.incrementAndGet();
        try (CapturingAppender appender = CapturingAppender.attach(name, Level.INFO)) {
            Logger logger = LogManager.getLogger(name);
            assertFalse(logger.isDebugEnabled());
            try (EffectContext context = new EffectContext("quiet", new LoggerFallbackPolicy(logger))) {
                context.debug(expensive);
                assertEquals(0, calls.get());
                assertTrue(appender.lines().isEmpty());

                context.warning(expensive);
                assertEquals(1, calls.get());
                assertEquals(List.of("WARN No handler processed log message (level=WARNING): built 1"),
                        appender.lines());
            }
        }
    }
}
