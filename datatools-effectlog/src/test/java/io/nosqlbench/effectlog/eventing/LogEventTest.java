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

package io.nosqlbench.effectlog.eventing;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class LogEventTest {

    @Test
    void nullLevelIsRejected() {
        assertThrows(NullPointerException.class, () -> LogEvent.of(null, "x"));
    }

    @Test
    void messageIsStringifiedLazilyAndOnce() {
        AtomicInteger calls = new AtomicInteger();
        Object message = new Object() {
            @Override
            public String toString() {
                calls.incrementAndGet();
                return "expensive";
            }
        };
        LogEvent event = LogEvent.of(LogLevel.INFO, message);
        assertEquals(0, calls.get());
        assertEquals("expensive", event.getText());
        assertEquals("expensive", event.getText());
        assertEquals(1, calls.get());
    }

    @Test
    void supplierMessagesAreResolved() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<String> message = () -> "built " + calls.incrementAndGet();
        LogEvent event = LogEvent.of(LogLevel.DEBUG, message);
        assertEquals(0, calls.get());
        assertEquals("built 1", event.getText());
        assertEquals("built 1", event.getText());
    }

    @Test
    void nullMessageRendersAsNull() {
        assertEquals("null", LogEvent.of(LogLevel.INFO, null).getText());
    }

    @Test
    void derivedEventsLeaveTheOriginalUntouched() {
        LogEvent original = LogEvent.of(LogLevel.INFO, "payload");
        LogEvent prefixed = original.withPrefix("[ctx] ");
        LogEvent raised = original.withLevel(LogLevel.ERROR);

        assertEquals("[ctx] payload", prefixed.getText());
        assertEquals(LogLevel.ERROR, raised.getLevel());
        assertEquals("payload", original.getText());
        assertEquals(LogLevel.INFO, original.getLevel());
        assertEquals(original.getTimestamp(), prefixed.getTimestamp());
    }

    @Test
    void fallbackEventDescribesTheUnhandledOne() {
        LogEvent unhandled = LogEvent.of(LogLevel.ERROR, "disk full");
        LogEvent fallback = LogEvent.fallbackFor(unhandled);

        assertTrue(fallback.isFallback());
        assertFalse(unhandled.isFallback());
        assertEquals(LogLevel.WARNING, fallback.getLevel());
        assertEquals("No handler processed log message (level=ERROR): disk full", fallback.getText());
    }
}
