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

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class DestinationsTest {

    @Test
    void streamsAreNotInteractiveByDefault() {
        assertFalse(Destinations.of(new StringWriter()).isInteractive());
        assertFalse(Destinations.of(new ByteArrayOutputStream()).isInteractive());
        assertEquals(80, Destinations.of(new PrintStream(new ByteArrayOutputStream())).getColumns());
    }

    @Test
    void interactiveWritersKeepTheirWidth() {
        TextDestination destination = Destinations.interactive(new StringWriter(), 132);
        assertTrue(destination.isInteractive());
        assertEquals(132, destination.getColumns());
        assertEquals(80, Destinations.interactive(new StringWriter(), 0).getColumns());
    }

    @Test
    void outputStreamsReceiveUtf8() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        TextDestination destination = Destinations.of(bytes);
        destination.write("█ done");
        destination.flush();
        assertEquals("█ done", bytes.toString(StandardCharsets.UTF_8));
    }

    @Test
    void ownershipIsExclusive() {
        TextDestination destination = Destinations.of(new StringWriter());
        Object first = new Object();
        Object second = new Object();

        destination.claim(first);
        assertThrows(IllegalStateException.class, () -> destination.claim(second));
        destination.release(second);
        assertSame(first, destination.getOwner());
        destination.release(first);
        destination.claim(second);
        assertSame(second, destination.getOwner());
    }

    @Test
    void consoleIsShared() {
        assertSame(Destinations.console(), Destinations.console());
    }
}
