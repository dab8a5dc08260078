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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LogLevelTest {

    @Test
    void namedLevelsHaveTheirValues() {
        assertEquals(0, LogLevel.DEBUG.getValue());
        assertEquals(10, LogLevel.INFO.getValue());
        assertEquals(50, LogLevel.WARNING.getValue());
        assertEquals(100, LogLevel.ERROR.getValue());
        assertEquals("WARNING", LogLevel.WARNING.getName());
    }

    @Test
    void ofReturnsNamedConstantsAndAcceptsOtherValues() {
        assertSame(LogLevel.INFO, LogLevel.of(10));
        LogLevel custom = LogLevel.of(75);
        assertEquals("LEVEL75", custom.getName());
        assertEquals(75, custom.getValue());
        assertEquals(LogLevel.of(75), custom);
        assertEquals(-5, LogLevel.of(-5).getValue());
    }

    @Test
    void levelsOrderByValue() {
        List<LogLevel> levels = new ArrayList<>(List.of(LogLevel.ERROR, LogLevel.of(75), LogLevel.DEBUG, LogLevel.INFO));
        Collections.sort(levels);
        assertEquals(List.of(LogLevel.DEBUG, LogLevel.INFO, LogLevel.of(75), LogLevel.ERROR), levels);
        assertTrue(LogLevel.ERROR.isAtLeast(LogLevel.WARNING));
        assertTrue(LogLevel.INFO.isAtLeast(LogLevel.INFO));
        assertFalse(LogLevel.DEBUG.isAtLeast(LogLevel.INFO));
    }
}
