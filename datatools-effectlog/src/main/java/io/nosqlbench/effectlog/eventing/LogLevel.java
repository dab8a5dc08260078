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

import java.util.Objects;

/**
 * Ordinal severity of a {@link LogEvent}. Levels are ordered by their numeric value;
 * the four named constants cover the common cases, but any integer is a legal level
 * and simply sorts above or below them.
 *
 * <pre>{@code
 * LogLevel.INFO.compareTo(LogLevel.WARNING) < 0   // true
 * LogLevel.of(50) == LogLevel.WARNING             // true
 * LogLevel.of(75).getName()                       // "LEVEL75"
 * }</pre>
 *
 * @see LogEvent
 * @since 4.0.0
 */
public final class LogLevel implements Comparable<LogLevel> {

    public static final LogLevel DEBUG = new LogLevel("DEBUG", 0);
    public static final LogLevel INFO = new LogLevel("INFO", 10);
    public static final LogLevel WARNING = new LogLevel("WARNING", 50);
    public static final LogLevel ERROR = new LogLevel("ERROR", 100);

    private static final LogLevel[] NAMED = {DEBUG, INFO, WARNING, ERROR};

    private final String name;
    private final int value;

    private LogLevel(String name, int value) {
        this.name = name;
        this.value = value;
    }

    /**
     * Returns the named constant for {@code value}, or an unnamed level called
     * {@code LEVEL<value>} when no constant matches.
     *
     * @param value the numeric severity
     * @return the matching level
     */
    public static LogLevel of(int value) {
        for (LogLevel level : NAMED) {
            if (level.value == value) {
                return level;
            }
        }
        return new LogLevel("LEVEL" + value, value);
    }

    /**
     * Creates a custom level with an explicit display name.
     *
     * @param name the display name, rendered in place of the standard level names
     * @param value the numeric severity used for ordering
     * @return a new level
     */
    public static LogLevel custom(String name, int value) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("level name must not be blank");
        }
        return new LogLevel(name, value);
    }

    public String getName() {
        return name;
    }

    public int getValue() {
        return value;
    }

    public boolean isAtLeast(LogLevel other) {
        return value >= other.value;
    }

    @Override
    public int compareTo(LogLevel other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LogLevel)) {
            return false;
        }
        LogLevel other = (LogLevel) o;
        return value == other.value && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }

    @Override
    public String toString() {
        return name;
    }
}
