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

package io.nosqlbench.effectlog;

import java.util.Locale;

/**
 * Decides whether a text writer treats its destination as an interactive terminal, for
 * the {@code nb.effectlog.writer} system property and
 * {@link io.nosqlbench.effectlog.sinks.TextWriterOptions.Builder#withWriterMode(WriterMode)}.
 *
 * <p>Supported modes:</p>
 * <ul>
 *   <li><strong>AUTO</strong> - use what the destination reports</li>
 *   <li><strong>INTERACTIVE</strong> - always draw progress bars with cursor control</li>
 *   <li><strong>PLAIN</strong> - never draw progress bars, never emit control sequences</li>
 * </ul>
 */
public enum WriterMode {
    AUTO("auto"),
    INTERACTIVE("tty"),
    PLAIN("plain");

    private final String propertyValue;

    WriterMode(String propertyValue) {
        this.propertyValue = propertyValue;
    }

    public String getPropertyValue() {
        return propertyValue;
    }

    /**
     * Parses a mode, accepting aliases. Case-insensitive, whitespace is trimmed.
     *
     * <ul>
     *   <li><strong>AUTO:</strong> "auto", "default", ""</li>
     *   <li><strong>INTERACTIVE:</strong> "tty", "interactive", "terminal", "console"</li>
     *   <li><strong>PLAIN:</strong> "plain", "text", "file", "dumb"</li>
     * </ul>
     *
     * @param value the string to parse (may be null)
     * @return the mode, or null if the input is null
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static WriterMode fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "tty":
            case "interactive":
            case "terminal":
            case "console":
                return INTERACTIVE;
            case "plain":
            case "text":
            case "file":
            case "dumb":
                return PLAIN;
            case "auto":
            case "default":
            case "":
                return AUTO;
            default:
                throw new IllegalArgumentException(
                    "Unrecognized writer mode '" + value + "'. Expected one of: auto, tty, plain.");
        }
    }

    /**
     * Resolves this mode against what the destination reported.
     *
     * @param detected whether the destination looks like an interactive terminal
     * @return true if the writer should render interactively
     */
    public boolean resolve(boolean detected) {
        switch (this) {
            case INTERACTIVE:
                return true;
            case PLAIN:
                return false;
            default:
                return detected;
        }
    }

    @Override
    public String toString() {
        return propertyValue;
    }
}
