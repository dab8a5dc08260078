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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Factory methods for {@link TextDestination}s.
 *
 * <p>Console detection follows the same rules as the rest of the tooling:</p>
 * <ol>
 *   <li>If {@code TERM} is unset or "dumb" → plain {@code System.out}</li>
 *   <li>If {@code System.console()} is null (piped/redirected) → plain {@code System.out}</li>
 *   <li>Otherwise → the JLine system terminal</li>
 * </ol>
 *
 * <p>Each call to {@code of(..)} creates a new destination. Ownership is tracked per
 * destination object, so code that opens several writers on the console should use
 * {@link #console()}, which always returns the same instance.
 *
 * @since 4.0.0
 */
public final class Destinations {

    private static final Logger logger = LogManager.getLogger(Destinations.class);

    private static volatile TextDestination console;

    private Destinations() {
    }

    /**
     * Returns the process console, creating it on first use.
     *
     * @return the shared console destination
     */
    public static TextDestination console() {
        TextDestination current = console;
        if (current == null) {
            synchronized (Destinations.class) {
                current = console;
                if (current == null) {
                    current = detectConsole();
                    console = current;
                }
            }
        }
        return current;
    }

    private static TextDestination detectConsole() {
        String term = System.getenv("TERM");
        if (term == null || term.equals("dumb") || System.console() == null) {
            return new StreamDestination(System.out, false, AbstractTextDestination.DEFAULT_COLUMNS, "System.out");
        }
        try {
            Terminal terminal = TerminalBuilder.builder()
                    .system(true)
                    .build();
            return new TerminalDestination(terminal);
        } catch (IOException e) {
            logger.warn("Could not open system terminal, using plain System.out: {}", e.getMessage());
            return new StreamDestination(System.out, false, AbstractTextDestination.DEFAULT_COLUMNS, "System.out");
        }
    }

    /**
     * A non-interactive destination writing to a print stream.
     */
    public static TextDestination of(PrintStream stream) {
        return new StreamDestination(stream, false, AbstractTextDestination.DEFAULT_COLUMNS, "stream@" + Integer.toHexString(System.identityHashCode(stream)));
    }

    /**
     * A non-interactive destination writing UTF-8 to an output stream.
     */
    public static TextDestination of(OutputStream stream) {
        Writer writer = new OutputStreamWriter(stream, StandardCharsets.UTF_8);
        return new StreamDestination(writer, false, AbstractTextDestination.DEFAULT_COLUMNS, "stream@" + Integer.toHexString(System.identityHashCode(stream)));
    }

    /**
     * A non-interactive destination writing to a character stream.
     */
    public static TextDestination of(Writer writer) {
        return new StreamDestination(writer, false, AbstractTextDestination.DEFAULT_COLUMNS, "writer@" + Integer.toHexString(System.identityHashCode(writer)));
    }

    /**
     * A destination on a JLine terminal.
     */
    public static TextDestination of(Terminal terminal) {
        return new TerminalDestination(terminal);
    }

    /**
     * A character stream that should be treated as an interactive terminal of the given
     * width, for pseudo-terminals and for capturing terminal output.
     *
     * @param writer the target
     * @param columns terminal width, non-positive for the default of 80
     * @return an interactive destination
     */
    public static TextDestination interactive(Writer writer, int columns) {
        return new StreamDestination(writer, true, columns, "tty-writer@" + Integer.toHexString(System.identityHashCode(writer)));
    }

    /**
     * A print stream that should be treated as an interactive terminal of the given width.
     */
    public static TextDestination interactive(PrintStream stream, int columns) {
        return new StreamDestination(stream, true, columns, "tty-stream@" + Integer.toHexString(System.identityHashCode(stream)));
    }
}
