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

import org.jline.terminal.Terminal;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * A destination backed by a JLine {@link Terminal}. The terminal is interactive unless
 * JLine had to fall back to a dumb terminal; the width follows terminal resizes.
 *
 * <p>The destination does not close the terminal; its creator does.
 *
 * @since 4.0.0
 */
public final class TerminalDestination extends AbstractTextDestination {

    private final Terminal terminal;

    TerminalDestination(Terminal terminal) {
        this.terminal = Objects.requireNonNull(terminal, "terminal");
    }

    @Override
    public void write(String text) {
        PrintWriter writer = terminal.writer();
        writer.print(text);
        if (writer.checkError()) {
            throw new UncheckedIOException(new IOException("Unable to write to terminal " + terminal.getName()));
        }
    }

    @Override
    public void flush() {
        terminal.flush();
        if (terminal.writer().checkError()) {
            throw new UncheckedIOException(new IOException("Unable to flush terminal " + terminal.getName()));
        }
    }

    @Override
    public boolean isInteractive() {
        String type = terminal.getType();
        return type != null
                && !Terminal.TYPE_DUMB.equals(type)
                && !Terminal.TYPE_DUMB_COLOR.equals(type);
    }

    @Override
    public int getColumns() {
        int width = terminal.getWidth();
        return width > 0 ? width : DEFAULT_COLUMNS;
    }

    public Terminal getTerminal() {
        return terminal;
    }

    @Override
    public String toString() {
        return "terminal:" + terminal.getName() + "(" + terminal.getType() + ")";
    }
}
