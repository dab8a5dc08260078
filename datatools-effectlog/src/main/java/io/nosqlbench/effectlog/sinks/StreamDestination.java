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

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Objects;

/**
 * A destination backed by a {@link PrintStream} or a {@link Writer}. Streams cannot tell
 * whether they end in a terminal, so interactivity is fixed by whoever creates the
 * destination; {@link Destinations} does this for the common cases.
 *
 * <p>{@link PrintStream} hides write failures behind {@link PrintStream#checkError()}; this
 * class checks the flag after every write and flush and raises an
 * {@link UncheckedIOException} instead.
 *
 * @since 4.0.0
 */
public final class StreamDestination extends AbstractTextDestination {

    private final PrintStream printStream;
    private final Writer writer;
    private final boolean interactive;
    private final int columns;
    private final String label;

    StreamDestination(PrintStream printStream, boolean interactive, int columns, String label) {
        this.printStream = Objects.requireNonNull(printStream, "printStream");
        this.writer = null;
        this.interactive = interactive;
        this.columns = columns > 0 ? columns : DEFAULT_COLUMNS;
        this.label = label;
    }

    StreamDestination(Writer writer, boolean interactive, int columns, String label) {
        this.printStream = null;
        this.writer = Objects.requireNonNull(writer, "writer");
        this.interactive = interactive;
        this.columns = columns > 0 ? columns : DEFAULT_COLUMNS;
        this.label = label;
    }

    @Override
    public void write(String text) {
        if (printStream != null) {
            printStream.print(text);
            checkPrintStream("write");
            return;
        }
        try {
            writer.write(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write to " + label, e);
        }
    }

    @Override
    public void flush() {
        if (printStream != null) {
            printStream.flush();
            checkPrintStream("flush");
            return;
        }
        try {
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to flush " + label, e);
        }
    }

    private void checkPrintStream(String operation) {
        if (printStream.checkError()) {
            throw new UncheckedIOException(new IOException("Unable to " + operation + " " + label + ": stream is in error state"));
        }
    }

    @Override
    public boolean isInteractive() {
        return interactive;
    }

    @Override
    public int getColumns() {
        return columns;
    }

    @Override
    public String toString() {
        return label;
    }
}
