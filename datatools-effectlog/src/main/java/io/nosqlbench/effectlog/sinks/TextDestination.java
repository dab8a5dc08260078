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

/**
 * An output target for a {@link TextWriterSink}, together with what the writer needs to
 * know about it: whether it is an interactive terminal and how wide it is.
 *
 * <p>A destination is owned by at most one writer at a time. Writers call
 * {@link #claim(Object)} when they are constructed and {@link #release(Object)} when they
 * close, so two writers can never redraw onto the same destination object.
 *
 * <p>Write failures surface as {@link java.io.UncheckedIOException}; they are never
 * swallowed.
 *
 * @see Destinations
 * @since 4.0.0
 */
public interface TextDestination {

    /**
     * Writes text as-is.
     *
     * @param text the text, which may contain control sequences on interactive destinations
     * @throws java.io.UncheckedIOException if the destination is no longer writable
     */
    void write(String text);

    /**
     * @throws java.io.UncheckedIOException if the destination is no longer writable
     */
    void flush();

    /**
     * Reports whether this destination is an interactive terminal. Writers query this once.
     */
    boolean isInteractive();

    /**
     * @return the current width in columns, positive
     */
    int getColumns();

    /**
     * Takes exclusive ownership of this destination.
     *
     * @param owner the claiming writer
     * @throws IllegalStateException if another owner holds it
     */
    void claim(Object owner);

    /**
     * Gives up ownership; ignored if {@code owner} does not hold it.
     *
     * @param owner the releasing writer
     */
    void release(Object owner);

    /**
     * @return the current owner, or null
     */
    Object getOwner();
}
