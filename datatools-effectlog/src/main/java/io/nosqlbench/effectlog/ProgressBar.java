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

import io.nosqlbench.effectlog.eventing.EventDispatcher;
import io.nosqlbench.effectlog.eventing.ProgressEvent;
import io.nosqlbench.effectlog.eventing.ProgressPhase;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Wraps a sequence and reports its consumption as {@link ProgressEvent}s, whether or not
 * anything renders them. A progress bar is lazy and single-pass: it may be iterated once,
 * and {@link #iterator()} fails on a second call.
 *
 * <p>Event order for one bar:</p>
 * <ol>
 *   <li>{@link ProgressPhase#START} on the first {@code hasNext()} or {@code next()}</li>
 *   <li>for each element, an optional {@link ProgressPhase#DESCRIPTION_CHANGE} computed from
 *       the element as it is handed out, then {@link ProgressPhase#ADVANCE} once the caller
 *       comes back for the next element, so the count reflects finished work</li>
 *   <li>{@link ProgressPhase#FINISH} when the source is exhausted, or when the bar is
 *       closed early</li>
 * </ol>
 *
 * <p>Always iterate inside try-with-resources so that leaving the loop early, by
 * {@code break} or by an exception, still finishes the bar:</p>
 * <pre>{@code
 * try (ProgressBar<Path> files = context.progressbar(paths, "indexing")) {
 *     for (Path file : files) {
 *         if (stop) break;
 *         index(file);
 *     }
 * }
 * }</pre>
 *
 * <p>Instances are not thread-safe; consume them from one thread.
 *
 * @param <T> element type
 * @see EffectContext#progressbar(Iterable)
 * @since 4.0.0
 */
public final class ProgressBar<T> implements Iterable<T>, Iterator<T>, AutoCloseable {

    private final EventDispatcher dispatcher;
    private final long sequenceId;
    private final Iterable<? extends T> source;
    private final Long total;
    private final Function<? super T, String> descriptionCallback;

    private Iterator<? extends T> iterator;
    private String description;
    private long current;
    private boolean handedOut;
    private boolean started;
    private boolean finished;
    private boolean pendingAdvance;

    ProgressBar(EventDispatcher dispatcher,
                long sequenceId,
                Iterable<? extends T> source,
                Long total,
                String initialDescription,
                Function<? super T, String> descriptionCallback) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.source = Objects.requireNonNull(source, "source");
        if (total != null && total < 0) {
            throw new IllegalArgumentException("total must not be negative: " + total);
        }
        this.sequenceId = sequenceId;
        this.total = total;
        this.description = Objects.requireNonNullElse(initialDescription, "");
        this.descriptionCallback = descriptionCallback;
    }

    /**
     * Returns this bar as its own iterator. Progress bars are single-pass.
     *
     * @throws IllegalStateException on the second call
     */
    @Override
    public Iterator<T> iterator() {
        if (handedOut) {
            throw new IllegalStateException("progress bar #" + sequenceId + " can only be iterated once");
        }
        handedOut = true;
        return this;
    }

    @Override
    public boolean hasNext() {
        if (finished) {
            return false;
        }
        ensureStarted();
        completePendingAdvance();
        if (iterator.hasNext()) {
            return true;
        }
        finish();
        return false;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("progress bar #" + sequenceId + " is exhausted");
        }
        T item = iterator.next();
        if (descriptionCallback != null) {
            description = Objects.requireNonNullElse(descriptionCallback.apply(item), "");
            emit(ProgressPhase.DESCRIPTION_CHANGE);
        }
        pendingAdvance = true;
        return item;
    }

    /**
     * Returns a sequential stream over the remaining elements. Closing the stream
     * finishes the bar.
     *
     * <p>The stream is never sized, even when a total is known, so terminal operations
     * such as {@code count()} traverse the source and report progress. Each element is
     * counted as soon as the downstream action for it returns, so a short-circuiting
     * operation like {@code limit(n)} still counts its last element.</p>
     *
     * @return a stream backed by this bar
     */
    public Stream<T> stream() {
        iterator();
        Spliterator<T> spliterator = new Spliterators.AbstractSpliterator<T>(Long.MAX_VALUE, Spliterator.ORDERED) {
            @Override
            public boolean tryAdvance(Consumer<? super T> action) {
                if (!hasNext()) {
                    return false;
                }
                action.accept(next());
                completePendingAdvance();
                return true;
            }
        };
        return StreamSupport.stream(spliterator, false).onClose(this::close);
    }

    /**
     * Finishes the bar if it was started and has not finished yet. An element handed out
     * but not yet acknowledged by a further {@code hasNext()} is not counted. A bar closed
     * before iteration began emits nothing and yields no elements afterwards.
     */
    @Override
    public void close() {
        if (finished) {
            return;
        }
        if (!started) {
            finished = true;
            return;
        }
        pendingAdvance = false;
        finish();
    }

    public long getSequenceId() {
        return sequenceId;
    }

    public long getCurrent() {
        return current;
    }

    public boolean isFinished() {
        return finished;
    }

    private void ensureStarted() {
        if (!started) {
            started = true;
            iterator = source.iterator();
            emit(ProgressPhase.START);
        }
    }

    private void completePendingAdvance() {
        if (pendingAdvance) {
            pendingAdvance = false;
            current++;
            emit(ProgressPhase.ADVANCE);
        }
    }

    private void finish() {
        if (finished) {
            return;
        }
        completePendingAdvance();
        finished = true;
        emit(ProgressPhase.FINISH);
    }

    private void emit(ProgressPhase phase) {
        dispatcher.send(ProgressEvent.of(sequenceId, total, current, description, phase));
    }
}
