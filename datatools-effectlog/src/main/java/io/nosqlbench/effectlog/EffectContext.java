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

import io.nosqlbench.effectlog.eventing.DefaultFallbackPolicy;
import io.nosqlbench.effectlog.eventing.Disposition;
import io.nosqlbench.effectlog.eventing.EventDispatcher;
import io.nosqlbench.effectlog.eventing.EventHandler;
import io.nosqlbench.effectlog.eventing.FallbackPolicy;
import io.nosqlbench.effectlog.eventing.LogEvent;
import io.nosqlbench.effectlog.eventing.LogLevel;
import io.nosqlbench.effectlog.eventing.ProgressEvent;
import io.nosqlbench.effectlog.sinks.Destinations;
import io.nosqlbench.effectlog.sinks.TextDestination;
import io.nosqlbench.effectlog.sinks.TextWriterOptions;
import io.nosqlbench.effectlog.sinks.TextWriterSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Owns one handler stack and is the entry point for emitting log and progress events.
 * A context is an explicit object rather than process-wide state: code that emits events
 * is handed the context, and independent contexts never see each other's handlers.
 *
 * <p><strong>Dispatch:</strong></p>
 * <ol>
 *   <li>The caller emits an event, e.g. {@link #info(Object)} or by iterating a
 *       {@link ProgressBar}</li>
 *   <li>The event is offered to the installed {@link EventHandler}s, innermost (most
 *       recently installed) first</li>
 *   <li>Each handler consumes it, forwards it (possibly replaced by a derived event), or
 *       forwards it marked as handled</li>
 *   <li>If it reaches the outer end and no handler consumed or handled it, the context's
 *       {@link FallbackPolicy} applies</li>
 * </ol>
 * <p>Dispatch happens synchronously on the emitting thread. Exceptions thrown by handlers
 * propagate to the emitting call.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * try (EffectContext context = new EffectContext("import");
 *      TextWriterScope console = context.textWriter()) {
 *     context.info("starting import");
 *     try (ProgressBar<Row> rows = context.progressbar(batch, "rows")) {
 *         for (Row row : rows) {
 *             store(row);
 *         }
 *     }
 *     context.error("2 rows rejected");
 * }
 * }</pre>
 *
 * <p><strong>Thread Safety:</strong> handlers may be installed and removed from any thread;
 * the stack is a {@link CopyOnWriteArrayList} and each dispatch works on a snapshot.</p>
 *
 * @see EventHandler
 * @see TextWriterScope
 * @see ProgressBar
 * @since 4.0.0
 */
public final class EffectContext implements EventDispatcher, AutoCloseable {

    private static final Logger logger = LogManager.getLogger(EffectContext.class);

    private final String name;
    private final FallbackPolicy fallbackPolicy;
    private final CopyOnWriteArrayList<HandlerRegistration> stack = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<TextWriterScope> openWriters = new CopyOnWriteArrayList<>();
    private final AtomicLong sequenceIds = new AtomicLong();
    private volatile boolean closed = false;

    /**
     * Creates a context using the {@link DefaultFallbackPolicy}.
     *
     * @param name the name of this context for identification purposes
     */
    public EffectContext(String name) {
        this(name, DefaultFallbackPolicy.getInstance());
    }

    /**
     * Creates a context with a specific fallback policy.
     *
     * @param name the name of this context for identification purposes
     * @param fallbackPolicy what to do with events nobody handled
     */
    public EffectContext(String name, FallbackPolicy fallbackPolicy) {
        this.name = Objects.requireNonNull(name, "name");
        this.fallbackPolicy = Objects.requireNonNull(fallbackPolicy, "fallbackPolicy");
    }

    /**
     * Installs a handler as the new innermost entry of the stack.
     *
     * @param handler the handler to install
     * @return a registration that removes the handler when closed
     * @throws IllegalStateException if this context has been closed
     */
    public HandlerRegistration install(EventHandler handler) {
        checkNotClosed();
        HandlerRegistration registration = new HandlerRegistration(this, Objects.requireNonNull(handler, "handler"));
        stack.add(registration);
        return registration;
    }

    void uninstall(HandlerRegistration registration) {
        stack.remove(registration);
    }

    /**
     * Returns the installed handlers, innermost first. The list is a snapshot.
     *
     * @return the current handler stack
     */
    public List<EventHandler> getHandlers() {
        List<EventHandler> handlers = new ArrayList<>();
        for (HandlerRegistration registration : stack) {
            handlers.add(registration.getHandler());
        }
        Collections.reverse(handlers);
        return handlers;
    }

    /**
     * Opens a text writer on the default console.
     *
     * @return the open writer scope
     * @see Destinations#console()
     */
    public TextWriterScope textWriter() {
        return textWriter(Destinations.console());
    }

    /**
     * Opens a text writer on a destination, configured from system properties.
     *
     * @param destination where to render
     * @return the open writer scope
     * @see TextWriterOptions#fromSystemProperties()
     */
    public TextWriterScope textWriter(TextDestination destination) {
        return textWriter(destination, TextWriterOptions.fromSystemProperties().build());
    }

    /**
     * Opens a text writer on a destination and installs it as the innermost handler.
     *
     * @param destination where to render; must not be owned by another open writer
     * @param options rendering options
     * @return the open writer scope
     * @throws IllegalStateException if the context is closed or the destination is owned
     */
    public TextWriterScope textWriter(TextDestination destination, TextWriterOptions options) {
        checkNotClosed();
        TextWriterSink sink = new TextWriterSink(destination, options);
        HandlerRegistration registration;
        try {
            registration = install(sink);
        } catch (RuntimeException e) {
            sink.close();
            throw e;
        }
        TextWriterScope scope = new TextWriterScope(this, sink, registration);
        openWriters.add(scope);
        logger.debug("Opened text writer on {} in context '{}'", destination, name);
        return scope;
    }

    void onWriterClosed(TextWriterScope scope) {
        openWriters.remove(scope);
    }

    @Override
    public void send(LogEvent event) {
        Objects.requireNonNull(event, "event");
        LogEvent current = event;
        boolean handled = false;
        for (EventHandler handler : innermostFirst()) {
            Disposition<LogEvent> disposition = handler.onLog(current);
            if (disposition.isConsumed()) {
                return;
            }
            handled |= disposition.isHandled();
            current = disposition.getEvent();
        }
        if (!handled) {
            fallbackPolicy.onUnhandledLog(current, this);
        }
    }

    @Override
    public void send(ProgressEvent event) {
        Objects.requireNonNull(event, "event");
        ProgressEvent current = event;
        boolean handled = false;
        for (EventHandler handler : innermostFirst()) {
            Disposition<ProgressEvent> disposition = handler.onProgress(current);
            if (disposition.isConsumed()) {
                return;
            }
            handled |= disposition.isHandled();
            current = disposition.getEvent();
        }
        if (!handled) {
            fallbackPolicy.onUnhandledProgress(current, this);
        }
    }

    private List<EventHandler> innermostFirst() {
        Object[] snapshot = stack.toArray();
        List<EventHandler> handlers = new ArrayList<>(snapshot.length);
        for (int i = snapshot.length - 1; i >= 0; i--) {
            handlers.add(((HandlerRegistration) snapshot[i]).getHandler());
        }
        return handlers;
    }

    /**
     * Emits a log event. The message is stringified only if some handler renders it;
     * pass a {@link java.util.function.Supplier} to defer building it as well.
     *
     * @param level the severity
     * @param message the message object
     */
    public void log(LogLevel level, Object message) {
        send(LogEvent.of(level, message));
    }

    public void debug(Object message) {
        log(LogLevel.DEBUG, message);
    }

    public void info(Object message) {
        log(LogLevel.INFO, message);
    }

    public void warning(Object message) {
        log(LogLevel.WARNING, message);
    }

    public void error(Object message) {
        log(LogLevel.ERROR, message);
    }

    /**
     * Wraps a sequence in a progress bar with no description. The total is the size of
     * the sequence when it is a {@link Collection}, otherwise unknown.
     */
    public <T> ProgressBar<T> progressbar(Iterable<? extends T> items) {
        return progressbar(items, null, null);
    }

    public <T> ProgressBar<T> progressbar(Iterable<? extends T> items, String initialDescription) {
        return progressbar(items, initialDescription, null);
    }

    /**
     * Wraps a sequence in a progress bar.
     *
     * @param items the sequence to consume
     * @param initialDescription text shown before the first element, null for none
     * @param descriptionCallback computes a description from each element, null for none
     * @param <T> element type
     * @return a single-pass progress bar over {@code items}
     */
    public <T> ProgressBar<T> progressbar(Iterable<? extends T> items,
                                          String initialDescription,
                                          Function<? super T, String> descriptionCallback) {
        return progressbar(items, knownSize(items), initialDescription, descriptionCallback);
    }

    /**
     * Wraps a sequence in a progress bar with an explicit total, for sequences whose
     * length is known to the caller but not to the collection framework.
     *
     * @param items the sequence to consume
     * @param total the expected length, or null when unknown
     * @param initialDescription text shown before the first element, null for none
     * @param descriptionCallback computes a description from each element, null for none
     * @param <T> element type
     * @return a single-pass progress bar over {@code items}
     */
    public <T> ProgressBar<T> progressbar(Iterable<? extends T> items,
                                          Long total,
                                          String initialDescription,
                                          Function<? super T, String> descriptionCallback) {
        return new ProgressBar<>(this, nextSequenceId(), items, total, initialDescription, descriptionCallback);
    }

    /**
     * Runs {@code action} for every element with progress reporting, finishing the bar
     * even when the action throws.
     *
     * @param items the sequence to consume
     * @param description the bar description
     * @param action the per-element work
     * @param <T> element type
     */
    public <T> void forEachWithProgress(Iterable<? extends T> items, String description, Consumer<? super T> action) {
        try (ProgressBar<T> bar = progressbar(items, description)) {
            for (T item : bar) {
                action.accept(item);
            }
        }
    }

    long nextSequenceId() {
        return sequenceIds.incrementAndGet();
    }

    private static Long knownSize(Iterable<?> items) {
        if (items instanceof Collection) {
            return (long) ((Collection<?>) items).size();
        }
        return null;
    }

    public String getName() {
        return name;
    }

    public FallbackPolicy getFallbackPolicy() {
        return fallbackPolicy;
    }

    public boolean isClosed() {
        return closed;
    }

    private void checkNotClosed() {
        if (closed) {
            throw new IllegalStateException("EffectContext '" + name + "' has been closed");
        }
    }

    /**
     * Closes every writer scope still open, innermost first, and removes all handlers.
     * Idempotent. The first failure raised while closing a writer is rethrown after all
     * writers were closed.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        RuntimeException failure = null;
        List<TextWriterScope> writers = new ArrayList<>(openWriters);
        Collections.reverse(writers);
        for (TextWriterScope writer : writers) {
            try {
                writer.close();
            } catch (RuntimeException e) {
                logger.warn("Error closing text writer in context '{}': {}", name, e.getMessage(), e);
                if (failure == null) {
                    failure = e;
                }
            }
        }
        openWriters.clear();
        stack.clear();
        if (failure != null) {
            throw failure;
        }
    }
}
