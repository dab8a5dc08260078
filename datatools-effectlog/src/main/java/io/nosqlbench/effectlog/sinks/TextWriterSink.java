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

import io.nosqlbench.effectlog.eventing.Disposition;
import io.nosqlbench.effectlog.eventing.EventHandler;
import io.nosqlbench.effectlog.eventing.LogEvent;
import io.nosqlbench.effectlog.eventing.ProgressEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;

/**
 * Renders log lines and progress bars as text on a {@link TextDestination}.
 *
 * <p><strong>Interactive destinations</strong> show active progress bars as a region of
 * lines at the bottom of the output, one line per bar in nesting order. A log line
 * arriving while bars are shown clears the region, is written, and the region is drawn
 * again below it, all under one lock so that log and bar output never interleave. Bar
 * updates repaint only the affected line, using relative cursor movement. When the last
 * bar finishes its final line stays on screen; an inner bar that finishes is removed and
 * the bars around it are redrawn.</p>
 *
 * <p><strong>Non-interactive destinations</strong> (files, pipes, dumb terminals) only
 * receive log lines, stripped of any control sequences. Progress events pass through
 * unrendered.</p>
 *
 * <p><strong>Asynchronous mode:</strong> with {@link TextWriterOptions#isAsync()} bar
 * updates only record the new state, and a {@link ProgressRedrawer} thread repaints changed
 * bars every refresh interval. Starting and finishing bars, and log lines, are still
 * drawn on the emitting thread. A redraw failure on the background thread is raised from
 * the next event or from {@link #close()}.</p>
 *
 * <p>Every processed event is forwarded marked as handled, so writers for other
 * destinations further out in the stack see it too. Write failures propagate as
 * {@link java.io.UncheckedIOException}.</p>
 *
 * <p>The writer owns its destination from construction until {@link #close()}. Usually
 * created through {@code EffectContext.textWriter(..)} rather than directly.</p>
 *
 * @see TextWriterOptions
 * @see Destinations
 * @since 4.0.0
 */
public final class TextWriterSink implements EventHandler, AutoCloseable {

    private static final Logger logger = LogManager.getLogger(TextWriterSink.class);

    // CSI, OSC and DCS/SOS/PM/APC strings (BEL or ST terminated), then any other ESC sequence
    private static final Pattern CONTROL_SEQUENCE = Pattern.compile(
            "\u001B(?:\\[[0-?]*[ -/]*[@-~]"
                    + "|\\][^\u0007\u001B]*(?:\u0007|\u001B\\\\)?"
                    + "|[PX^_][^\u001B]*(?:\u001B\\\\)?"
                    + "|[ -/]*[0-~]?)");

    private final TextDestination destination;
    private final TextWriterOptions options;
    private final boolean interactive;
    private final LogFormatter logFormatter;
    private final LongSupplier nanoClock;
    private final long minRedrawNanos;
    private final BarRegion region = new BarRegion();
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicReference<RuntimeException> redrawFailure = new AtomicReference<>();
    private final ProgressRedrawer redrawer;
    private volatile boolean closed = false;

    /**
     * Creates a writer and claims its destination.
     *
     * @param destination where to render
     * @param options rendering options
     * @throws IllegalStateException if the destination is owned by another writer
     */
    public TextWriterSink(TextDestination destination, TextWriterOptions options) {
        this.destination = Objects.requireNonNull(destination, "destination");
        this.options = Objects.requireNonNull(options, "options");
        destination.claim(this);
        this.interactive = options.getWriterMode().resolve(destination.isInteractive());
        this.logFormatter = new LogFormatter(options.isShowTimestamp(), options.isShowPid(),
                interactive && options.isColorOutput());
        this.nanoClock = options.getNanoClock();
        this.minRedrawNanos = options.getMinRedrawInterval().toNanos();
        if (interactive && options.isAsync()) {
            this.redrawer = new ProgressRedrawer(this::redrawChangedBars, options.getRefreshInterval(),
                    failure -> redrawFailure.compareAndSet(null, failure));
            this.redrawer.start();
        } else {
            this.redrawer = null;
        }
        logger.debug("Opened text writer on {} (interactive={}, {})", destination, interactive, options);
    }

    @Override
    public Disposition<LogEvent> onLog(LogEvent event) {
        checkNotClosed();
        String text = logFormatter.format(event);
        if (!interactive) {
            text = stripControlSequences(text);
        }
        lock.lock();
        try {
            raiseRedrawFailure();
            if (region.isEmpty()) {
                destination.write(text);
            } else {
                destination.write(region.clear() + text + region.draw(this::renderBar, nanoClock.getAsLong()));
            }
            destination.flush();
        } finally {
            lock.unlock();
        }
        return Disposition.forwardHandled(event);
    }

    @Override
    public Disposition<ProgressEvent> onProgress(ProgressEvent event) {
        checkNotClosed();
        if (!interactive) {
            return Disposition.forward(event);
        }
        lock.lock();
        try {
            raiseRedrawFailure();
            switch (event.getPhase()) {
                case START:
                    start(event);
                    break;
                case ADVANCE:
                case DESCRIPTION_CHANGE:
                    update(event);
                    break;
                case FINISH:
                    finish(event);
                    break;
                default:
                    throw new IllegalStateException("Unhandled progress phase " + event.getPhase());
            }
        } finally {
            lock.unlock();
        }
        return Disposition.forwardHandled(event);
    }

    private void start(ProgressEvent event) {
        if (region.find(event.getSequenceId()) != null) {
            update(event);
            return;
        }
        long now = nanoClock.getAsLong();
        String cleared = region.clear();
        region.push(new BarState(event, now));
        write(cleared + region.draw(this::renderBar, now));
    }

    private void update(ProgressEvent event) {
        BarState bar = region.find(event.getSequenceId());
        if (bar == null) {
            // bar began before this writer was installed
            start(event);
            return;
        }
        bar.apply(event);
        if (redrawer != null) {
            return;
        }
        long now = nanoClock.getAsLong();
        if (now - bar.getLastDrawNanos() >= minRedrawNanos) {
            write(region.redrawLine(bar, this::renderBar, now));
        }
    }

    private void finish(ProgressEvent event) {
        BarState bar = region.find(event.getSequenceId());
        if (bar == null) {
            return;
        }
        bar.apply(event);
        bar.markFinished();
        long now = nanoClock.getAsLong();
        StringBuilder out = new StringBuilder(region.redrawLine(bar, this::renderBar, now));
        if (region.size() == 1) {
            region.remove(bar);
            out.append(region.release());
        } else {
            out.append(region.clear());
            region.remove(bar);
            out.append(region.draw(this::renderBar, now));
        }
        write(out.toString());
    }

    private void redrawChangedBars() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            long now = nanoClock.getAsLong();
            StringBuilder out = new StringBuilder();
            for (BarState bar : region.getBars()) {
                if (bar.isDirty()) {
                    out.append(region.redrawLine(bar, this::renderBar, now));
                }
            }
            if (out.length() > 0) {
                write(out.toString());
            }
        } finally {
            lock.unlock();
        }
    }

    private String renderBar(BarState bar, long nowNanos) {
        double elapsedSeconds = Math.max(0, nowNanos - bar.getStartNanos()) / (double) TimeUnit.SECONDS.toNanos(1);
        return ProgressFormatter.format(bar, destination.getColumns(), elapsedSeconds);
    }

    private void write(String text) {
        if (text.isEmpty()) {
            return;
        }
        destination.write(text);
        destination.flush();
    }

    private void raiseRedrawFailure() {
        RuntimeException failure = redrawFailure.getAndSet(null);
        if (failure != null) {
            throw failure;
        }
    }

    static String stripControlSequences(String text) {
        return CONTROL_SEQUENCE.matcher(text).replaceAll("");
    }

    public TextDestination getDestination() {
        return destination;
    }

    public TextWriterOptions getOptions() {
        return options;
    }

    /**
     * @return whether this writer draws progress bars and styled text
     */
    public boolean isInteractive() {
        return interactive;
    }

    /**
     * @return the number of bars currently shown
     */
    public int getActiveBarCount() {
        lock.lock();
        try {
            return region.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    private void checkNotClosed() {
        if (closed) {
            throw new IllegalStateException("TextWriterSink on " + destination + " has been closed");
        }
    }

    /**
     * Stops the background redrawer if there is one, draws bars that are still active at
     * their last state and moves the cursor below them, then releases the destination.
     * Idempotent. Write failures, including one left by the background redrawer, are
     * raised after the destination was released.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        RuntimeException failure = null;
        try {
            if (redrawer != null) {
                redrawer.close();
            }
            lock.lock();
            try {
                closed = true;
                if (!region.isEmpty()) {
                    logger.debug("Closing text writer with {} unfinished progress bars", region.size());
                    long now = nanoClock.getAsLong();
                    String text = region.clear() + region.draw(this::renderBar, now) + region.release();
                    region.clearBars();
                    destination.write(text);
                }
                destination.flush();
            } finally {
                lock.unlock();
            }
        } catch (RuntimeException e) {
            failure = e;
        } finally {
            closed = true;
            destination.release(this);
        }

        RuntimeException background = redrawFailure.getAndSet(null);
        if (background != null) {
            if (failure == null) {
                failure = background;
            } else {
                failure.addSuppressed(background);
            }
        }
        if (failure != null) {
            throw failure;
        }
        logger.debug("Closed text writer on {}", destination);
    }
}
