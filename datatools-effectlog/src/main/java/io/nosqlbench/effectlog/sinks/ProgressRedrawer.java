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

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Background thread of an asynchronous {@link TextWriterSink}. Every refresh interval it
 * runs the writer's redraw task, which repaints bars whose state changed since they were
 * last drawn.
 *
 * <p>The thread is a daemon named {@value #THREAD_NAME}. {@link #close()} signals it and
 * waits until it has exited, so no redraw happens after close returns. A redraw that
 * throws stops the thread; the exception goes to the failure handler so that the writer
 * can raise it on the caller's thread.
 *
 * <p>This class is package-private and should only be instantiated by
 * {@link TextWriterSink}.
 */
final class ProgressRedrawer implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(ProgressRedrawer.class);
    static final String THREAD_NAME = "TextWriterSink-Redrawer";

    private final Runnable redraw;
    private final long intervalNanos;
    private final Consumer<RuntimeException> failureHandler;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final Thread thread;

    ProgressRedrawer(Runnable redraw, Duration interval, Consumer<RuntimeException> failureHandler) {
        this.redraw = Objects.requireNonNull(redraw, "redraw");
        this.intervalNanos = interval.toNanos();
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
        this.thread = new Thread(this::runLoop, THREAD_NAME);
        this.thread.setDaemon(true);
    }

    void start() {
        thread.start();
        logger.debug("Started progress redrawer with interval {}ms", TimeUnit.NANOSECONDS.toMillis(intervalNanos));
    }

    boolean isAlive() {
        return thread.isAlive();
    }

    private void runLoop() {
        try {
            while (!stopSignal.await(intervalNanos, TimeUnit.NANOSECONDS)) {
                try {
                    redraw.run();
                } catch (RuntimeException e) {
                    logger.warn("Progress redraw failed, stopping redrawer: {}", e.getMessage());
                    failureHandler.accept(e);
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Stops the thread and waits for it to exit. Idempotent.
     */
    @Override
    public void close() {
        stopSignal.countDown();
        if (Thread.currentThread() == thread || !thread.isAlive()) {
            return;
        }
        boolean interrupted = false;
        while (thread.isAlive()) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        logger.debug("Progress redrawer stopped");
    }
}
