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

import io.nosqlbench.effectlog.EffectContext;
import io.nosqlbench.effectlog.ProgressBar;
import io.nosqlbench.effectlog.TextWriterScope;
import io.nosqlbench.effectlog.WriterMode;
import io.nosqlbench.effectlog.eventing.LogEvent;
import io.nosqlbench.effectlog.eventing.LogLevel;
import io.nosqlbench.effectlog.eventing.ProgressEvent;
import io.nosqlbench.effectlog.eventing.ProgressPhase;
import org.jline.terminal.Terminal;
import org.jline.terminal.impl.DumbTerminal;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies the text produced by {@link TextWriterSink} on plain and interactive destinations.
 */
class TextWriterSinkTest {

    private static final String K = "\u001B[K";
    private static final String CLEAR_BELOW = "\u001B[J";

    private final AtomicLong nanos = new AtomicLong();

    private TextWriterOptions.Builder options() {
        return TextWriterOptions.builder()
                .withColorOutput(false)
                .withNanoClock(nanos::get);
    }

    private static String line(String description, long current, Long total, int columns) {
        return ProgressFormatter.format(
                new BarState(ProgressEvent.of(1, total, current, description, ProgressPhase.ADVANCE), 0L), columns, 0.0);
    }

    private static String finishedLine(String description, long current, Long total, int columns) {
        BarState state = new BarState(ProgressEvent.of(1, total, current, description, ProgressPhase.FINISH), 0L);
        state.markFinished();
        return ProgressFormatter.format(state, columns, 0.0);
    }

    @Test
    void plainLogSessionIsTheConcatenationOfLines() {
        StringWriter out = new StringWriter();
        try (EffectContext context = new EffectContext("plain");
             TextWriterScope writer = context.textWriter(Destinations.of(out), options().build())) {
            assertFalse(writer.getSink().isInteractive());
            context.info("a");
            context.warning("b");
            context.error("c\nd");
        }
        assertEquals("[INFO] a\n[WARNING] b\n[ERROR] + c\n[ERROR] + d\n", out.toString());
    }

    @Test
    void plainDestinationNeverReceivesControlSequences() {
        StringWriter out = new StringWriter();
        try (EffectContext context = new EffectContext("plain-progress");
             TextWriterScope writer = context.textWriter(Destinations.of(out),
                     TextWriterOptions.builder().withTimestamps(true).withPid(true).build())) {
            context.info("before");
            try (ProgressBar<Integer> bar = context.progressbar(List.of(1, 2, 3), "hidden")) {
                for (Integer i : bar) {
                    context.debug("item " + i);
                }
            }
            context.info("\u001B[31mred\u001B[0m");
        }
        String text = out.toString();
        assertFalse(text.contains("\u001B"), text);
        assertFalse(text.contains("\r"), text);
        assertFalse(text.contains("hidden"), text);
        assertEquals(5, text.split("\n").length);
        assertTrue(text.contains("[INFO] (" + ProcessHandle.current().pid() + ") red\n"), text);
    }

    @Test
    void interactiveScenarioKeepsLogAndBarOutputApart() {
        StringWriter out = new StringWriter();
        try (EffectContext context = new EffectContext("tty");
             TextWriterScope writer = context.textWriter(Destinations.interactive(out, 80), options().build())) {
            assertTrue(writer.getSink().isInteractive());
            context.info("starting");
            try (ProgressBar<String> bar = context.progressbar(List.of("x", "y", "z"), "work")) {
                for (String ignored : bar) {
                    assertEquals(1, writer.getSink().getActiveBarCount());
                }
            }
            assertEquals(0, writer.getSink().getActiveBarCount());
            context.error("failed");
        }

        String expected = "[INFO] starting\n"
                + "\r" + line("work", 0, 3L, 80) + K
                + "\r" + line("work", 1, 3L, 80) + K
                + "\r" + line("work", 2, 3L, 80) + K
                + "\r" + line("work", 3, 3L, 80) + K
                + "\r" + line("work", 3, 3L, 80) + K + "\n"
                + "[ERROR] failed\n";
        assertEquals(expected, out.toString());
        assertTrue(line("work", 3, 3L, 80).startsWith("work: 100%|"));
    }

    @Test
    void logLinesClearAndRedrawActiveBars() {
        StringWriter out = new StringWriter();
        try (EffectContext context = new EffectContext("interleave");
             TextWriterScope ignored = context.textWriter(Destinations.interactive(out, 60), options().build());
             ProgressBar<Integer> bar = context.progressbar(List.of(1, 2), "rows")) {
            Iterator<Integer> it = bar.iterator();
            it.next();
            context.info("inside");
        }
        String expected = "\r" + line("rows", 0, 2L, 60) + K
                + "\r" + CLEAR_BELOW + "[INFO] inside\n" + "\r" + line("rows", 0, 2L, 60) + K;
        assertTrue(out.toString().startsWith(expected), out.toString());
    }

    @Test
    void innerBarFinishRestoresTheOuterRegion() {
        StringWriter out = new StringWriter();
        TextWriterSink sink;
        try (EffectContext context = new EffectContext("nested");
             TextWriterScope writer = context.textWriter(Destinations.interactive(out, 70), options().build())) {
            sink = writer.getSink();
            try (ProgressBar<String> outer = context.progressbar(List.of("a"), "outer")) {
                for (String ignored : outer) {
                    try (ProgressBar<Integer> inner = context.progressbar(List.of(1, 2), "inner")) {
                        for (Integer ignoredToo : inner) {
                            assertEquals(2, sink.getActiveBarCount());
                        }
                    }
                    assertEquals(1, sink.getActiveBarCount());
                }
            }
        }

        String outer0 = line("outer", 0, 1L, 70);
        String outer1 = line("outer", 1, 1L, 70);
        String expected = "\r" + outer0 + K
                + "\r" + CLEAR_BELOW + "\r" + outer0 + "\n" + line("inner", 0, 2L, 70) + K
                + "\r" + line("inner", 1, 2L, 70) + K
                + "\r" + line("inner", 2, 2L, 70) + K
                + "\r" + line("inner", 2, 2L, 70) + K
                + "\r\u001B[1A" + CLEAR_BELOW + "\r" + outer0 + K
                + "\r" + outer1 + K
                + "\r" + outer1 + K + "\n";
        assertEquals(expected, out.toString());
    }

    @Test
    void outerBarUpdatesMoveTheCursorAroundInnerBars() {
        StringWriter out = new StringWriter();
        try (EffectContext context = new EffectContext("cursor");
             TextWriterScope writer = context.textWriter(Destinations.interactive(out, 50), options().build())) {
            context.send(ProgressEvent.of(1, 4L, 0, "outer", ProgressPhase.START));
            context.send(ProgressEvent.of(2, 4L, 0, "inner", ProgressPhase.START));
            int mark = out.toString().length();
            context.send(ProgressEvent.of(1, 4L, 1, "outer", ProgressPhase.ADVANCE));
            assertEquals("\u001B[1A\r" + line("outer", 1, 4L, 50) + K + "\u001B[1B", out.toString().substring(mark));
            context.send(ProgressEvent.of(2, 4L, 4, "inner", ProgressPhase.FINISH));
            context.send(ProgressEvent.of(1, 4L, 4, "outer", ProgressPhase.FINISH));
        }
    }

    @Test
    void countsNeverGoBackwards() {
        StringWriter out = new StringWriter();
        try (EffectContext context = new EffectContext("monotonic");
             TextWriterScope ignored = context.textWriter(Destinations.interactive(out, 50), options().build())) {
            context.send(ProgressEvent.of(9, 10L, 0, "m", ProgressPhase.START));
            context.send(ProgressEvent.of(9, 10L, 5, "m", ProgressPhase.ADVANCE));
            int mark = out.toString().length();
            context.send(ProgressEvent.of(9, 10L, 2, "m", ProgressPhase.ADVANCE));
            assertEquals("\r" + line("m", 5, 10L, 50) + K, out.toString().substring(mark));
            context.send(ProgressEvent.of(9, 10L, 10, "m", ProgressPhase.FINISH));
        }
    }

    @Test
    void descriptionChangesRedrawTheBarLineInPlace() {
        StringWriter out = new StringWriter();
        try (EffectContext context = new EffectContext("describe");
             TextWriterScope ignored = context.textWriter(Destinations.interactive(out, 60), options().build())) {
            try (ProgressBar<String> bar = context.progressbar(List.of("a", "b"), "files", f -> "file " + f)) {
                for (String ignoredToo : bar) {
                }
            }
        }
        String expected = "\r" + line("files", 0, 2L, 60) + K
                + "\r" + line("file a", 0, 2L, 60) + K
                + "\r" + line("file a", 1, 2L, 60) + K
                + "\r" + line("file b", 1, 2L, 60) + K
                + "\r" + line("file b", 2, 2L, 60) + K
                + "\r" + line("file b", 2, 2L, 60) + K + "\n";
        assertEquals(expected, out.toString());
    }

    @Test
    void descriptionChangeOfAnOuterBarMovesAroundTheInnerBar() {
        StringWriter out = new StringWriter();
        try (EffectContext context = new EffectContext("describe-nested");
             TextWriterScope ignored = context.textWriter(Destinations.interactive(out, 60), options().build())) {
            context.send(ProgressEvent.of(1, 2L, 0, "outer", ProgressPhase.START));
            context.send(ProgressEvent.of(2, 3L, 0, "inner", ProgressPhase.START));
            int mark = out.toString().length();
            context.send(ProgressEvent.of(1, 2L, 0, "outer: part 1", ProgressPhase.DESCRIPTION_CHANGE));
            assertEquals("\u001B[1A\r" + line("outer: part 1", 0, 2L, 60) + K + "\u001B[1B",
                    out.toString().substring(mark));

            mark = out.toString().length();
            context.send(ProgressEvent.of(2, 3L, 0, "inner: x", ProgressPhase.DESCRIPTION_CHANGE));
            assertEquals("\r" + line("inner: x", 0, 3L, 60) + K, out.toString().substring(mark));

            context.send(ProgressEvent.of(2, 3L, 3, "inner: x", ProgressPhase.FINISH));
            context.send(ProgressEvent.of(1, 2L, 2, "outer: part 1", ProgressPhase.FINISH));
        }
    }

    @Test
    void unknownTotalBarFinishesWithDoneMarker() {
        StringWriter out = new StringWriter();
        Iterable<Integer> generated = () -> List.of(1, 2).iterator();
        try (EffectContext context = new EffectContext("unknown-total");
             TextWriterScope ignored = context.textWriter(Destinations.interactive(out, 60), options().build())) {
            context.forEachWithProgress(generated, "stream", i -> { });
        }
        String done = finishedLine("stream", 2, null, 60);
        assertTrue(done.endsWith(" 2 [ 0s, 0.00it/s] done"), done);
        String expected = "\r" + line("stream", 0, null, 60) + K
                + "\r" + line("stream", 1, null, 60) + K
                + "\r" + line("stream", 2, null, 60) + K
                + "\r" + done + K + "\n";
        assertEquals(expected, out.toString());
    }

    @Test
    void plainDestinationStripsNonCsiEscapes() {
        StringWriter out = new StringWriter();
        try (EffectContext context = new EffectContext("escapes");
             TextWriterScope ignored = context.textWriter(Destinations.of(out), options().build())) {
            context.info("\u001B7saved\u001B8 \u001B]0;title\u0007shown \u001B]8;;http://x\u001B\\link\u001B(B");
        }
        assertEquals("[INFO] saved shown link\n", out.toString());
    }

    @Test
    void throttledRedrawsSkipUpdatesInsideTheInterval() {
        StringWriter out = new StringWriter();
        TextWriterOptions throttled = options().withMinRedrawInterval(Duration.ofSeconds(1)).build();
        try (EffectContext context = new EffectContext("throttle");
             TextWriterScope ignored = context.textWriter(Destinations.interactive(out, 50), throttled)) {
            context.send(ProgressEvent.of(1, 10L, 0, "t", ProgressPhase.START));
            int mark = out.toString().length();

            nanos.set(TimeUnit.MILLISECONDS.toNanos(100));
            context.send(ProgressEvent.of(1, 10L, 1, "t", ProgressPhase.ADVANCE));
            assertEquals(mark, out.toString().length());

            nanos.set(TimeUnit.MILLISECONDS.toNanos(1500));
            context.send(ProgressEvent.of(1, 10L, 2, "t", ProgressPhase.ADVANCE));
            assertTrue(out.toString().substring(mark).contains("2/10"));

            context.send(ProgressEvent.of(1, 10L, 10, "t", ProgressPhase.FINISH));
        }
    }

    @Test
    void asyncUpdatesAreDrawnByTheRedrawer() throws InterruptedException {
        StringWriter out = new StringWriter();
        TextWriterOptions async = options().withAsync(true).withRefreshInterval(Duration.ofMillis(10)).build();
        try (EffectContext context = new EffectContext("async");
             TextWriterScope ignored = context.textWriter(Destinations.interactive(out, 50), async)) {
            context.send(ProgressEvent.of(1, 10L, 0, "bg", ProgressPhase.START));
            context.send(ProgressEvent.of(1, 10L, 7, "bg", ProgressPhase.ADVANCE));

            long deadline = System.currentTimeMillis() + 5000;
            while (!snapshot(out).contains("7/10") && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            assertTrue(snapshot(out).contains(line("bg", 7, 10L, 50)));
            context.send(ProgressEvent.of(1, 10L, 10, "bg", ProgressPhase.FINISH));
        }
        assertTrue(out.toString().endsWith(line("bg", 10, 10L, 50) + K + "\n"));
        assertFalse(redrawerThreadAlive());
    }

    @Test
    void asyncCloseShowsFinalStateOfEveryBar() {
        StringWriter out = new StringWriter();
        TextWriterOptions async = options().withAsync(true).withRefreshInterval(Duration.ofSeconds(30)).build();
        try (EffectContext context = new EffectContext("async-final")) {
            TextWriterScope writer = context.textWriter(Destinations.interactive(out, 50), async);
            context.forEachWithProgress(List.of(1, 2, 3, 4), "quick", i -> { });
            context.send(ProgressEvent.of(99, 5L, 0, "abandoned", ProgressPhase.START));
            context.send(ProgressEvent.of(99, 5L, 3, "abandoned", ProgressPhase.ADVANCE));
            assertFalse(snapshot(out).contains("3/5"));
            writer.close();
        }
        String text = out.toString();
        assertTrue(text.contains(line("quick", 4, 4L, 50)), text);
        assertTrue(text.endsWith(line("abandoned", 3, 5L, 50) + K + "\n"), text);
        assertFalse(redrawerThreadAlive());
    }

    @Test
    void redrawFailureIsRaisedOnTheCallerThread() throws InterruptedException {
        FailingWriter target = new FailingWriter();
        TextWriterOptions async = options().withAsync(true).withRefreshInterval(Duration.ofMillis(10)).build();
        try (EffectContext context = new EffectContext("async-failure");
             TextWriterScope ignored = context.textWriter(Destinations.interactive(target, 50), async)) {
            context.send(ProgressEvent.of(1, 10L, 0, "f", ProgressPhase.START));
            target.failing.set(true);
            context.send(ProgressEvent.of(1, 10L, 1, "f", ProgressPhase.ADVANCE));

            long deadline = System.currentTimeMillis() + 5000;
            while ((target.failures.get() == 0 || redrawerThreadAlive()) && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            assertTrue(target.failures.get() > 0);
            assertFalse(redrawerThreadAlive());
            target.failing.set(false);

            assertThrows(UncheckedIOException.class, () -> context.info("after failure"));
            context.info("recovered");
            context.send(ProgressEvent.of(1, 10L, 10, "f", ProgressPhase.FINISH));
        }
        assertTrue(target.toString().contains("[INFO] recovered\n"));
    }

    @Test
    void twoWritersBothReceiveEveryLogEvent() {
        StringWriter first = new StringWriter();
        StringWriter second = new StringWriter();
        try (EffectContext context = new EffectContext("fanout");
             TextWriterScope a = context.textWriter(Destinations.of(first), options().build());
             TextWriterScope b = context.textWriter(Destinations.interactive(second, 40), options().build())) {
            context.info("one");
            context.forEachWithProgress(List.of(1), "p", i -> { });
            context.log(LogLevel.DEBUG, "two");
        }
        assertEquals("[INFO] one\n[DEBUG] two\n", first.toString());
        assertTrue(second.toString().startsWith("[INFO] one\n"));
        assertTrue(second.toString().endsWith("[DEBUG] two\n"));
    }

    @Test
    void aDestinationHasOneOwnerAtATime() {
        TextDestination destination = Destinations.of(new StringWriter());
        try (EffectContext context = new EffectContext("owner")) {
            TextWriterScope first = context.textWriter(destination, options().build());
            assertThrows(IllegalStateException.class, () -> context.textWriter(destination, options().build()));
            assertEquals(1, context.getHandlers().size());
            first.close();
            assertNull(destination.getOwner());
            try (TextWriterScope second = context.textWriter(destination, options().build())) {
                assertSame(second.getSink(), destination.getOwner());
            }
        }
    }

    @Test
    void closingTheContextClosesOpenWriters() {
        TextDestination destination = Destinations.of(new StringWriter());
        EffectContext context = new EffectContext("cleanup");
        TextWriterScope writer = context.textWriter(destination, options().build());
        context.close();
        assertTrue(writer.isClosed());
        assertNull(destination.getOwner());
        assertTrue(context.getHandlers().isEmpty());
    }

    @Test
    void closedSinkRejectsEvents() {
        TextWriterSink sink = new TextWriterSink(Destinations.of(new StringWriter()), options().build());
        sink.close();
        sink.close();
        assertTrue(sink.isClosed());
        assertThrows(IllegalStateException.class, () -> sink.onLog(LogEvent.of(LogLevel.INFO, "late")));
    }

    @Test
    void unwritableWriterRaisesFromTheLogCall() {
        FailingWriter target = new FailingWriter();
        target.failing.set(true);
        try (EffectContext context = new EffectContext("broken-writer");
             TextWriterScope ignored = context.textWriter(Destinations.of(target), options().build())) {
            assertThrows(UncheckedIOException.class, () -> context.info("lost"));
            target.failing.set(false);
        }
    }

    @Test
    void unwritablePrintStreamRaisesFromTheLogCall() {
        PrintStream broken = new PrintStream(new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("device gone");
            }
        });
        try (EffectContext context = new EffectContext("broken-stream")) {
            TextWriterScope writer = context.textWriter(Destinations.of(broken), options().build());
            assertThrows(UncheckedIOException.class, () -> context.error("lost"));
            assertThrows(UncheckedIOException.class, writer::close);
            assertTrue(writer.isClosed());
        }
    }

    @Test
    void dumbTerminalIsRenderedAsPlainText() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (Terminal terminal = new DumbTerminal(new ByteArrayInputStream(new byte[0]), bytes)) {
            TextDestination destination = Destinations.of(terminal);
            assertFalse(destination.isInteractive());
            assertTrue(destination.getColumns() > 0);
            try (EffectContext context = new EffectContext("dumb");
                 TextWriterScope ignored = context.textWriter(destination, TextWriterOptions.defaults())) {
                context.warning("careful");
                context.forEachWithProgress(List.of(1, 2), "hidden", i -> { });
            }
        }
        String text = bytes.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("[WARNING] careful"), text);
        assertFalse(text.contains("hidden"), text);
        assertFalse(text.contains("\u001B["), text);
    }

    @Test
    void writerModeOverridesDetection() {
        StringWriter out = new StringWriter();
        TextWriterOptions forced = options().withWriterMode(WriterMode.INTERACTIVE).build();
        try (EffectContext context = new EffectContext("forced");
             TextWriterScope writer = context.textWriter(Destinations.of(out), forced)) {
            assertTrue(writer.getSink().isInteractive());
            context.forEachWithProgress(List.of(1), "shown", i -> { });
        }
        assertTrue(out.toString().contains("shown: 100%|"));

        TextWriterOptions plain = options().withWriterMode(WriterMode.PLAIN).build();
        try (EffectContext context = new EffectContext("plain-forced");
             TextWriterScope writer = context.textWriter(Destinations.interactive(new StringWriter(), 80), plain)) {
            assertFalse(writer.getSink().isInteractive());
        }
    }

    private static String snapshot(StringWriter out) {
        synchronized (out.getBuffer()) {
            return out.toString();
        }
    }

    private static boolean redrawerThreadAlive() {
        return Thread.getAllStackTraces().keySet().stream()
                .anyMatch(t -> t.getName().equals(ProgressRedrawer.THREAD_NAME) && t.isAlive());
    }

    private static final class FailingWriter extends Writer {
        final AtomicBoolean failing = new AtomicBoolean();
        final AtomicInteger failures = new AtomicInteger();
        private final StringBuffer written = new StringBuffer();

        @Override
        public void write(char[] cbuf, int off, int len) throws IOException {
            if (failing.get()) {
                failures.incrementAndGet();
                throw new IOException("write refused");
            }
            written.append(cbuf, off, len);
        }

        @Override
        public void write(String str) throws IOException {
            write(str.toCharArray(), 0, str.length());
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }

        @Override
        public String toString() {
            return written.toString();
        }
    }
}
