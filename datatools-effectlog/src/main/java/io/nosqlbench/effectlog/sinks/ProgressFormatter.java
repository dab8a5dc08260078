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

import org.jline.utils.AttributedString;

import java.util.Locale;

/**
 * Formats one progress bar line.
 *
 * <p>Known total: {@code desc: 42%|████------| 42/100 [ 3s< 4s, 14.00it/s]}. Unknown
 * total: {@code desc: ----------- 42 [ 3s, 14.00it/s]}. The bar itself takes whatever
 * width is left, at least {@value #MIN_BAR_LENGTH} cells, and the line is cut at the
 * terminal width.
 */
final class ProgressFormatter {

    static final int MIN_BAR_LENGTH = 5;
    static final char FILLED = '█';
    static final char EMPTY = '-';
    static final String DONE_MARKER = " done";

    private static final long SECONDS_PER_DAY = 24 * 3600;

    private ProgressFormatter() {
    }

    /**
     * @param state the bar to render
     * @param columns the available width
     * @param elapsedSeconds time since the bar started
     * @return the rendered line without line terminator
     */
    static String format(BarState state, int columns, double elapsedSeconds) {
        String description = state.getDescription();
        String prefix = description.isEmpty() ? "" : description + ": ";
        long value = state.getCurrent();
        String rate = formatRate(value, elapsedSeconds);
        String elapsed = formatDuration(elapsedSeconds);

        String progress;
        String bar;
        String suffix;
        Long knownTotal = state.getTotal();
        if (knownTotal != null && knownTotal > 0) {
            long total = Math.max(value, knownTotal);
            int percentage = (int) Math.min(100, 100 * value / total);
            progress = percentage + "%|";
            double eta = value > 0 ? elapsedSeconds / value * (total - value) : Double.POSITIVE_INFINITY;
            suffix = "| " + value + "/" + total + " [" + elapsed + "<" + formatDuration(eta) + rate + "]";
            int length = barLength(columns, prefix, progress, suffix);
            int filled = (int) (length * value / total);
            bar = repeat(FILLED, filled) + repeat(EMPTY, length - filled);
        } else {
            progress = "";
            suffix = " " + value + " [" + elapsed + rate + "]" + (state.isFinished() ? DONE_MARKER : "");
            bar = repeat(EMPTY, barLength(columns, prefix, progress, suffix));
        }

        String line = prefix + progress + bar + suffix;
        return truncate(line, columns);
    }

    /**
     * Cuts a line to the given number of terminal cells. Wide characters count as two
     * cells and are never split.
     */
    static String truncate(String line, int columns) {
        AttributedString text = new AttributedString(line);
        return text.columnLength() > columns ? text.columnSubSequence(0, columns).toString() : line;
    }

    /**
     * Formats a duration as days, hours, minutes and seconds, leaving out leading zero
     * units. Seconds are only shown for durations under an hour.
     *
     * @param totalSeconds the duration, may be infinite
     * @return e.g. {@code " 1m 1s"}, {@code "1d 2h 3m"} or {@code "inf"}
     */
    static String formatDuration(double totalSeconds) {
        if (Double.isInfinite(totalSeconds) || Double.isNaN(totalSeconds)) {
            return "inf";
        }
        long days = (long) (totalSeconds / SECONDS_PER_DAY);
        double remaining = totalSeconds % SECONDS_PER_DAY;
        long hours = (long) (remaining / 3600);
        remaining %= 3600;
        long minutes = (long) (remaining / 60);
        double seconds = remaining % 60;

        StringBuilder out = new StringBuilder();
        if (days > 0) {
            out.append(days).append('d');
        }
        if (days > 0 || hours > 0) {
            out.append(String.format(Locale.ROOT, "%2dh", hours));
        }
        if (days > 0 || hours > 0 || minutes > 0) {
            out.append(String.format(Locale.ROOT, "%2dm", minutes));
        }
        if (days == 0 && hours == 0) {
            out.append(String.format(Locale.ROOT, "%2.0fs", seconds));
        }
        return out.toString();
    }

    /**
     * @return the rate suffix, including the leading separator
     */
    static String formatRate(long value, double elapsedSeconds) {
        if (elapsedSeconds > 0 && value > 0) {
            double rate = value / elapsedSeconds;
            if (rate >= 1) {
                return String.format(Locale.ROOT, ", %.2fit/s", rate);
            }
            return String.format(Locale.ROOT, ", %.2fs/it", 1 / rate);
        }
        return ", 0.00it/s";
    }

    private static int barLength(int columns, String prefix, String progress, String suffix) {
        return Math.max(MIN_BAR_LENGTH, columns - cells(prefix) - cells(progress) - cells(suffix));
    }

    static int cells(String text) {
        return new AttributedString(text).columnLength();
    }

    private static String repeat(char c, int count) {
        return String.valueOf(c).repeat(Math.max(0, count));
    }
}
