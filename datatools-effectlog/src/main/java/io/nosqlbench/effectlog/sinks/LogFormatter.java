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

import io.nosqlbench.effectlog.eventing.LogEvent;
import io.nosqlbench.effectlog.eventing.LogLevel;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Turns a {@link LogEvent} into newline-terminated text.
 *
 * <p>A single-line message renders as {@code [INFO] message}. With timestamps and pids
 * enabled the record reads {@code [ 2025-01-31 12:00:00.000 ] [INFO] (4242) message}.
 * Multi-line messages repeat the prefix on every line and frame the text:
 * <pre>
 * [INFO] + first
 * [INFO] | middle
 * [INFO] + last
 * </pre>
 */
final class LogFormatter {

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private static final AttributedStyle STYLE_DEBUG = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.BLACK);
    private static final AttributedStyle STYLE_WARNING = AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW);
    private static final AttributedStyle STYLE_ERROR = AttributedStyle.DEFAULT.foreground(AttributedStyle.RED);
    private static final AttributedStyle STYLE_PID = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.BLACK);

    private final boolean showTimestamp;
    private final boolean showPid;
    private final boolean color;
    private final ZoneId zone;
    private final long pid;

    LogFormatter(boolean showTimestamp, boolean showPid, boolean color) {
        this(showTimestamp, showPid, color, ZoneId.systemDefault());
    }

    LogFormatter(boolean showTimestamp, boolean showPid, boolean color, ZoneId zone) {
        this.showTimestamp = showTimestamp;
        this.showPid = showPid;
        this.color = color;
        this.zone = zone;
        this.pid = ProcessHandle.current().pid();
    }

    String format(LogEvent event) {
        String prefix = prefix(event);
        String[] lines = event.getText().split("\n", -1);
        StringBuilder out = new StringBuilder();
        if (lines.length == 1) {
            out.append(prefix).append(lines[0]).append('\n');
            return out.toString();
        }
        for (int i = 0; i < lines.length; i++) {
            String frame = (i == 0 || i == lines.length - 1) ? "+ " : "| ";
            out.append(prefix).append(frame).append(lines[i]).append('\n');
        }
        return out.toString();
    }

    private String prefix(LogEvent event) {
        LogLevel level = event.getLevel();
        AttributedStringBuilder builder = new AttributedStringBuilder();
        if (showTimestamp) {
            builder.append("[ ").append(LocalDateTime.ofInstant(Instant.ofEpochMilli(event.getTimestamp()), zone).format(TIMESTAMP_FORMAT)).append(" ] ");
        }
        builder.append("[");
        AttributedStyle style = color ? styleFor(level) : null;
        if (style != null) {
            builder.styled(style, level.getName());
        } else {
            builder.append(level.getName());
        }
        builder.append("] ");
        if (showPid) {
            String pidText = "(" + pid + ")";
            if (color) {
                builder.styled(STYLE_PID, pidText);
            } else {
                builder.append(pidText);
            }
            builder.append(" ");
        }
        return color ? builder.toAnsi() : builder.toString();
    }

    private static AttributedStyle styleFor(LogLevel level) {
        if (LogLevel.DEBUG.equals(level)) {
            return STYLE_DEBUG;
        }
        if (LogLevel.WARNING.equals(level)) {
            return STYLE_WARNING;
        }
        if (LogLevel.ERROR.equals(level)) {
            return STYLE_ERROR;
        }
        return null;
    }
}
