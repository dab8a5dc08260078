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

package io.nosqlbench.effectlog.eventing;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * An immutable log message travelling through the handler stack of an
 * {@link io.nosqlbench.effectlog.EffectContext}. The message is kept as given and
 * only turned into text when a handler asks for it via {@link #getText()}, so the
 * formatting cost of discarded messages is never paid. A {@link Supplier} message is
 * invoked at that point instead of being stringified directly.
 *
 * <p>Handlers that want to change a message build a derived event with
 * {@link #withMessage(Object)}, {@link #withLevel(LogLevel)} or {@link #withPrefix(String)}
 * and forward that one; the original instance is never mutated.
 *
 * <p>Events created by the {@link FallbackPolicy} carry the {@link #isFallback() fallback}
 * tag so that the policy never applies to them a second time.
 *
 * @see LogLevel
 * @see EventHandler#onLog(LogEvent)
 * @since 4.0.0
 */
public final class LogEvent {

    private final LogLevel level;
    private final Object message;
    private final boolean fallback;
    private final long timestamp;
    private volatile String text;

    private LogEvent(LogLevel level, Object message, boolean fallback, long timestamp) {
        this.level = Objects.requireNonNull(level, "level");
        this.message = message;
        this.fallback = fallback;
        this.timestamp = timestamp;
    }

    /**
     * Creates a log event stamped with the current time.
     *
     * @param level the severity, must not be null
     * @param message the message object or a {@link Supplier} of it; may be null
     * @return a new event
     * @throws NullPointerException if level is null
     */
    public static LogEvent of(LogLevel level, Object message) {
        return new LogEvent(level, message, false, System.currentTimeMillis());
    }

    /**
     * Creates the WARNING event emitted for a log event that no handler processed.
     *
     * @param unhandled the event that reached the end of the stack
     * @return a fallback-tagged WARNING event describing the unhandled one
     */
    public static LogEvent fallbackFor(LogEvent unhandled) {
        Supplier<String> text = () -> "No handler processed log message (level="
                + unhandled.getLevel().getName() + "): " + unhandled.getText();
        return new LogEvent(LogLevel.WARNING, text, true, unhandled.timestamp);
    }

    public LogLevel getLevel() {
        return level;
    }

    /**
     * Returns the raw message object as it was passed at construction.
     *
     * @return the message, possibly a {@link Supplier} or null
     */
    public Object getMessage() {
        return message;
    }

    /**
     * Returns the rendered message text, computing it on first access.
     *
     * @return the message text, "null" for a null message
     */
    public String getText() {
        String rendered = text;
        if (rendered == null) {
            Object value = message;
            if (value instanceof Supplier) {
                value = ((Supplier<?>) value).get();
            }
            rendered = String.valueOf(value);
            text = rendered;
        }
        return rendered;
    }

    public boolean isFallback() {
        return fallback;
    }

    /**
     * @return creation time in epoch milliseconds
     */
    public long getTimestamp() {
        return timestamp;
    }

    public LogEvent withLevel(LogLevel newLevel) {
        return new LogEvent(newLevel, message, fallback, timestamp);
    }

    public LogEvent withMessage(Object newMessage) {
        return new LogEvent(level, newMessage, fallback, timestamp);
    }

    /**
     * Derives an event whose text is {@code prefix} followed by this event's text.
     * The original text is still rendered lazily.
     *
     * @param prefix text to prepend
     * @return a derived event
     */
    public LogEvent withPrefix(String prefix) {
        Supplier<String> prefixed = () -> prefix + getText();
        return new LogEvent(level, prefixed, fallback, timestamp);
    }

    @Override
    public String toString() {
        return "LogEvent{" + level + (fallback ? ", fallback" : "") + ", " + getText() + "}";
    }
}
