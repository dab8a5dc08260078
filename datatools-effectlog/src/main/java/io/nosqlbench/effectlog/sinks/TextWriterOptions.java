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

import io.nosqlbench.effectlog.WriterMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Immutable configuration of a {@link TextWriterSink}.
 *
 * <p>Options can be preset for a whole process with system properties and then refined
 * per writer with the builder:</p>
 * <ul>
 *   <li>{@value #PROP_WRITER_MODE} - auto, tty or plain, see {@link WriterMode#fromString(String)}</li>
 *   <li>{@value #PROP_ASYNC} - true to redraw progress on a background thread</li>
 *   <li>{@value #PROP_REFRESH_MILLIS} - background redraw interval in milliseconds</li>
 * </ul>
 * <p>Unparseable property values are reported at warn level and ignored.</p>
 *
 * <pre>{@code
 * TextWriterOptions options = TextWriterOptions.fromSystemProperties()
 *     .withAsync(true)
 *     .withRefreshInterval(Duration.ofMillis(50))
 *     .build();
 * }</pre>
 *
 * @since 4.0.0
 */
public final class TextWriterOptions {

    private static final Logger logger = LogManager.getLogger(TextWriterOptions.class);

    public static final String PROP_WRITER_MODE = "nb.effectlog.writer";
    public static final String PROP_ASYNC = "nb.effectlog.async";
    public static final String PROP_REFRESH_MILLIS = "nb.effectlog.refresh.ms";

    public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofMillis(100);
    public static final Duration MIN_REFRESH_INTERVAL = Duration.ofMillis(10);

    private final boolean async;
    private final Duration refreshInterval;
    private final Duration minRedrawInterval;
    private final boolean showTimestamp;
    private final boolean showPid;
    private final boolean colorOutput;
    private final WriterMode writerMode;
    private final LongSupplier nanoClock;

    private TextWriterOptions(Builder builder) {
        this.async = builder.async;
        this.refreshInterval = builder.refreshInterval;
        this.minRedrawInterval = builder.minRedrawInterval;
        this.showTimestamp = builder.showTimestamp;
        this.showPid = builder.showPid;
        this.colorOutput = builder.colorOutput;
        this.writerMode = builder.writerMode;
        this.nanoClock = builder.nanoClock;
    }

    /**
     * @return the default options, ignoring system properties
     */
    public static TextWriterOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a builder preset from the {@code nb.effectlog.*} system properties.
     *
     * @return a builder that may be refined further
     */
    public static Builder fromSystemProperties() {
        Builder builder = new Builder();

        String mode = System.getProperty(PROP_WRITER_MODE);
        if (mode != null) {
            try {
                builder.withWriterMode(WriterMode.fromString(mode));
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring {}: {}", PROP_WRITER_MODE, e.getMessage());
            }
        }

        String async = System.getProperty(PROP_ASYNC);
        if (async != null) {
            String normalized = async.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("true") || normalized.equals("false")) {
                builder.withAsync(Boolean.parseBoolean(normalized));
            } else {
                logger.warn("Ignoring {}: expected true or false, got '{}'", PROP_ASYNC, async);
            }
        }

        String refresh = System.getProperty(PROP_REFRESH_MILLIS);
        if (refresh != null) {
            try {
                builder.withRefreshInterval(Duration.ofMillis(Long.parseLong(refresh.trim())));
            } catch (NumberFormatException e) {
                logger.warn("Ignoring {}: '{}' is not a number of milliseconds", PROP_REFRESH_MILLIS, refresh);
            }
        }
        return builder;
    }

    public boolean isAsync() {
        return async;
    }

    public Duration getRefreshInterval() {
        return refreshInterval;
    }

    public Duration getMinRedrawInterval() {
        return minRedrawInterval;
    }

    public boolean isShowTimestamp() {
        return showTimestamp;
    }

    public boolean isShowPid() {
        return showPid;
    }

    public boolean isColorOutput() {
        return colorOutput;
    }

    public WriterMode getWriterMode() {
        return writerMode;
    }

    /**
     * @return the monotonic clock used for elapsed time, rate and throttling
     */
    public LongSupplier getNanoClock() {
        return nanoClock;
    }

    @Override
    public String toString() {
        return "TextWriterOptions{async=" + async
                + ", refreshInterval=" + refreshInterval
                + ", minRedrawInterval=" + minRedrawInterval
                + ", showTimestamp=" + showTimestamp
                + ", showPid=" + showPid
                + ", colorOutput=" + colorOutput
                + ", writerMode=" + writerMode + '}';
    }

    /**
     * Builder for {@link TextWriterOptions}.
     */
    public static final class Builder {
        private boolean async = false;
        private Duration refreshInterval = DEFAULT_REFRESH_INTERVAL;
        private Duration minRedrawInterval = Duration.ZERO;
        private boolean showTimestamp = false;
        private boolean showPid = false;
        private boolean colorOutput = true;
        private WriterMode writerMode = WriterMode.AUTO;
        private LongSupplier nanoClock = System::nanoTime;

        private Builder() {
        }

        /**
         * Redraws progress changes on a background thread instead of on the emitting
         * thread. Defaults to false.
         *
         * @param async whether to redraw asynchronously
         * @return this builder
         */
        public Builder withAsync(boolean async) {
            this.async = async;
            return this;
        }

        /**
         * Sets the background redraw interval used when async. Intervals shorter than
         * 10ms are raised to 10ms. Default is 100ms.
         *
         * @param interval the redraw interval
         * @return this builder
         * @throws IllegalArgumentException if interval is negative
         */
        public Builder withRefreshInterval(Duration interval) {
            Objects.requireNonNull(interval, "interval");
            if (interval.isNegative()) {
                throw new IllegalArgumentException("refresh interval must not be negative: " + interval);
            }
            if (interval.compareTo(MIN_REFRESH_INTERVAL) < 0) {
                logger.warn("Refresh interval {}ms is below the minimum, using {}ms",
                        interval.toMillis(), MIN_REFRESH_INTERVAL.toMillis());
                interval = MIN_REFRESH_INTERVAL;
            }
            this.refreshInterval = interval;
            return this;
        }

        /**
         * Limits how often a synchronous writer redraws a bar for ADVANCE and description
         * changes. Start and finish are always drawn. Default is zero, redraw every event.
         *
         * @param interval minimum time between two redraws of the same bar
         * @return this builder
         * @throws IllegalArgumentException if interval is negative
         */
        public Builder withMinRedrawInterval(Duration interval) {
            Objects.requireNonNull(interval, "interval");
            if (interval.isNegative()) {
                throw new IllegalArgumentException("min redraw interval must not be negative: " + interval);
            }
            this.minRedrawInterval = interval;
            return this;
        }

        public Builder withTimestamps(boolean showTimestamp) {
            this.showTimestamp = showTimestamp;
            return this;
        }

        public Builder withPid(boolean showPid) {
            this.showPid = showPid;
            return this;
        }

        /**
         * Enables colored level names. Only takes effect on interactive destinations.
         */
        public Builder withColorOutput(boolean colorOutput) {
            this.colorOutput = colorOutput;
            return this;
        }

        public Builder withWriterMode(WriterMode writerMode) {
            this.writerMode = Objects.requireNonNull(writerMode, "writerMode");
            return this;
        }

        /**
         * Replaces the monotonic clock, in nanoseconds. Intended for tests.
         */
        public Builder withNanoClock(LongSupplier nanoClock) {
            this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
            return this;
        }

        public TextWriterOptions build() {
            return new TextWriterOptions(this);
        }
    }
}
