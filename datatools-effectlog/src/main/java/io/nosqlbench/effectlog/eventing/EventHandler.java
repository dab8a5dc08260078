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

import io.nosqlbench.effectlog.EffectContext;
import io.nosqlbench.effectlog.sinks.LoggerEventHandler;
import io.nosqlbench.effectlog.sinks.TextWriterSink;

/**
 * A contract for objects installed in the handler stack of an {@link EffectContext}.
 * Every emitted event is offered to the installed handlers from the innermost (most
 * recently installed) outward. Each handler returns a {@link Disposition} that either
 * stops the event, passes it on unchanged or modified, or passes it on marked as handled.
 *
 * <p>Both methods default to forwarding the event untouched, so a handler only overrides
 * the event kind it cares about.
 *
 * <h2>Examples</h2>
 *
 * <h3>Adding context to every log line</h3>
 * <pre>{@code
 * EventHandler requestTag = new EventHandler() {
 *     @Override
 *     public Disposition<LogEvent> onLog(LogEvent event) {
 *         return Disposition.forward(event.withPrefix("[req-42] "));
 *     }
 * };
 * try (HandlerRegistration ignored = context.install(requestTag)) {
 *     context.info("started");   // renders as "[INFO] [req-42] started"
 * }
 * }</pre>
 *
 * <h3>Silencing debug output</h3>
 * <pre>{@code
 * EventHandler quiet = new EventHandler() {
 *     @Override
 *     public Disposition<LogEvent> onLog(LogEvent event) {
 *         return event.getLevel().isAtLeast(LogLevel.INFO)
 *             ? Disposition.forward(event)
 *             : Disposition.consumed();
 *     }
 * };
 * }</pre>
 *
 * <h2>Error Handling</h2>
 * <p>Exceptions thrown by a handler are not caught by the dispatcher; they propagate out
 * of the {@code log}/{@code progress} call that triggered them.
 *
 * <h2>Thread Safety</h2>
 * <p>Dispatch runs on the thread that emitted the event. A handler shared between threads
 * must synchronize its own state.
 *
 * @see EffectContext#install(EventHandler)
 * @see TextWriterSink
 * @see LoggerEventHandler
 * @since 4.0.0
 */
public interface EventHandler {

    /**
     * Offers a log event to this handler.
     *
     * @param event the event, possibly already transformed by inner handlers
     * @return what to do with the event next
     */
    default Disposition<LogEvent> onLog(LogEvent event) {
        return Disposition.forward(event);
    }

    /**
     * Offers a progress event to this handler.
     *
     * @param event the event, possibly already transformed by inner handlers
     * @return what to do with the event next
     */
    default Disposition<ProgressEvent> onProgress(ProgressEvent event) {
        return Disposition.forward(event);
    }
}
