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

/**
 * Defines what happens to an event that reached the outer end of the handler stack
 * without any handler consuming or handling it. This is not an error condition.
 *
 * @see DefaultFallbackPolicy
 * @see io.nosqlbench.effectlog.sinks.LoggerFallbackPolicy
 * @since 4.0.0
 */
public interface FallbackPolicy {

    /**
     * Called for a log event nobody handled.
     *
     * @param event the unhandled event, as transformed by the handlers it passed through
     * @param dispatcher the stack the event came from, for re-emission
     */
    void onUnhandledLog(LogEvent event, EventDispatcher dispatcher);

    /**
     * Called for a progress event nobody handled. Progress iteration never depends on
     * what this method does.
     *
     * @param event the unhandled event
     * @param dispatcher the stack the event came from
     */
    default void onUnhandledProgress(ProgressEvent event, EventDispatcher dispatcher) {
    }
}
