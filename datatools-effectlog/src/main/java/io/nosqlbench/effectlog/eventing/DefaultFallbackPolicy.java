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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The standard fallback. An unhandled log event is re-emitted once through the same
 * stack as a WARNING naming the lost message. The re-emitted event carries the fallback
 * tag; if it is not handled either, it is dropped. Unhandled progress events have no
 * visible effect.
 *
 * @since 4.0.0
 */
public final class DefaultFallbackPolicy implements FallbackPolicy {

    private static final Logger logger = LogManager.getLogger(DefaultFallbackPolicy.class);
    private static final DefaultFallbackPolicy INSTANCE = new DefaultFallbackPolicy();

    private DefaultFallbackPolicy() {
    }

    public static DefaultFallbackPolicy getInstance() {
        return INSTANCE;
    }

    @Override
    public void onUnhandledLog(LogEvent event, EventDispatcher dispatcher) {
        if (event.isFallback()) {
            logger.trace("Dropping unhandled fallback event: {}", event);
            return;
        }
        dispatcher.send(LogEvent.fallbackFor(event));
    }
}
