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

package io.nosqlbench.effectlog;

import io.nosqlbench.effectlog.eventing.EventHandler;

/**
 * Handle for a handler installed in an {@link EffectContext}. Closing it removes the
 * handler from the stack; closing twice has no further effect.
 *
 * <pre>{@code
 * try (HandlerRegistration registration = context.install(myHandler)) {
 *     context.info("seen by myHandler");
 * }
 * context.info("no longer seen by myHandler");
 * }</pre>
 *
 * @since 4.0.0
 */
public final class HandlerRegistration implements AutoCloseable {

    private final EffectContext context;
    private final EventHandler handler;
    private volatile boolean closed = false;

    HandlerRegistration(EffectContext context, EventHandler handler) {
        this.context = context;
        this.handler = handler;
    }

    public EventHandler getHandler() {
        return handler;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        context.uninstall(this);
    }
}
