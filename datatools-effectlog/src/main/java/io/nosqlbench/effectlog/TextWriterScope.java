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

import io.nosqlbench.effectlog.sinks.TextWriterSink;

/**
 * A text writer installed in an {@link EffectContext}. While open, the wrapped
 * {@link TextWriterSink} receives every log and progress event of the context. Closing the
 * scope removes the sink from the handler stack and then closes it, which stops and joins
 * its redraw thread and writes the final progress state. Both steps run even if the
 * other fails.
 *
 * <pre>{@code
 * try (TextWriterScope writer = context.textWriter(Destinations.of(System.err))) {
 *     context.info("rendered to stderr");
 * }
 * }</pre>
 *
 * @see EffectContext#textWriter(io.nosqlbench.effectlog.sinks.TextDestination)
 * @since 4.0.0
 */
public final class TextWriterScope implements AutoCloseable {

    private final EffectContext context;
    private final TextWriterSink sink;
    private final HandlerRegistration registration;

    TextWriterScope(EffectContext context, TextWriterSink sink, HandlerRegistration registration) {
        this.context = context;
        this.sink = sink;
        this.registration = registration;
    }

    public TextWriterSink getSink() {
        return sink;
    }

    public boolean isClosed() {
        return registration.isClosed() && sink.isClosed();
    }

    @Override
    public void close() {
        try {
            registration.close();
        } finally {
            try {
                sink.close();
            } finally {
                context.onWriterClosed(this);
            }
        }
    }
}
