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

import io.nosqlbench.effectlog.eventing.Disposition;
import io.nosqlbench.effectlog.eventing.EventHandler;
import io.nosqlbench.effectlog.eventing.LogEvent;
import io.nosqlbench.effectlog.eventing.ProgressEvent;

import java.util.Objects;

/**
 * Tags everything emitted inside a scope with a context label. Log events are forwarded
 * as derived events whose text starts with {@code [label] }; progress descriptions get the
 * same prefix. The original events are never modified.
 *
 * <pre>{@code
 * try (HandlerRegistration tag = context.install(new ContextPrefixHandler("shard-3"))) {
 *     context.info("compacting");   // [INFO] [shard-3] compacting
 * }
 * }</pre>
 */
public class ContextPrefixHandler implements EventHandler {

    private final String label;
    private final String prefix;

    public ContextPrefixHandler(String label) {
        this.label = Objects.requireNonNull(label, "label");
        this.prefix = "[" + label + "] ";
    }

    @Override
    public Disposition<LogEvent> onLog(LogEvent event) {
        return Disposition.forward(event.withPrefix(prefix));
    }

    @Override
    public Disposition<ProgressEvent> onProgress(ProgressEvent event) {
        return Disposition.forward(event.withDescription(prefix + event.getDescription()));
    }

    public String getLabel() {
        return label;
    }
}
