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
 * Something that can put events into a handler stack. Implemented by
 * {@link io.nosqlbench.effectlog.EffectContext}; handed to the {@link FallbackPolicy}
 * so it can re-emit through the same stack.
 *
 * @since 4.0.0
 */
public interface EventDispatcher {

    void send(LogEvent event);

    void send(ProgressEvent event);
}
