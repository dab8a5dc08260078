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

/**
 * Event handlers that render events: the terminal {@link io.nosqlbench.effectlog.sinks.TextWriterSink}
 * and its destinations, plus handlers that bridge events into Log4j 2.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link io.nosqlbench.effectlog.sinks.TextWriterSink} - Log lines and nested progress bars on a text destination</li>
 *   <li>{@link io.nosqlbench.effectlog.sinks.TextWriterOptions} - Async redraw, throttling and line format options</li>
 *   <li>{@link io.nosqlbench.effectlog.sinks.Destinations} - Console, stream, writer and JLine terminal destinations</li>
 *   <li>{@link io.nosqlbench.effectlog.sinks.LoggerEventHandler} - Routes events into a Log4j logger</li>
 *   <li>{@link io.nosqlbench.effectlog.sinks.LoggerFallbackPolicy} - Sends unhandled log events to Log4j</li>
 *   <li>{@link io.nosqlbench.effectlog.sinks.ContextPrefixHandler} - Tags events with a scope label</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (EffectContext context = new EffectContext("load");
 *      TextWriterScope console = context.textWriter(Destinations.console(),
 *          TextWriterOptions.builder().withAsync(true).build())) {
 *     context.forEachWithProgress(files, "loading", this::load);
 * }
 * }</pre>
 *
 * @see io.nosqlbench.effectlog.EffectContext
 * @since 4.0.0
 */
package io.nosqlbench.effectlog.sinks;
