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
 * The event model and the handler contract: {@link io.nosqlbench.effectlog.eventing.LogEvent},
 * {@link io.nosqlbench.effectlog.eventing.ProgressEvent}, {@link io.nosqlbench.effectlog.eventing.EventHandler}
 * with its {@link io.nosqlbench.effectlog.eventing.Disposition}, and the
 * {@link io.nosqlbench.effectlog.eventing.FallbackPolicy} applied to events nobody handled.
 *
 * @since 4.0.0
 */
package io.nosqlbench.effectlog.eventing;
