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
 * Lifecycle phase carried by a {@link ProgressEvent}. For one sequence id the phases
 * always arrive as one {@link #START}, any number of {@link #ADVANCE} and
 * {@link #DESCRIPTION_CHANGE} events, and exactly one {@link #FINISH}.
 *
 * @see ProgressEvent
 * @since 4.0.0
 */
public enum ProgressPhase {
    /**
     * A new progress operation began; renderers allocate a bar for it.
     */
    START,

    /**
     * One more item of work completed.
     */
    ADVANCE,

    /**
     * The description text changed; the count did not.
     */
    DESCRIPTION_CHANGE,

    /**
     * The operation ended, either exhausted or abandoned. Terminal phase.
     */
    FINISH;

    public boolean isTerminal() {
        return this == FINISH;
    }
}
