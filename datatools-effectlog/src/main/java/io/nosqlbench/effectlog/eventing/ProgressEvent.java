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

import java.util.Objects;
import java.util.OptionalLong;

/**
 * An immutable progress update for one logical progress operation, identified by its
 * {@link #getSequenceId() sequence id}. Events of one sequence share the id from
 * {@link ProgressPhase#START} to {@link ProgressPhase#FINISH}; the id is never reused while
 * that operation is active, which is what lets renderers keep nested bars apart.
 *
 * <p>{@code current} counts the items consumed so far and never decreases within a
 * sequence. {@code total} is absent when the size of the underlying sequence is unknown.
 *
 * @see ProgressPhase
 * @see EventHandler#onProgress(ProgressEvent)
 * @since 4.0.0
 */
public final class ProgressEvent {

    private final long sequenceId;
    private final Long total;
    private final long current;
    private final String description;
    private final ProgressPhase phase;

    private ProgressEvent(long sequenceId, Long total, long current, String description, ProgressPhase phase) {
        if (current < 0) {
            throw new IllegalArgumentException("progress count must not be negative: " + current);
        }
        if (total != null && total < 0) {
            throw new IllegalArgumentException("progress total must not be negative: " + total);
        }
        this.sequenceId = sequenceId;
        this.total = total;
        this.current = current;
        this.description = Objects.requireNonNullElse(description, "");
        this.phase = Objects.requireNonNull(phase, "phase");
    }

    /**
     * Creates a progress event.
     *
     * @param sequenceId the id of the progress operation
     * @param total the known length, or null when unknown
     * @param current items consumed so far, must be zero or more
     * @param description display text, null is treated as empty
     * @param phase the lifecycle phase, must not be null
     * @return a new event
     * @throws IllegalArgumentException if current or total is negative
     * @throws NullPointerException if phase is null
     */
    public static ProgressEvent of(long sequenceId, Long total, long current, String description, ProgressPhase phase) {
        return new ProgressEvent(sequenceId, total, current, description, phase);
    }

    public long getSequenceId() {
        return sequenceId;
    }

    public OptionalLong getTotal() {
        return total == null ? OptionalLong.empty() : OptionalLong.of(total);
    }

    public boolean hasTotal() {
        return total != null;
    }

    public long getCurrent() {
        return current;
    }

    public String getDescription() {
        return description;
    }

    public ProgressPhase getPhase() {
        return phase;
    }

    /**
     * Derives an event of the same sequence with a different phase, count and description.
     */
    public ProgressEvent next(ProgressPhase nextPhase, long nextCurrent, String nextDescription) {
        return new ProgressEvent(sequenceId, total, nextCurrent, nextDescription, nextPhase);
    }

    public ProgressEvent withDescription(String newDescription) {
        return new ProgressEvent(sequenceId, total, current, newDescription, phase);
    }

    @Override
    public String toString() {
        return "ProgressEvent{#" + sequenceId + " " + phase + " " + current
                + (total != null ? "/" + total : "") + (description.isEmpty() ? "" : " '" + description + "'") + "}";
    }
}
