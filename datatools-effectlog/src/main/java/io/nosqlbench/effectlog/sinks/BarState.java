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

import io.nosqlbench.effectlog.eventing.ProgressEvent;

/**
 * Render state of one active progress bar. Guarded by the owning writer's lock.
 */
final class BarState {

    private final long sequenceId;
    private final long startNanos;
    private Long total;
    private long current;
    private String description;
    private boolean dirty;
    private boolean finished;
    private long lastDrawNanos;

    BarState(ProgressEvent start, long startNanos) {
        this.sequenceId = start.getSequenceId();
        this.startNanos = startNanos;
        this.lastDrawNanos = startNanos;
        apply(start);
    }

    /**
     * Takes the count, total and description from an event. The count never goes back.
     */
    void apply(ProgressEvent event) {
        current = Math.max(current, event.getCurrent());
        if (event.hasTotal()) {
            total = event.getTotal().getAsLong();
        }
        description = event.getDescription();
        dirty = true;
    }

    long getSequenceId() {
        return sequenceId;
    }

    long getStartNanos() {
        return startNanos;
    }

    Long getTotal() {
        return total;
    }

    long getCurrent() {
        return current;
    }

    String getDescription() {
        return description;
    }

    boolean isDirty() {
        return dirty;
    }

    boolean isFinished() {
        return finished;
    }

    void markFinished() {
        finished = true;
    }

    long getLastDrawNanos() {
        return lastDrawNanos;
    }

    void drawn(long nowNanos) {
        dirty = false;
        lastDrawNanos = nowNanos;
    }
}
