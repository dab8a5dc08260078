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

/**
 * The outcome a handler reports for one event. There are three outcomes:
 * <ul>
 *   <li>{@link #consumed()}: the event stops here; outer handlers never see it and the
 *       fallback policy does not apply.</li>
 *   <li>{@link #forward(Object)}: the handler ignored the event, or replaced it with a
 *       derived one; dispatch continues outward with the given event.</li>
 *   <li>{@link #forwardHandled(Object)}: the handler processed the event and passes it on
 *       so sibling handlers also receive it. Once any handler reports this, the fallback
 *       policy no longer applies to the event.</li>
 * </ul>
 *
 * @param <E> the event type
 * @see EventHandler
 * @since 4.0.0
 */
public final class Disposition<E> {

    private static final Disposition<?> CONSUMED = new Disposition<>(null, true, true);

    private final E event;
    private final boolean consumed;
    private final boolean handled;

    private Disposition(E event, boolean consumed, boolean handled) {
        this.event = event;
        this.consumed = consumed;
        this.handled = handled;
    }

    @SuppressWarnings("unchecked")
    public static <E> Disposition<E> consumed() {
        return (Disposition<E>) CONSUMED;
    }

    public static <E> Disposition<E> forward(E event) {
        return new Disposition<>(Objects.requireNonNull(event, "event"), false, false);
    }

    public static <E> Disposition<E> forwardHandled(E event) {
        return new Disposition<>(Objects.requireNonNull(event, "event"), false, true);
    }

    public boolean isConsumed() {
        return consumed;
    }

    public boolean isHandled() {
        return handled;
    }

    /**
     * @return the event to pass outward, null when consumed
     */
    public E getEvent() {
        return event;
    }

    @Override
    public String toString() {
        if (consumed) {
            return "Disposition{consumed}";
        }
        return "Disposition{" + (handled ? "forwardHandled " : "forward ") + event + "}";
    }
}
