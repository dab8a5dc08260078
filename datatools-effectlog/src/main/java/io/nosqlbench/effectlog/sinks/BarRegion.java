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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The stack of active bars of one writer, in nesting order, together with the cursor
 * bookkeeping needed to repaint them. Bars occupy consecutive terminal lines, outermost on
 * top; while any are drawn the cursor rests at the end of the last bar line.
 *
 * <p>All methods return the control sequences to write rather than writing them, so the
 * caller can send one combined write per event. Not thread-safe; guarded by the writer's
 * lock.
 */
final class BarRegion {

    static final String CSI = "\u001B[";
    static final String ERASE_TO_END_OF_LINE = CSI + "K";
    static final String ERASE_BELOW = CSI + "J";

    private final List<BarState> bars = new ArrayList<>();
    private int drawnLines;

    BarState find(long sequenceId) {
        for (BarState bar : bars) {
            if (bar.getSequenceId() == sequenceId) {
                return bar;
            }
        }
        return null;
    }

    void push(BarState bar) {
        bars.add(bar);
    }

    /**
     * Removes exactly this bar, keeping the others in order.
     */
    void remove(BarState bar) {
        bars.remove(bar);
    }

    List<BarState> getBars() {
        return Collections.unmodifiableList(bars);
    }

    boolean isEmpty() {
        return bars.isEmpty();
    }

    int size() {
        return bars.size();
    }

    int getDrawnLines() {
        return drawnLines;
    }

    /**
     * Erases every drawn bar line and leaves the cursor at the start of the top one.
     */
    String clear() {
        if (drawnLines == 0) {
            return "";
        }
        StringBuilder out = new StringBuilder("\r");
        if (drawnLines > 1) {
            out.append(CSI).append(drawnLines - 1).append('A');
        }
        out.append(ERASE_BELOW);
        drawnLines = 0;
        return out.toString();
    }

    /**
     * Draws all bars from the current cursor line downwards. Expects the region to be
     * cleared.
     */
    String draw(BarRenderer renderer, long nowNanos) {
        if (bars.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder("\r");
        for (int i = 0; i < bars.size(); i++) {
            if (i > 0) {
                out.append('\n');
            }
            BarState bar = bars.get(i);
            out.append(renderer.render(bar, nowNanos));
            bar.drawn(nowNanos);
        }
        out.append(ERASE_TO_END_OF_LINE);
        drawnLines = bars.size();
        return out.toString();
    }

    /**
     * Repaints one bar's line in place and returns the cursor to the last line.
     */
    String redrawLine(BarState bar, BarRenderer renderer, long nowNanos) {
        int index = bars.indexOf(bar);
        if (index < 0 || index >= drawnLines) {
            return "";
        }
        int up = drawnLines - 1 - index;
        StringBuilder out = new StringBuilder();
        if (up > 0) {
            out.append(CSI).append(up).append('A');
        }
        out.append('\r').append(renderer.render(bar, nowNanos)).append(ERASE_TO_END_OF_LINE);
        if (up > 0) {
            out.append(CSI).append(up).append('B');
        }
        bar.drawn(nowNanos);
        return out.toString();
    }

    /**
     * Leaves whatever is drawn on screen as permanent output: the cursor moves to a fresh
     * line below the region and the region forgets its lines.
     */
    String release() {
        if (drawnLines == 0) {
            return "";
        }
        drawnLines = 0;
        return "\n";
    }

    void clearBars() {
        bars.clear();
    }

    @FunctionalInterface
    interface BarRenderer {
        String render(BarState bar, long nowNanos);
    }
}
