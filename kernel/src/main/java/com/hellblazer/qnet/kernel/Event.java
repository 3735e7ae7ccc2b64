/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the QNet.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.qnet.kernel;

/**
 * A scheduled state change. Events are ordered by time, then by the sequence number the {@link Timeline} assigned
 * when the event was scheduled, so equal-time events execute in insertion order.
 * <p>
 * An event is owned by its timeline from scheduling until it executes. A cancelled event stays in the queue and is
 * discarded when popped.
 *
 * @author hal.hildebrand
 */
public final class Event implements Comparable<Event> {

    private final long     time;
    private final long     sequence;
    private final Runnable callback;
    private       boolean  cancelled;

    Event(long time, long sequence, Runnable callback) {
        this.time = time;
        this.sequence = sequence;
        this.callback = callback;
    }

    public long getTime() {
        return time;
    }

    public long getSequence() {
        return sequence;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Cancel this event. Idempotent; cancelling an event that already ran has no effect.
     */
    public void cancel() {
        cancelled = true;
    }

    void execute() {
        callback.run();
    }

    @Override
    public int compareTo(Event other) {
        int c = Long.compare(time, other.time);
        return c != 0 ? c : Long.compare(sequence, other.sequence);
    }

    @Override
    public String toString() {
        return String.format("Event{time=%d, seq=%d%s}", time, sequence, cancelled ? ", cancelled" : "");
    }
}
