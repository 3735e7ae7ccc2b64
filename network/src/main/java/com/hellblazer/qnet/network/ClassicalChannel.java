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
package com.hellblazer.qnet.network;

import com.hellblazer.qnet.kernel.Timeline;

/**
 * A bidirectional classical channel between two nodes. Messages are delivered after a fixed delay, either given
 * explicitly or derived from the fiber length.
 * <p>
 * Messages sent at the same time from the same end arrive in the order they were sent.
 *
 * @author hal.hildebrand
 */
public class ClassicalChannel {

    /**
     * Speed of light in fiber, in meters per picosecond.
     */
    public static final double LIGHT_SPEED = 2e-4;

    private final String   name;
    private final Timeline timeline;
    private final double   distance;
    private final long     delay;
    private       Node     end1;
    private       Node     end2;

    /**
     * Channel whose delay is the propagation time over the given distance.
     *
     * @param distance fiber length in meters
     */
    public ClassicalChannel(String name, Timeline timeline, double distance) {
        this(name, timeline, distance, Math.round(distance / LIGHT_SPEED));
    }

    /**
     * @param distance fiber length in meters
     * @param delay    delivery delay in picoseconds
     */
    public ClassicalChannel(String name, Timeline timeline, double distance, long delay) {
        if (distance < 0) {
            throw new IllegalArgumentException("Distance must be non-negative: " + distance);
        }
        if (delay <= 0) {
            throw new IllegalArgumentException("Delay must be positive: " + delay);
        }
        this.name = name;
        this.timeline = timeline;
        this.distance = distance;
        this.delay = delay;
    }

    /**
     * Connect the two ends and register this channel with both nodes.
     */
    public void setEnds(Node end1, Node end2) {
        if (end1.getName().equals(end2.getName())) {
            throw new IllegalArgumentException("Channel ends must differ: " + end1.getName());
        }
        this.end1 = end1;
        this.end2 = end2;
        end1.assignCChannel(this, end2.getName());
        end2.assignCChannel(this, end1.getName());
    }

    /**
     * Schedule delivery of a message to the end opposite the source.
     *
     * @param message the message
     * @param source  sending node, one of this channel's ends
     */
    public void transmit(Message message, Node source) {
        Node destination;
        if (source == end1) {
            destination = end2;
        } else if (source == end2) {
            destination = end1;
        } else {
            throw new IllegalArgumentException(source.getName() + " is not an end of " + name);
        }
        var sender = source.getName();
        timeline.scheduleAfter(delay, () -> destination.receiveMessage(sender, message));
    }

    public String getName() {
        return name;
    }

    public double getDistance() {
        return distance;
    }

    public long getDelay() {
        return delay;
    }

    @Override
    public String toString() {
        return String.format("ClassicalChannel{%s, %s<->%s, delay=%d}", name, end1 == null ? "-" : end1.getName(),
                             end2 == null ? "-" : end2.getName(), delay);
    }
}
