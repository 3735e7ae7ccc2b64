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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * The discrete event scheduling kernel. Holds the current logical time and the queue of pending events, and executes
 * events one at a time in (time, insertion sequence) order.
 * <p>
 * Time is an integral count of picoseconds and never decreases. All simulation state is mutated from event
 * callbacks on the thread calling {@link #run()}, so the kernel needs no locking.
 * <p>
 * Usage:
 * <pre>
 * var timeline = new Timeline();
 * var node = new Node("alice", timeline);
 * timeline.init();
 * timeline.schedule(1_000, () -> node.doSomething());
 * timeline.runUntil(1_000_000);
 * </pre>
 *
 * @author hal.hildebrand
 */
public class Timeline {
    private static final Logger log = LoggerFactory.getLogger(Timeline.class);

    /**
     * Stop time meaning "run until the queue drains".
     */
    public static final long UNBOUNDED = Long.MAX_VALUE;

    private final PriorityQueue<Event> events   = new PriorityQueue<>();
    private final Map<String, Entity>  entities = new LinkedHashMap<>();
    private final long                 stopTime;
    private       long                 now;
    private       long                 sequence;
    private       long                 executed;
    private       boolean              running;
    private       boolean              stopRequested;

    public Timeline() {
        this(UNBOUNDED);
    }

    /**
     * @param stopTime default end time used by {@link #run()}
     */
    public Timeline(long stopTime) {
        if (stopTime < 0) {
            throw new IllegalArgumentException("Stop time must be non-negative: " + stopTime);
        }
        this.stopTime = stopTime;
    }

    /**
     * @return the current logical time
     */
    public long now() {
        return now;
    }

    public long getStopTime() {
        return stopTime;
    }

    /**
     * Register an entity for initialization.
     *
     * @throws IllegalArgumentException if an entity with the same name is already registered
     */
    public void register(Entity entity) {
        var previous = entities.putIfAbsent(entity.getName(), entity);
        if (previous != null && previous != entity) {
            throw new IllegalArgumentException("Duplicate entity name: " + entity.getName());
        }
    }

    public Entity getEntity(String name) {
        return entities.get(name);
    }

    public List<Entity> getEntities() {
        return Collections.unmodifiableList(new ArrayList<>(entities.values()));
    }

    /**
     * Initialize all registered entities in registration order.
     */
    public void init() {
        log.debug("Initializing {} entities", entities.size());
        for (var entity : new ArrayList<>(entities.values())) {
            entity.init();
        }
    }

    /**
     * Schedule a callback at an absolute time.
     *
     * @param time     execution time, not earlier than {@link #now()}
     * @param callback the state change to apply
     * @return the scheduled event, which may be cancelled
     * @throws InvalidTimeException if time precedes the current time
     */
    public Event schedule(long time, Runnable callback) {
        if (time < now) {
            throw new InvalidTimeException(time, now);
        }
        var event = new Event(time, sequence++, callback);
        events.add(event);
        return event;
    }

    /**
     * Schedule a callback relative to the current time.
     */
    public Event scheduleAfter(long delay, Runnable callback) {
        if (delay < 0) {
            throw new InvalidTimeException(now + delay, now);
        }
        return schedule(now + delay, callback);
    }

    /**
     * Cancel a scheduled event. The event is discarded when it reaches the head of the queue.
     */
    public void remove(Event event) {
        event.cancel();
    }

    /**
     * Run until the default stop time.
     */
    public void run() {
        runUntil(stopTime);
    }

    /**
     * Execute events until the queue is empty, {@link #stop()} is called, or the next event is at or beyond the end
     * time. Events at or beyond the end time stay queued.
     *
     * @param endTime exclusive end of the run
     */
    public void runUntil(long endTime) {
        if (running) {
            throw new IllegalStateException("Timeline is already running");
        }
        running = true;
        stopRequested = false;
        log.debug("Running from {} until {}", now, endTime == UNBOUNDED ? "drained" : endTime);
        try {
            while (!stopRequested && !events.isEmpty()) {
                var next = events.peek();
                if (next.getTime() >= endTime) {
                    break;
                }
                events.poll();
                if (next.isCancelled()) {
                    continue;
                }
                if (next.getTime() < now) {
                    throw new IllegalStateException(
                        String.format("Event order violated: %s popped at time %d", next, now));
                }
                now = next.getTime();
                executed++;
                next.execute();
            }
        } finally {
            running = false;
        }
        log.debug("Run ended at {} after {} events, {} pending", now, executed, events.size());
    }

    /**
     * Halt the current run after the executing event completes.
     */
    public void stop() {
        stopRequested = true;
    }

    public boolean isRunning() {
        return running;
    }

    public long getExecutedEvents() {
        return executed;
    }

    /**
     * @return the number of queued events, including cancelled ones not yet discarded
     */
    public int getPendingEvents() {
        return events.size();
    }

    @Override
    public String toString() {
        return String.format("Timeline{now=%d, pending=%d, executed=%d}", now, events.size(), executed);
    }
}
