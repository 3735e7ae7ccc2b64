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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Timeline - the discrete event kernel.
 *
 * @author hal.hildebrand
 */
class TimelineTest {

    private Timeline     timeline;
    private List<String> trace;

    @BeforeEach
    void setUp() {
        timeline = new Timeline();
        trace = new ArrayList<>();
    }

    @Test
    void testEventsExecuteInTimeOrder() {
        timeline.schedule(30, () -> trace.add("c"));
        timeline.schedule(10, () -> trace.add("a"));
        timeline.schedule(20, () -> trace.add("b"));

        timeline.run();

        assertEquals(List.of("a", "b", "c"), trace);
        assertEquals(30, timeline.now());
        assertEquals(3, timeline.getExecutedEvents());
    }

    @Test
    void testEqualTimesAreFifo() {
        for (int i = 0; i < 5; i++) {
            var label = "e" + i;
            timeline.schedule(100, () -> trace.add(label));
        }
        timeline.run();
        assertEquals(List.of("e0", "e1", "e2", "e3", "e4"), trace);
    }

    @Test
    void testSchedulingInThePastFails() {
        timeline.schedule(50, () -> {
        });
        timeline.run();

        var e = assertThrows(InvalidTimeException.class, () -> timeline.schedule(10, () -> {
        }));
        assertEquals(10, e.getRequested());
        assertEquals(50, e.getNow());
    }

    @Test
    void testSchedulingFromCallbackAtCurrentTime() {
        timeline.schedule(5, () -> {
            trace.add("first");
            timeline.schedule(timeline.now(), () -> trace.add("same-time"));
        });
        timeline.schedule(5, () -> trace.add("second"));

        timeline.run();

        // The nested event was inserted after "second" so it follows it
        assertEquals(List.of("first", "second", "same-time"), trace);
    }

    @Test
    void testRunUntilLeavesLaterEventsQueued() {
        timeline.schedule(10, () -> trace.add("a"));
        timeline.schedule(100, () -> trace.add("b"));
        timeline.schedule(200, () -> trace.add("c"));

        timeline.runUntil(100);
        assertEquals(List.of("a"), trace);
        assertEquals(10, timeline.now());
        assertEquals(2, timeline.getPendingEvents());

        timeline.runUntil(Timeline.UNBOUNDED);
        assertEquals(List.of("a", "b", "c"), trace);
    }

    @Test
    void testDefaultStopTime() {
        var bounded = new Timeline(50);
        bounded.schedule(49, () -> trace.add("in"));
        bounded.schedule(50, () -> trace.add("out"));
        bounded.run();
        assertEquals(List.of("in"), trace);
    }

    @Test
    void testCancelledEventIsSkipped() {
        var event = timeline.schedule(10, () -> trace.add("cancelled"));
        timeline.schedule(20, () -> trace.add("kept"));
        timeline.remove(event);

        timeline.run();

        assertTrue(event.isCancelled());
        assertEquals(List.of("kept"), trace);
        assertEquals(1, timeline.getExecutedEvents());
    }

    @Test
    void testStopHaltsRun() {
        timeline.schedule(1, () -> {
            trace.add("a");
            timeline.stop();
        });
        timeline.schedule(2, () -> trace.add("b"));

        timeline.run();
        assertEquals(List.of("a"), trace);

        timeline.run();
        assertEquals(List.of("a", "b"), trace);
    }

    @Test
    void testInitCallsEntitiesInRegistrationOrder() {
        timeline.register(new TraceEntity("one"));
        timeline.register(new TraceEntity("two"));

        timeline.init();

        assertEquals(List.of("init:one", "init:two"), trace);
        assertThrows(IllegalArgumentException.class, () -> timeline.register(new TraceEntity("one")));
    }

    @Test
    void testRunIsNotReentrant() {
        timeline.schedule(1, () -> assertThrows(IllegalStateException.class, () -> timeline.run()));
        timeline.run();
        assertFalse(timeline.isRunning());
    }

    private class TraceEntity implements Entity {
        private final String name;

        TraceEntity(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public Timeline getTimeline() {
            return timeline;
        }

        @Override
        public void init() {
            trace.add("init:" + name);
        }
    }
}
