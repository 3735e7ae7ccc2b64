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
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Node message routing and ClassicalChannel delivery.
 *
 * @author hal.hildebrand
 */
class NodeTest {

    record Text(String value) implements Payload {
    }

    record Received(long time, String src, String value) {
    }

    static class RecordingNode extends Node {
        final List<Received> log = new ArrayList<>();

        RecordingNode(String name, Timeline timeline) {
            super(name, timeline);
        }

        @Override
        public void receiveMessage(String src, Message msg) {
            log.add(new Received(timeline.now(), src, ((Text) msg.payload()).value()));
        }
    }

    static class RecordingProtocol implements Protocol {
        final String       name;
        final String       kind;
        final List<String> received = new ArrayList<>();
        boolean initialized;

        RecordingProtocol(String name, String kind) {
            this.name = name;
            this.kind = kind;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String getKind() {
            return kind;
        }

        @Override
        public void init() {
            initialized = true;
        }

        @Override
        public void receivedMessage(String src, Message msg) {
            received.add(src + ":" + ((Text) msg.payload()).value());
        }
    }

    @Test
    void testInitInitializesProtocols() {
        var timeline = new Timeline();
        var node = new Node("node", timeline);
        var protocol = new RecordingProtocol("p", "fake");
        node.addProtocol(protocol);

        assertFalse(protocol.initialized);
        timeline.init();
        assertTrue(protocol.initialized);
    }

    @Test
    void testAssignCChannel() {
        var timeline = new Timeline();
        var node1 = new Node("node1", timeline);
        var node2 = new Node("node2", timeline);
        var cc = new ClassicalChannel("cc", timeline, 1e3);
        cc.setEnds(node1, node2);

        assertSame(cc, node1.getCChannels().get("node2"));
        assertSame(cc, node2.getCChannels().get("node1"));
        assertEquals(5_000_000, cc.getDelay());
    }

    @Test
    void testSendMessageDelivery() {
        var timeline = new Timeline();
        var node1 = new RecordingNode("node1", timeline);
        var node2 = new RecordingNode("node2", timeline);
        var cc = new ClassicalChannel("cc", timeline, 1e3);
        cc.setEnds(node1, node2);

        for (int i = 0; i < 10; i++) {
            var value = String.valueOf(i);
            timeline.schedule(i, () -> node1.send("node2", Address.broadcast("any"), new Text(value)));
        }
        for (int i = 0; i < 10; i++) {
            var value = String.valueOf(i);
            timeline.schedule(10 + i, () -> node2.send("node1", Address.broadcast("any"), new Text(value)));
        }

        timeline.init();
        timeline.run();

        assertEquals(10, node1.log.size());
        assertEquals(10, node2.log.size());
        for (int i = 0; i < 10; i++) {
            assertEquals(new Received(5_000_010 + i, "node2", String.valueOf(i)), node1.log.get(i));
            assertEquals(new Received(5_000_000 + i, "node1", String.valueOf(i)), node2.log.get(i));
        }
    }

    @Test
    void testSendWithoutChannelFails() {
        var timeline = new Timeline();
        var node = new Node("lonely", timeline);
        assertThrows(IllegalArgumentException.class,
                     () -> node.send("nobody", Address.resourceManager(), new Text("x")));
    }

    @Test
    void testChannelRejectsNonPositiveDelay() {
        var timeline = new Timeline();
        assertThrows(IllegalArgumentException.class, () -> new ClassicalChannel("cc", timeline, 0));
        assertThrows(IllegalArgumentException.class, () -> new ClassicalChannel("cc", timeline, 10, 0));
    }

    @Test
    void testRoutingByNameAndKind() {
        var timeline = new Timeline();
        var sender = new Node("sender", timeline);
        var receiver = new Node("receiver", timeline);
        new ClassicalChannel("cc", timeline, 0, 10).setEnds(sender, receiver);

        var a = new RecordingProtocol("a", "alpha");
        var b = new RecordingProtocol("b", "alpha");
        var c = new RecordingProtocol("c", "beta");
        receiver.addProtocol(a);
        receiver.addProtocol(b);
        receiver.addProtocol(c);

        sender.send("receiver", Address.protocol("c"), new Text("direct"));
        sender.send("receiver", Address.broadcast("alpha"), new Text("all"));
        sender.send("receiver", Address.protocol("gone"), new Text("stale"));
        sender.send("receiver", Address.resourceManager(), new Text("rm"));

        timeline.run();

        assertEquals(List.of("sender:all"), a.received);
        assertEquals(List.of("sender:all"), b.received);
        assertEquals(List.of("sender:direct"), c.received);
    }

    @Test
    void testMessageToRemovedProtocolIsDropped() {
        var timeline = new Timeline();
        var sender = new Node("sender", timeline);
        var receiver = new Node("receiver", timeline);
        new ClassicalChannel("cc", timeline, 0, 10).setEnds(sender, receiver);
        var protocol = new RecordingProtocol("p", "alpha");
        receiver.addProtocol(protocol);

        sender.send("receiver", Address.protocol("p"), new Text("late"));
        timeline.schedule(5, () -> receiver.removeProtocol(protocol));

        assertDoesNotThrow(() -> timeline.run());
        assertTrue(protocol.received.isEmpty());
    }
}
