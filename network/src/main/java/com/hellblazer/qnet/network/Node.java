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

import com.hellblazer.qnet.kernel.Entity;
import com.hellblazer.qnet.kernel.Timeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A network node. Owns its classical channels and its installed protocols, and routes inbound messages to the
 * addressed receiver.
 * <p>
 * Messages for a protocol that is no longer installed are dropped: the protocol may have completed or been cancelled
 * while the message was in flight.
 *
 * @author hal.hildebrand
 */
public class Node implements Entity {
    private static final Logger log = LoggerFactory.getLogger(Node.class);

    protected final String                        name;
    protected final Timeline                      timeline;
    private final   Map<String, ClassicalChannel> cchannels = new HashMap<>();
    private final   List<Protocol>                protocols = new ArrayList<>();

    public Node(String name, Timeline timeline) {
        this.name = name;
        this.timeline = timeline;
        timeline.register(this);
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
        for (var protocol : new ArrayList<>(protocols)) {
            protocol.init();
        }
    }

    public void assignCChannel(ClassicalChannel channel, String destination) {
        cchannels.put(destination, channel);
    }

    public Map<String, ClassicalChannel> getCChannels() {
        return Collections.unmodifiableMap(cchannels);
    }

    /**
     * Send a message over the classical channel to the destination node.
     *
     * @throws IllegalArgumentException if no channel connects this node to the destination
     */
    public void sendMessage(String destination, Message message) {
        var channel = cchannels.get(destination);
        if (channel == null) {
            throw new IllegalArgumentException(name + " has no classical channel to " + destination);
        }
        channel.transmit(message, this);
    }

    /**
     * Send a payload from this node to a receiver on the destination node.
     */
    public void send(String destination, Address receiver, Payload payload) {
        sendMessage(destination, new Message(name, receiver, payload));
    }

    /**
     * Route an inbound message to its receiver.
     *
     * @param src name of the sending node
     * @param msg the message
     */
    public void receiveMessage(String src, Message msg) {
        var receiver = msg.receiver();
        if (receiver instanceof Address.ResourceManagerAddress) {
            receivedByResourceManager(src, msg);
        } else if (receiver instanceof Address.ProtocolAddress address) {
            var protocol = getProtocol(address.name());
            if (protocol == null) {
                log.debug("{} dropping {} from {}: no protocol {}", name, msg.payload(), src, address.name());
                return;
            }
            protocol.receivedMessage(src, msg);
        } else if (receiver instanceof Address.Broadcast broadcast) {
            int delivered = 0;
            for (var protocol : new ArrayList<>(protocols)) {
                if (protocol.getKind().equals(broadcast.kind()) && protocols.contains(protocol)) {
                    protocol.receivedMessage(src, msg);
                    delivered++;
                }
            }
            if (delivered == 0) {
                log.debug("{} dropping broadcast {} from {}: no {} protocols", name, msg.payload(), src,
                          broadcast.kind());
            }
        }
    }

    /**
     * Messages addressed to the resource manager. Plain nodes have none, so the message is dropped.
     */
    protected void receivedByResourceManager(String src, Message msg) {
        log.debug("{} has no resource manager, dropping {} from {}", name, msg.payload(), src);
    }

    public void addProtocol(Protocol protocol) {
        protocols.add(protocol);
    }

    public boolean removeProtocol(Protocol protocol) {
        return protocols.remove(protocol);
    }

    public Protocol getProtocol(String protocolName) {
        for (var protocol : protocols) {
            if (protocol.getName().equals(protocolName)) {
                return protocol;
            }
        }
        return null;
    }

    public List<Protocol> getProtocols() {
        return Collections.unmodifiableList(protocols);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + name + "}";
    }
}
