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
package com.hellblazer.qnet.resource;

import com.hellblazer.qnet.kernel.Event;
import com.hellblazer.qnet.network.Address;
import com.hellblazer.qnet.network.Message;
import com.hellblazer.qnet.network.Payload;
import com.hellblazer.qnet.network.Protocol;
import com.hellblazer.qnet.resource.memory.MemoryState;
import com.hellblazer.qnet.resource.memory.QuantumMemory;
import com.hellblazer.qnet.resource.rule.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base of the entanglement protocol state machines.
 * <p>
 * A protocol is created by a rule action, owns a fixed set of memory slots, and moves from {@link ProtocolState#PENDING}
 * to {@link ProtocolState#ACTIVE} when its negotiation completes, then to a terminal state when its physical steps
 * complete. Subclasses implement {@link #start()} and {@link #onMessage(String, Payload)}, and report their outcome
 * through {@link #updateResources(Map)}: once a protocol has released all of its slots it is retired from the router
 * and from its rule.
 * <p>
 * Each protocol is identified within its router by a unique name, and by its {@link #getKey() key}, the slot it was
 * created for.
 *
 * @author hal.hildebrand
 */
public abstract class EntanglementProtocol implements Protocol {
    private static final Logger log = LoggerFactory.getLogger(EntanglementProtocol.class);

    protected final QuantumRouter owner;
    protected final String        name;
    private final   List<Event>   timers = new ArrayList<>();
    private final   List<Peer>    peers  = new ArrayList<>();
    private         ProtocolState state  = ProtocolState.PENDING;
    private         Rule          rule;

    protected EntanglementProtocol(QuantumRouter owner, String name) {
        this.owner = owner;
        this.name = name;
    }

    /**
     * @return the kind tag of this protocol
     */
    public abstract ProtocolKind kind();

    /**
     * @return the slots this protocol owns, the key slot first
     */
    public abstract List<Integer> getMemoryIndices();

    /**
     * Begin executing the physical steps. Called once, on activation.
     */
    protected abstract void start();

    /**
     * Handle a message from the partner protocol. Only called while active.
     */
    protected abstract void onMessage(String src, Payload payload);

    /**
     * Combine this pending protocol with another pending protocol of the same kind, producing a new protocol that
     * owns the memories of both. Neither input is modified.
     *
     * @throws UnsupportedOperationException if this kind of protocol cannot merge
     */
    public EntanglementProtocol merge(EntanglementProtocol absorbed) {
        throw new UnsupportedOperationException(kind() + " protocols do not merge");
    }

    /**
     * Called when the protocol is cancelled, after its timers are cancelled.
     */
    protected void onCancel() {
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getKind() {
        return kind().name();
    }

    /**
     * @return the identity key: the slot this protocol was created for
     */
    public int getKey() {
        return getMemoryIndices().get(0);
    }

    public QuantumRouter getOwner() {
        return owner;
    }

    public ProtocolState getState() {
        return state;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public Rule getRule() {
        return rule;
    }

    void setRule(Rule rule) {
        this.rule = rule;
    }

    public List<Peer> getPeers() {
        return Collections.unmodifiableList(peers);
    }

    /**
     * @return the negotiated partner on the node, or null
     */
    public Peer getPeer(String node) {
        for (var peer : peers) {
            if (peer.node().equals(node)) {
                return peer;
            }
        }
        return null;
    }

    void addPeer(Peer peer) {
        peers.add(peer);
    }

    final void activate() {
        if (state != ProtocolState.PENDING) {
            throw new IllegalStateException(name + " cannot activate from " + state);
        }
        state = ProtocolState.ACTIVE;
        log.trace("{} activated on {} with peers {}", name, owner.getName(), peers);
        start();
    }

    final void cancel() {
        if (state.isTerminal()) {
            return;
        }
        for (var timer : timers) {
            timer.cancel();
        }
        timers.clear();
        state = ProtocolState.FAILED;
        onCancel();
    }

    @Override
    public final void receivedMessage(String src, Message msg) {
        if (state != ProtocolState.ACTIVE) {
            log.debug("{} on {} is {}, dropping {} from {}", name, owner.getName(), state, msg.payload(), src);
            return;
        }
        onMessage(src, msg.payload());
    }

    /**
     * Mark the outcome. Slots are released separately through {@link #updateResources(Map)}.
     */
    protected void complete(boolean success) {
        if (state.isTerminal()) {
            throw new IllegalStateException(name + " already " + state);
        }
        state = success ? ProtocolState.SUCCESS : ProtocolState.FAILED;
        for (var timer : timers) {
            timer.cancel();
        }
        timers.clear();
    }

    /**
     * Schedule a step of this protocol. The step is cancelled if the protocol is cancelled first.
     */
    protected Event schedule(long delay, Runnable step) {
        var event = owner.getTimeline().scheduleAfter(delay, step);
        timers.add(event);
        return event;
    }

    /**
     * Send a payload to the negotiated partner protocol.
     */
    protected void send(Peer peer, Payload payload) {
        owner.send(peer.node(), Address.protocol(peer.protocol()), payload);
    }

    protected QuantumMemory memory(int index) {
        return owner.getMemoryManager().getMemory(index);
    }

    /**
     * Report the new state of owned slots to the resource manager, releasing them.
     */
    protected void updateResources(Map<Integer, MemoryState> updates) {
        owner.getResourceManager().update(this, updates);
    }

    protected void updateResource(int index, MemoryState state) {
        var updates = new LinkedHashMap<Integer, MemoryState>();
        updates.put(index, state);
        updateResources(updates);
    }

    @Override
    public String toString() {
        return String.format("%s{%s, %s, memories=%s}", getClass().getSimpleName(), name, state, getMemoryIndices());
    }
}
