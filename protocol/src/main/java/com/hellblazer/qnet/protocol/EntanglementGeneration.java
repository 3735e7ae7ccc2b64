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
package com.hellblazer.qnet.protocol;

import com.hellblazer.qnet.network.Payload;
import com.hellblazer.qnet.resource.EntanglementProtocol;
import com.hellblazer.qnet.resource.Peer;
import com.hellblazer.qnet.resource.ProtocolKind;
import com.hellblazer.qnet.resource.QuantumRouter;
import com.hellblazer.qnet.resource.hardware.DelayKind;
import com.hellblazer.qnet.resource.memory.MemoryId;
import com.hellblazer.qnet.resource.memory.MemoryState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Generates an entangled pair between one slot on each of two adjacent routers.
 * <p>
 * The primary (the requesting side) makes a single attempt after the hardware attempt delay, draws the outcome and
 * reports it to its partner before releasing its own slot. On success both slots become ENTANGLED, referring to each
 * other; on failure both revert to RAW and the generation rule fires again.
 *
 * @author hal.hildebrand
 */
public class EntanglementGeneration extends EntanglementProtocol {
    private static final Logger log = LoggerFactory.getLogger(EntanglementGeneration.class);

    private final int     memory;
    private final String  remoteNode;
    private final boolean primary;

    /**
     * @param owner      the router
     * @param memory     the slot to entangle
     * @param remoteNode the adjacent router
     * @param primary    whether this side attempts and draws the outcome
     */
    public EntanglementGeneration(QuantumRouter owner, int memory, String remoteNode, boolean primary) {
        super(owner, owner.nextProtocolName("EG[" + memory + "]"));
        this.memory = memory;
        this.remoteNode = remoteNode;
        this.primary = primary;
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.GENERATION;
    }

    @Override
    public List<Integer> getMemoryIndices() {
        return List.of(memory);
    }

    public String getRemoteNode() {
        return remoteNode;
    }

    public boolean isPrimary() {
        return primary;
    }

    @Override
    protected void start() {
        if (primary) {
            schedule(owner.getHardware().delay(DelayKind.GENERATION_ATTEMPT), this::attempt);
        }
    }

    private void attempt() {
        var peer = getPeer(remoteNode);
        var hardware = owner.getHardware();
        boolean success = hardware.drawSuccess(hardware.generationSuccessProbability(remoteNode));
        long now = owner.getTimeline().now();
        double fidelity = hardware.rawFidelity();
        log.trace("{} on {} attempt with {}: {}", name, owner.getName(), remoteNode, success ? "heralded" : "lost");

        // the partner must learn the outcome before this slot can be claimed again
        send(peer, new GenerationMessage(success, memory, fidelity, now));
        finish(success, peer.node(), peer.memories().get(0), fidelity, now);
    }

    @Override
    protected void onMessage(String src, Payload payload) {
        if (primary || !(payload instanceof GenerationMessage outcome)) {
            log.debug("{} on {} ignoring {} from {}", name, owner.getName(), payload, src);
            return;
        }
        finish(outcome.success(), src, outcome.memory(), outcome.fidelity(), outcome.time());
    }

    private void finish(boolean success, String node, int remoteMemory, double fidelity, long time) {
        var quantumMemory = memory(memory);
        if (success) {
            quantumMemory.entangle(new MemoryId(node, remoteMemory), fidelity, time);
        } else {
            quantumMemory.reset();
        }
        complete(success);
        updateResource(memory, success ? MemoryState.ENTANGLED : MemoryState.RAW);
    }

    /**
     * @return the negotiated partner, or null before negotiation completes
     */
    public Peer getPartner() {
        return getPeer(remoteNode);
    }
}
