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
import com.hellblazer.qnet.resource.ProtocolKind;
import com.hellblazer.qnet.resource.QuantumRouter;
import com.hellblazer.qnet.resource.hardware.DelayKind;
import com.hellblazer.qnet.resource.memory.MemoryState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Swapping on the intermediate router: consumes a pair shared with the left router and a pair shared with the right
 * router, and tells each end router who its new partner is. Both local slots revert to RAW whatever the outcome.
 *
 * @author hal.hildebrand
 */
public class EntanglementSwappingA extends EntanglementProtocol {
    private static final Logger log = LoggerFactory.getLogger(EntanglementSwappingA.class);

    private final int            left;
    private final int            right;
    private final String         leftNode;
    private final String         rightNode;
    private final SwappingConfig config;

    /**
     * @param left  slot entangled with the left router
     * @param right slot entangled with the right router
     * @throws IllegalArgumentException unless both slots hold pairs with distinct routers
     */
    public EntanglementSwappingA(QuantumRouter owner, int left, int right, SwappingConfig config) {
        super(owner, owner.nextProtocolName("ESA[" + left + "," + right + "]"));
        var leftMemory = owner.getMemoryManager().getMemory(left);
        var rightMemory = owner.getMemoryManager().getMemory(right);
        if (!leftMemory.isEntangled() || !rightMemory.isEntangled()) {
            throw new IllegalArgumentException("Swapping requires two entangled memories: " + left + ", " + right);
        }
        this.left = left;
        this.right = right;
        this.leftNode = leftMemory.getEntangled().node();
        this.rightNode = rightMemory.getEntangled().node();
        if (leftNode.equals(rightNode)) {
            throw new IllegalArgumentException("Both pairs are shared with " + leftNode);
        }
        this.config = config;
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.SWAPPING_A;
    }

    @Override
    public List<Integer> getMemoryIndices() {
        return List.of(left, right);
    }

    public String getLeftNode() {
        return leftNode;
    }

    public String getRightNode() {
        return rightNode;
    }

    @Override
    protected void start() {
        schedule(owner.getHardware().delay(DelayKind.SWAPPING), this::swap);
    }

    private void swap() {
        var leftPeer = getPeer(leftNode);
        var rightPeer = getPeer(rightNode);
        double leftFidelity = memory(left).getFidelity();
        double rightFidelity = memory(right).getFidelity();
        boolean success = owner.getHardware().drawSuccess(config.getSuccessProbability());
        double fidelity = success ? leftFidelity * rightFidelity * config.getDegradation() : 0.0;
        long now = owner.getTimeline().now();
        log.debug("{} on {} swapped {} and {}: {}", name, owner.getName(), leftNode, rightNode,
                  success ? "fidelity " + fidelity : "failed");

        send(leftPeer, new SwappingMessage(success, fidelity, rightNode, rightPeer.memories().get(0), now));
        send(rightPeer, new SwappingMessage(success, fidelity, leftNode, leftPeer.memories().get(0), now));

        memory(left).reset();
        memory(right).reset();
        complete(success);
        var updates = new LinkedHashMap<Integer, MemoryState>();
        updates.put(left, MemoryState.RAW);
        updates.put(right, MemoryState.RAW);
        updateResources(updates);
    }

    @Override
    protected void onMessage(String src, Payload payload) {
        log.debug("{} on {} ignoring {} from {}", name, owner.getName(), payload, src);
    }
}
