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
import com.hellblazer.qnet.resource.memory.MemoryId;
import com.hellblazer.qnet.resource.memory.MemoryState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Swapping on an end router: waits for the intermediate router's result and re-points its slot at the new partner,
 * or reverts the slot to RAW when the swap failed.
 *
 * @author hal.hildebrand
 */
public class EntanglementSwappingB extends EntanglementProtocol {
    private static final Logger log = LoggerFactory.getLogger(EntanglementSwappingB.class);

    private final int memory;

    public EntanglementSwappingB(QuantumRouter owner, int memory) {
        super(owner, owner.nextProtocolName("ESB[" + memory + "]"));
        this.memory = memory;
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.SWAPPING_B;
    }

    @Override
    public List<Integer> getMemoryIndices() {
        return List.of(memory);
    }

    @Override
    protected void start() {
    }

    @Override
    protected void onMessage(String src, Payload payload) {
        if (!(payload instanceof SwappingMessage result)) {
            log.debug("{} on {} ignoring {} from {}", name, owner.getName(), payload, src);
            return;
        }
        var quantumMemory = memory(memory);
        if (result.success()) {
            quantumMemory.entangle(new MemoryId(result.remoteNode(), result.remoteMemo()), result.fidelity(),
                                   result.time());
        } else {
            quantumMemory.reset();
        }
        log.trace("{} on {}: {}", name, owner.getName(), result);
        complete(result.success());
        updateResource(memory, result.success() ? MemoryState.ENTANGLED : MemoryState.RAW);
    }
}
