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
package com.hellblazer.qnet.protocol.rules;

import com.hellblazer.qnet.resource.memory.MemoryInfo;
import com.hellblazer.qnet.resource.memory.MemoryManager;
import com.hellblazer.qnet.resource.memory.MemoryState;
import com.hellblazer.qnet.resource.rule.RuleCondition;

import java.util.List;

/**
 * Selects, on the requesting router, an ENTANGLED slot below the target fidelity together with a second ENTANGLED
 * slot shared with the same router at exactly the same fidelity. The first slot is kept, the second consumed.
 * <p>
 * Only pairs above 0.5 are purified; below that BBPSSW lowers fidelity.
 *
 * @param memories       eligible slots
 * @param targetFidelity fidelity at which purification stops
 * @author hal.hildebrand
 */
public record PurificationCondition(List<Integer> memories, double targetFidelity) implements RuleCondition {

    public PurificationCondition {
        memories = List.copyOf(memories);
    }

    @Override
    public List<MemoryInfo> evaluate(MemoryInfo memory, MemoryManager manager) {
        if (!eligible(memory)) {
            return List.of();
        }
        for (var index : memories) {
            if (index == memory.index()) {
                continue;
            }
            var other = manager.get(index);
            if (eligible(other) && other.remoteNode().equals(memory.remoteNode())
                && other.fidelity() == memory.fidelity()) {
                return List.of(memory, other);
            }
        }
        return List.of();
    }

    private boolean eligible(MemoryInfo info) {
        return info.state() == MemoryState.ENTANGLED && memories.contains(info.index())
            && info.fidelity() < targetFidelity && info.fidelity() > 0.5;
    }
}
