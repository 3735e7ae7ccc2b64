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
 * Selects, on an end router, each slot entangled with the intermediate router at or above the minimum fidelity.
 *
 * @author hal.hildebrand
 */
public record SwappingBCondition(List<Integer> memories, String middleNode, double minFidelity)
    implements RuleCondition {

    public SwappingBCondition {
        memories = List.copyOf(memories);
    }

    @Override
    public List<MemoryInfo> evaluate(MemoryInfo memory, MemoryManager manager) {
        if (memory.state() == MemoryState.ENTANGLED && memories.contains(memory.index())
            && middleNode.equals(memory.remoteNode()) && memory.fidelity() >= minFidelity) {
            return List.of(memory);
        }
        return List.of();
    }
}
