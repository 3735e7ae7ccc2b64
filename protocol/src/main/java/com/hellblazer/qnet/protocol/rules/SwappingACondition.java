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
 * Selects, on the intermediate router, a slot entangled with the left router and a slot entangled with the right
 * router, both at or above the minimum fidelity. Evaluation is anchored on the left slot.
 *
 * @author hal.hildebrand
 */
public record SwappingACondition(List<Integer> memories, String leftNode, String rightNode, double minFidelity)
    implements RuleCondition {

    public SwappingACondition {
        memories = List.copyOf(memories);
    }

    @Override
    public List<MemoryInfo> evaluate(MemoryInfo memory, MemoryManager manager) {
        if (!eligible(memory, leftNode)) {
            return List.of();
        }
        for (var index : memories) {
            var other = manager.get(index);
            if (eligible(other, rightNode)) {
                return List.of(memory, other);
            }
        }
        return List.of();
    }

    private boolean eligible(MemoryInfo info, String node) {
        return info.state() == MemoryState.ENTANGLED && memories.contains(info.index())
            && node.equals(info.remoteNode()) && info.fidelity() >= minFidelity;
    }
}
