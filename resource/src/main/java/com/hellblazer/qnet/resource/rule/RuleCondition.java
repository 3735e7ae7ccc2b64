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
package com.hellblazer.qnet.resource.rule;

import com.hellblazer.qnet.resource.memory.MemoryInfo;
import com.hellblazer.qnet.resource.memory.MemoryManager;

import java.util.List;

/**
 * Predicate selecting the memories a rule acts on.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface RuleCondition {

    /**
     * Evaluate the condition against one slot.
     *
     * @param memory  the candidate slot, never OCCUPIED
     * @param manager the node's memory records, for conditions involving more than one slot
     * @return the qualifying records, the candidate first; empty when the condition does not hold
     */
    List<MemoryInfo> evaluate(MemoryInfo memory, MemoryManager manager);
}
