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

import com.hellblazer.qnet.resource.QuantumRouter;
import com.hellblazer.qnet.resource.memory.MemoryInfo;

import java.util.List;

/**
 * Creates the protocol that serves the memories a {@link RuleCondition} selected.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface RuleAction {

    /**
     * @param memories the records returned by the rule's condition
     * @param router   the router the protocol will run on
     * @return the new protocol together with the peers that must confirm it
     */
    ActionResult apply(List<MemoryInfo> memories, QuantumRouter router);
}
