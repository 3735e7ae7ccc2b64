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

import com.hellblazer.qnet.protocol.EntanglementSwappingB;
import com.hellblazer.qnet.resource.QuantumRouter;
import com.hellblazer.qnet.resource.memory.MemoryInfo;
import com.hellblazer.qnet.resource.rule.ActionResult;
import com.hellblazer.qnet.resource.rule.RuleAction;

import java.util.List;

/**
 * Creates an end-router swapping protocol that waits for the intermediate router.
 *
 * @author hal.hildebrand
 */
public record SwappingBAction() implements RuleAction {

    @Override
    public ActionResult apply(List<MemoryInfo> memories, QuantumRouter router) {
        return ActionResult.respond(new EntanglementSwappingB(router, memories.get(0).index()));
    }
}
