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

import com.hellblazer.qnet.protocol.EntanglementGeneration;
import com.hellblazer.qnet.protocol.GenerationMatcher;
import com.hellblazer.qnet.resource.QuantumRouter;
import com.hellblazer.qnet.resource.memory.MemoryInfo;
import com.hellblazer.qnet.resource.rule.ActionResult;
import com.hellblazer.qnet.resource.rule.RuleAction;

import java.util.List;

/**
 * Creates a generation protocol for the selected slot. The initiator requests a partner from the peer router and
 * becomes the primary; the other side waits for that request.
 *
 * @param peer      the adjacent router
 * @param initiator whether this side requests
 * @author hal.hildebrand
 */
public record GenerationAction(String peer, boolean initiator) implements RuleAction {

    @Override
    public ActionResult apply(List<MemoryInfo> memories, QuantumRouter router) {
        var protocol = new EntanglementGeneration(router, memories.get(0).index(), peer, initiator);
        return initiator ? ActionResult.request(protocol, peer, new GenerationMatcher())
                         : ActionResult.respond(protocol);
    }
}
