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

import com.hellblazer.qnet.protocol.EntanglementSwappingA;
import com.hellblazer.qnet.protocol.SwappingConfig;
import com.hellblazer.qnet.protocol.SwappingMatcher;
import com.hellblazer.qnet.resource.QuantumRouter;
import com.hellblazer.qnet.resource.memory.MemoryInfo;
import com.hellblazer.qnet.resource.rule.ActionResult;
import com.hellblazer.qnet.resource.rule.RuleAction;

import java.util.List;

/**
 * Creates the intermediate swapping protocol for a left and a right slot, requesting the end protocols that hold
 * their partners.
 *
 * @author hal.hildebrand
 */
public record SwappingAAction(SwappingConfig config) implements RuleAction {

    @Override
    public ActionResult apply(List<MemoryInfo> memories, QuantumRouter router) {
        var left = memories.get(0);
        var right = memories.get(1);
        var protocol = new EntanglementSwappingA(router, left.index(), right.index(), config);
        return ActionResult.request(protocol, List.of(left.remoteNode(), right.remoteNode()),
                                    List.of(new SwappingMatcher(left.remoteMemo()),
                                            new SwappingMatcher(right.remoteMemo())));
    }
}
