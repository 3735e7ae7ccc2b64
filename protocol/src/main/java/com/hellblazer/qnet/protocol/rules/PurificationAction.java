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

import com.hellblazer.qnet.protocol.BBPSSW;
import com.hellblazer.qnet.protocol.PurificationMatcher;
import com.hellblazer.qnet.resource.QuantumRouter;
import com.hellblazer.qnet.resource.memory.MemoryInfo;
import com.hellblazer.qnet.resource.rule.ActionResult;
import com.hellblazer.qnet.resource.rule.RuleAction;

import java.util.List;

/**
 * Creates a purification protocol. The initiator owns the kept and measured slots and asks the remote router to
 * merge the protocols holding their partners; the responder creates one waiting protocol per slot.
 *
 * @param initiator whether this side requests
 * @author hal.hildebrand
 */
public record PurificationAction(boolean initiator) implements RuleAction {

    @Override
    public ActionResult apply(List<MemoryInfo> memories, QuantumRouter router) {
        var kept = memories.get(0);
        if (!initiator) {
            return ActionResult.respond(new BBPSSW(router, kept.index()));
        }
        var measured = memories.get(1);
        var protocol = new BBPSSW(router, kept.index(), measured.index());
        return ActionResult.request(protocol, kept.remoteNode(),
                                    new PurificationMatcher(kept.remoteMemo(), measured.remoteMemo()));
    }
}
