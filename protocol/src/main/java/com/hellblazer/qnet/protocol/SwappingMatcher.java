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

import com.hellblazer.qnet.resource.Match;
import com.hellblazer.qnet.resource.PendingProtocols;
import com.hellblazer.qnet.resource.ProtocolKind;
import com.hellblazer.qnet.resource.ProtocolMatcher;

import java.util.Optional;

/**
 * Selects the pending end-router swapping protocol holding the given slot.
 *
 * @param memory the receiver's slot entangled with the intermediate router
 * @author hal.hildebrand
 */
public record SwappingMatcher(int memory) implements ProtocolMatcher {

    @Override
    public Optional<Match> match(PendingProtocols pending, String requester) {
        var protocol = pending.byMemory(memory);
        if (protocol == null || protocol.kind() != ProtocolKind.SWAPPING_B) {
            return Optional.empty();
        }
        return Optional.of(Match.single(protocol));
    }
}
