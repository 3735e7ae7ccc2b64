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

import com.hellblazer.qnet.resource.EntanglementProtocol;
import com.hellblazer.qnet.resource.Match;
import com.hellblazer.qnet.resource.PendingProtocols;
import com.hellblazer.qnet.resource.ProtocolKind;
import com.hellblazer.qnet.resource.ProtocolMatcher;

import java.util.Optional;

/**
 * Merges the two pending purification protocols that hold the partners of the requester's kept and measured slots.
 *
 * @param remoteKept     the receiver's slot paired with the requester's kept slot
 * @param remoteMeasured the receiver's slot paired with the requester's measured slot
 * @author hal.hildebrand
 */
public record PurificationMatcher(int remoteKept, int remoteMeasured) implements ProtocolMatcher {

    @Override
    public Optional<Match> match(PendingProtocols pending, String requester) {
        var keep = pending.byMemory(remoteKept);
        var absorb = pending.byMemory(remoteMeasured);
        if (!waiting(keep) || !waiting(absorb) || keep == absorb) {
            return Optional.empty();
        }
        return Optional.of(Match.merge(keep, absorb));
    }

    private static boolean waiting(EntanglementProtocol protocol) {
        return protocol != null && protocol.kind() == ProtocolKind.PURIFICATION
            && protocol.getMemoryIndices().size() == 1;
    }
}
