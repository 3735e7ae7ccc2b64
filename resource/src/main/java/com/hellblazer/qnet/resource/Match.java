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
package com.hellblazer.qnet.resource;

/**
 * Result of a {@link ProtocolMatcher}: the pending protocol that partners the requester, possibly formed by merging
 * two pending protocols.
 *
 * @author hal.hildebrand
 */
public sealed interface Match permits Match.Single, Match.Merge {

    static Match single(EntanglementProtocol protocol) {
        return new Single(protocol);
    }

    static Match merge(EntanglementProtocol keep, EntanglementProtocol absorb) {
        return new Merge(keep, absorb);
    }

    /**
     * One pending protocol partners the requester as is.
     */
    record Single(EntanglementProtocol protocol) implements Match {
    }

    /**
     * Two pending protocols combine into the partner: {@code keep} absorbs the memories of {@code absorb}. The
     * resource manager performs the merge as a single replacement in its pending table.
     */
    record Merge(EntanglementProtocol keep, EntanglementProtocol absorb) implements Match {
        public Merge {
            if (keep == absorb) {
                throw new IllegalArgumentException("Cannot merge a protocol with itself: " + keep.getName());
            }
        }
    }
}
