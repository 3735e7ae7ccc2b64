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

import java.util.Optional;

/**
 * Sent with a negotiation request; evaluated by the receiving resource manager to select which of its pending
 * protocols partners the requester. Implementations are immutable values.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface ProtocolMatcher {

    /**
     * @param pending   the receiver's protocols awaiting a request; must not be modified
     * @param requester name of the requesting node
     * @return the partner, or empty if none qualifies
     */
    Optional<Match> match(PendingProtocols pending, String requester);
}
