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

import com.hellblazer.qnet.network.Payload;

/**
 * Swapping result sent to each end node.
 *
 * @param success    whether the Bell state measurement succeeded
 * @param fidelity   fidelity of the new end-to-end pair, zero on failure
 * @param remoteNode the other end node
 * @param remoteMemo the other end's slot
 * @param time       time of the swap
 * @author hal.hildebrand
 */
public record SwappingMessage(boolean success, double fidelity, String remoteNode, int remoteMemo, long time)
    implements Payload {
}
