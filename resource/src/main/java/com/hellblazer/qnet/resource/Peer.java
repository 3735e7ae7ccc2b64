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

import java.util.List;

/**
 * The partner protocol negotiated on another node.
 *
 * @param node     peer node name
 * @param protocol name of the partner protocol on that node
 * @param memories slot indices the partner protocol owns
 * @author hal.hildebrand
 */
public record Peer(String node, String protocol, List<Integer> memories) {

    public Peer {
        memories = List.copyOf(memories);
    }
}
