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
 * An outstanding request for a partner protocol on another node. Responses are matched to requirements by id, so a
 * response for a cancelled protocol finds nothing and is ignored.
 *
 * @param id       router-unique requirement id
 * @param target   node asked for a partner
 * @param matcher  selects the partner among the target's pending protocols
 * @param protocol the requesting protocol
 * @author hal.hildebrand
 */
public record PendingRequirement(long id, String target, ProtocolMatcher matcher, EntanglementProtocol protocol) {
}
