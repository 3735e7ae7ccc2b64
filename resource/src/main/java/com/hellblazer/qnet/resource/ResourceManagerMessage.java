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

import com.hellblazer.qnet.network.Payload;

import java.util.List;

/**
 * Negotiation messages exchanged between resource managers.
 *
 * @author hal.hildebrand
 */
public sealed interface ResourceManagerMessage extends Payload
    permits ResourceManagerMessage.Request, ResourceManagerMessage.Response, ResourceManagerMessage.Release {

    /**
     * Ask the receiver for a partner protocol.
     *
     * @param requirementId identifies the requirement, echoed in the response
     * @param protocol      requesting protocol name
     * @param memories      slots the requesting protocol owns
     * @param matcher       selects the partner among the receiver's pending protocols
     */
    record Request(long requirementId, String protocol, List<Integer> memories, ProtocolMatcher matcher)
        implements ResourceManagerMessage {
        public Request {
            memories = List.copyOf(memories);
        }
    }

    /**
     * Answer to a {@link Request}.
     *
     * @param requirementId  the request's requirement id
     * @param approved       whether a partner was found
     * @param protocol       requesting protocol name
     * @param pairedProtocol the partner's name, null when rejected
     * @param pairedMemories slots the partner owns, empty when rejected
     */
    record Response(long requirementId, boolean approved, String protocol, String pairedProtocol,
                    List<Integer> pairedMemories) implements ResourceManagerMessage {
        public Response {
            pairedMemories = List.copyOf(pairedMemories);
        }

        static Response approve(Request request, EntanglementProtocol partner) {
            return new Response(request.requirementId(), true, request.protocol(), partner.getName(),
                                partner.getMemoryIndices());
        }

        static Response reject(Request request) {
            return new Response(request.requirementId(), false, request.protocol(), null, List.of());
        }
    }

    /**
     * Best effort notice that the partner of the named protocol was cancelled.
     *
     * @param protocol the receiver's protocol to release
     */
    record Release(String protocol) implements ResourceManagerMessage {
    }
}
