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
package com.hellblazer.qnet.resource.rule;

import com.hellblazer.qnet.resource.EntanglementProtocol;
import com.hellblazer.qnet.resource.ProtocolMatcher;

import java.util.List;

/**
 * Outcome of a {@link RuleAction}: the new protocol, and one matcher per peer node whose cooperation it requires.
 *
 * @param protocol the protocol, owning the memories it will occupy
 * @param peers    nodes that must confirm a partner protocol
 * @param matchers one matcher per peer, selecting the partner among that peer's pending protocols
 * @param mode     how the protocol is brought up
 * @author hal.hildebrand
 */
public record ActionResult(EntanglementProtocol protocol, List<String> peers, List<ProtocolMatcher> matchers,
                           Mode mode) {

    public enum Mode {
        /**
         * Request a partner from every peer; activate once all confirm.
         */
        REQUEST,
        /**
         * Wait until a peer's request selects this protocol.
         */
        RESPOND,
        /**
         * Activate immediately, no partner required.
         */
        STANDALONE
    }

    public ActionResult {
        if (protocol == null) {
            throw new RuleViolationException("Action produced no protocol");
        }
        peers = List.copyOf(peers);
        matchers = List.copyOf(matchers);
        if (peers.size() != matchers.size()) {
            throw new RuleViolationException(
                String.format("%s: %d peers but %d matchers", protocol.getName(), peers.size(), matchers.size()));
        }
        if (mode == Mode.REQUEST && peers.isEmpty()) {
            throw new RuleViolationException(protocol.getName() + ": request without peers");
        }
        if (mode != Mode.REQUEST && !peers.isEmpty()) {
            throw new RuleViolationException(protocol.getName() + ": " + mode + " cannot name peers");
        }
    }

    public static ActionResult request(EntanglementProtocol protocol, String peer, ProtocolMatcher matcher) {
        return new ActionResult(protocol, List.of(peer), List.of(matcher), Mode.REQUEST);
    }

    public static ActionResult request(EntanglementProtocol protocol, List<String> peers,
                                       List<ProtocolMatcher> matchers) {
        return new ActionResult(protocol, peers, matchers, Mode.REQUEST);
    }

    public static ActionResult respond(EntanglementProtocol protocol) {
        return new ActionResult(protocol, List.of(), List.of(), Mode.RESPOND);
    }

    public static ActionResult standalone(EntanglementProtocol protocol) {
        return new ActionResult(protocol, List.of(), List.of(), Mode.STANDALONE);
    }
}
