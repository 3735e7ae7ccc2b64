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

import com.hellblazer.qnet.kernel.Event;
import com.hellblazer.qnet.network.Address;
import com.hellblazer.qnet.network.Message;
import com.hellblazer.qnet.resource.memory.MemoryInfo;
import com.hellblazer.qnet.resource.memory.MemoryManager;
import com.hellblazer.qnet.resource.memory.MemoryState;
import com.hellblazer.qnet.resource.rule.ActionResult;
import com.hellblazer.qnet.resource.rule.Rule;
import com.hellblazer.qnet.resource.rule.RuleManager;
import com.hellblazer.qnet.resource.rule.RuleViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orchestrates the memories of one router: evaluates installed rules whenever memory state changes, spawns the
 * protocols their actions create, and negotiates partner protocols with peer routers.
 * <p>
 * Rule pass: rules are visited by descending priority, ties in installation order. Each rule's condition is
 * evaluated against every slot that is not OCCUPIED; when it yields memories, the action creates a protocol and every
 * slot that protocol owns becomes OCCUPIED at once, so no later rule in the same pass can claim it. A state change
 * made while a pass runs schedules one more pass after it rather than re-entering.
 * <p>
 * Negotiation:
 * <ol>
 *   <li>A requesting protocol sends one {@link ResourceManagerMessage.Request} per peer, carrying a matcher</li>
 *   <li>The peer evaluates the matcher against its protocols awaiting a request, and approves with the partner it
 *   selected (activating it) or rejects</li>
 *   <li>The requester activates its protocol once every peer approved; any rejection fails it, reverting its slots
 *   to RAW</li>
 * </ol>
 * Cancelled protocols invalidate their requirements, so late responses are recognized by requirement id and
 * ignored; an approval arriving for a cancelled protocol is answered with a release so the partner does not linger.
 *
 * @author hal.hildebrand
 */
public class ResourceManager {
    private static final Logger log = LoggerFactory.getLogger(ResourceManager.class);

    /**
     * Counters describing negotiation activity.
     *
     * @param requests         requests sent
     * @param approvals        requests this router approved
     * @param rejections       requests this router rejected
     * @param cancellations    protocols cancelled or failed by negotiation
     * @param ignoredResponses responses for requirements no longer outstanding
     * @param expiredMemories  entangled memories lost to decoherence
     */
    public record Statistics(long requests, long approvals, long rejections, long cancellations,
                             long ignoredResponses, long expiredMemories) {
    }

    private static class Negotiation {
        final EntanglementProtocol protocol;
        final Set<Long>            unresolved = new LinkedHashSet<>();
        Event timeout;

        Negotiation(EntanglementProtocol protocol) {
            this.protocol = protocol;
        }
    }

    private final QuantumRouter                      owner;
    private final ResourceManagerConfig              config;
    private final MemoryManager                      memoryManager;
    private final RuleManager                        ruleManager  = new RuleManager();
    private final PendingProtocols                   awaiting     = new PendingProtocols();
    private final Map<String, Negotiation>           negotiations = new LinkedHashMap<>();
    private final Map<Long, PendingRequirement>      requirements = new HashMap<>();
    private final Map<String, EntanglementProtocol>  active       = new LinkedHashMap<>();
    private final Map<Integer, EntanglementProtocol> owners       = new HashMap<>();
    private final long[]                             expiryVersion;
    private       long                               nextRequirement;
    private       boolean                            evaluating;
    private       boolean                            reevaluate;
    private       long                               requests;
    private       long                               approvals;
    private       long                               rejections;
    private       long                               cancellations;
    private       long                               ignoredResponses;
    private       long                               expiredMemories;

    public ResourceManager(QuantumRouter owner, MemoryManager memoryManager, ResourceManagerConfig config) {
        this.owner = owner;
        this.memoryManager = memoryManager;
        this.config = config;
        this.expiryVersion = new long[memoryManager.size()];
        Arrays.fill(expiryVersion, -1);
    }

    /**
     * Install a rule and evaluate it against the current memories.
     */
    public void load(Rule rule) {
        ruleManager.load(rule);
        log.debug("{} loaded {}", owner.getName(), rule);
        evaluate();
    }

    /**
     * Remove a rule, cancelling every protocol it spawned that has not terminated.
     */
    public void expire(Rule rule) {
        var spawned = ruleManager.expire(rule);
        log.debug("{} expired {}, cancelling {} protocols", owner.getName(), rule, spawned.size());
        for (var protocol : spawned) {
            cancel(protocol, null, "rule expired");
        }
    }

    /**
     * Apply new states to memory slots and re-evaluate the rules.
     *
     * @param protocol the protocol releasing the slots, or null for slots no protocol owns
     * @param updates  new state per slot; OCCUPIED is reserved to rule evaluation
     * @throws IllegalStateException if the protocol does not own a slot, or an unowned update targets an owned slot
     */
    public void update(EntanglementProtocol protocol, Map<Integer, MemoryState> updates) {
        for (var entry : updates.entrySet()) {
            int index = entry.getKey();
            var state = entry.getValue();
            if (state == MemoryState.OCCUPIED) {
                throw new IllegalArgumentException("Slots become OCCUPIED only through rules: " + index);
            }
            var holder = owners.get(index);
            if (holder != protocol) {
                throw new IllegalStateException(String.format("%s: slot %d is owned by %s, not %s", owner.getName(),
                                                              index, describe(holder), describe(protocol)));
            }
            if (protocol != null) {
                owners.remove(index);
            }
            applyState(index, state);
        }
        if (protocol != null && !ownsAny(protocol)) {
            retire(protocol);
        }
        evaluate();
    }

    public void update(EntanglementProtocol protocol, int index, MemoryState state) {
        var updates = new LinkedHashMap<Integer, MemoryState>();
        updates.put(index, state);
        update(protocol, updates);
    }

    /**
     * Handle a negotiation message addressed to this resource manager.
     */
    public void receivedMessage(String src, Message msg) {
        var payload = msg.payload();
        if (payload instanceof ResourceManagerMessage.Request request) {
            onRequest(src, request);
        } else if (payload instanceof ResourceManagerMessage.Response response) {
            onResponse(src, response);
        } else if (payload instanceof ResourceManagerMessage.Release release) {
            onRelease(src, release);
        } else {
            log.debug("{} resource manager dropping {} from {}", owner.getName(), payload, src);
        }
    }

    /**
     * Run rule passes until no state change is left unevaluated.
     */
    public void evaluate() {
        if (evaluating) {
            reevaluate = true;
            return;
        }
        evaluating = true;
        try {
            do {
                reevaluate = false;
                pass();
            } while (reevaluate);
        } finally {
            evaluating = false;
        }
    }

    private void pass() {
        for (var rule : ruleManager) {
            for (int i = 0; i < memoryManager.size() && ruleManager.contains(rule); i++) {
                var info = memoryManager.get(i);
                if (info.state() == MemoryState.OCCUPIED) {
                    continue;
                }
                var matched = rule.evaluate(info, memoryManager);
                if (!matched.isEmpty()) {
                    fire(rule, matched);
                }
            }
        }
    }

    private void fire(Rule rule, List<MemoryInfo> matched) {
        for (var info : matched) {
            if (memoryManager.get(info.index()).state() == MemoryState.OCCUPIED) {
                throw new RuleViolationException(
                    String.format("%s: %s matched occupied slot %d", owner.getName(), rule, info.index()));
            }
        }
        ActionResult result = rule.apply(matched, owner);
        var protocol = result.protocol();
        if (protocol.getOwner() != owner) {
            throw new RuleViolationException(
                String.format("%s: %s created %s for another router", owner.getName(), rule, protocol.getName()));
        }
        var indices = protocol.getMemoryIndices();
        if (indices.isEmpty() || new HashSet<>(indices).size() != indices.size()) {
            throw new RuleViolationException(
                String.format("%s: %s claims invalid slots %s", owner.getName(), protocol.getName(), indices));
        }
        for (var index : indices) {
            if (index < 0 || index >= memoryManager.size() || owners.containsKey(index)
                || memoryManager.get(index).state() == MemoryState.OCCUPIED) {
                throw new RuleViolationException(
                    String.format("%s: %s claims unavailable slot %d", owner.getName(), protocol.getName(), index));
            }
        }
        protocol.setRule(rule);
        rule.addProtocol(protocol);
        for (var index : indices) {
            owners.put(index, protocol);
            memoryManager.setState(index, MemoryState.OCCUPIED);
        }
        log.trace("{}: {} spawned {} ({})", owner.getName(), rule, protocol.getName(), result.mode());
        switch (result.mode()) {
            case STANDALONE -> activate(protocol);
            case RESPOND -> awaiting.add(protocol);
            case REQUEST -> request(protocol, result);
        }
    }

    private void request(EntanglementProtocol protocol, ActionResult result) {
        var negotiation = new Negotiation(protocol);
        negotiations.put(protocol.getName(), negotiation);
        var peers = result.peers();
        var matchers = result.matchers();
        for (int i = 0; i < peers.size(); i++) {
            var requirement = new PendingRequirement(nextRequirement++, peers.get(i), matchers.get(i), protocol);
            requirements.put(requirement.id(), requirement);
            negotiation.unresolved.add(requirement.id());
        }
        // requirements are all registered before any request leaves
        for (var id : new ArrayList<>(negotiation.unresolved)) {
            var requirement = requirements.get(id);
            requests++;
            owner.send(requirement.target(), Address.resourceManager(),
                       new ResourceManagerMessage.Request(id, protocol.getName(), protocol.getMemoryIndices(),
                                                          requirement.matcher()));
        }
        if (config.isNegotiationTimeoutEnabled()) {
            negotiation.timeout = owner.getTimeline()
                                       .scheduleAfter(config.getNegotiationTimeout(), () -> timeout(negotiation));
        }
    }

    private void onRequest(String src, ResourceManagerMessage.Request request) {
        var match = request.matcher().match(awaiting, src);
        var partner = match.map(this::claim).orElse(null);
        if (partner == null) {
            rejections++;
            log.debug("{} rejecting {} from {}: no pending partner", owner.getName(), request.protocol(), src);
            owner.send(src, Address.resourceManager(), ResourceManagerMessage.Response.reject(request));
            return;
        }
        approvals++;
        partner.addPeer(new Peer(src, request.protocol(), request.memories()));
        owner.send(src, Address.resourceManager(), ResourceManagerMessage.Response.approve(request, partner));
        activate(partner);
    }

    /**
     * Take the matched protocol out of the pending table. A merge replaces both inputs with the merged protocol in a
     * single step, after the matcher has finished reading the table.
     */
    private EntanglementProtocol claim(Match match) {
        if (match instanceof Match.Single single) {
            var protocol = single.protocol();
            if (!awaiting.remove(protocol)) {
                log.warn("{}: matcher selected {} which is not pending", owner.getName(), protocol.getName());
                return null;
            }
            return protocol;
        }
        var merge = (Match.Merge) match;
        var keep = merge.keep();
        var absorb = merge.absorb();
        if (!awaiting.contains(keep) || !awaiting.contains(absorb)) {
            log.warn("{}: matcher merged {} and {} which are not both pending", owner.getName(), keep.getName(),
                     absorb.getName());
            return null;
        }
        var merged = keep.merge(absorb);
        var expected = new HashSet<>(keep.getMemoryIndices());
        expected.addAll(absorb.getMemoryIndices());
        if (merged.getOwner() != owner || !expected.equals(new HashSet<>(merged.getMemoryIndices()))) {
            throw new IllegalStateException(
                String.format("%s: merge of %s and %s produced %s", owner.getName(), keep, absorb, merged));
        }
        awaiting.remove(keep);
        awaiting.remove(absorb);
        for (var index : merged.getMemoryIndices()) {
            owners.put(index, merged);
        }
        merged.setRule(keep.getRule());
        keep.getRule().replaceProtocol(keep, merged);
        if (absorb.getRule() != null) {
            absorb.getRule().removeProtocol(absorb);
        }
        keep.cancel();
        absorb.cancel();
        log.trace("{} merged {} and {} into {}", owner.getName(), keep.getName(), absorb.getName(), merged.getName());
        return merged;
    }

    private void onResponse(String src, ResourceManagerMessage.Response response) {
        var requirement = requirements.remove(response.requirementId());
        var negotiation = requirement == null ? null : negotiations.get(requirement.protocol().getName());
        if (negotiation == null || negotiation.protocol != requirement.protocol()) {
            ignoredResponses++;
            log.debug("{} ignoring response for {} from {}: no longer negotiating", owner.getName(),
                      response.protocol(), src);
            if (response.approved()) {
                owner.send(src, Address.resourceManager(),
                           new ResourceManagerMessage.Release(response.pairedProtocol()));
            }
            return;
        }
        var protocol = negotiation.protocol;
        negotiation.unresolved.remove(response.requirementId());
        if (!response.approved()) {
            log.debug("{}: {} rejected by {}", owner.getName(), protocol.getName(), src);
            cancel(protocol, null, "rejected by " + src);
            return;
        }
        protocol.addPeer(new Peer(src, response.pairedProtocol(), response.pairedMemories()));
        if (negotiation.unresolved.isEmpty()) {
            negotiations.remove(protocol.getName());
            if (negotiation.timeout != null) {
                negotiation.timeout.cancel();
            }
            activate(protocol);
        }
    }

    private void onRelease(String src, ResourceManagerMessage.Release release) {
        var protocol = find(release.protocol());
        if (protocol == null) {
            log.debug("{} ignoring release of {} from {}: unknown protocol", owner.getName(), release.protocol(), src);
            return;
        }
        cancel(protocol, src, "released by " + src);
    }

    private void timeout(Negotiation negotiation) {
        if (negotiations.get(negotiation.protocol.getName()) != negotiation) {
            return;
        }
        log.debug("{}: negotiation of {} timed out", owner.getName(), negotiation.protocol.getName());
        cancel(negotiation.protocol, null, "negotiation timed out");
    }

    private void activate(EntanglementProtocol protocol) {
        active.put(protocol.getName(), protocol);
        owner.addProtocol(protocol);
        protocol.activate();
    }

    /**
     * Tear down a protocol: invalidate its negotiation, notify its negotiated peers (except the one that asked for
     * the release), and revert every slot it still owns to RAW.
     */
    private void cancel(EntanglementProtocol protocol, String exceptPeer, String reason) {
        boolean holdsSlots = ownsAny(protocol);
        if (protocol.isTerminal() && !holdsSlots) {
            return;
        }
        cancellations++;
        var negotiation = negotiations.get(protocol.getName());
        if (negotiation != null && negotiation.protocol == protocol) {
            negotiations.remove(protocol.getName());
            for (var id : negotiation.unresolved) {
                requirements.remove(id);
            }
            if (negotiation.timeout != null) {
                negotiation.timeout.cancel();
            }
        }
        awaiting.remove(protocol);
        if (active.get(protocol.getName()) == protocol) {
            active.remove(protocol.getName());
        }
        owner.removeProtocol(protocol);
        for (var peer : protocol.getPeers()) {
            if (!peer.node().equals(exceptPeer)) {
                owner.send(peer.node(), Address.resourceManager(), new ResourceManagerMessage.Release(peer.protocol()));
            }
        }
        protocol.cancel();
        if (protocol.getRule() != null) {
            protocol.getRule().removeProtocol(protocol);
        }
        for (var index : protocol.getMemoryIndices()) {
            if (owners.get(index) == protocol) {
                owners.remove(index);
                memoryManager.getMemory(index).reset();
                applyState(index, MemoryState.RAW);
            }
        }
        log.debug("{} cancelled {}: {}", owner.getName(), protocol.getName(), reason);
        evaluate();
    }

    private void retire(EntanglementProtocol protocol) {
        if (active.get(protocol.getName()) == protocol) {
            active.remove(protocol.getName());
        }
        owner.removeProtocol(protocol);
        awaiting.remove(protocol);
        if (protocol.getRule() != null) {
            protocol.getRule().removeProtocol(protocol);
        }
        log.trace("{} retired {}", owner.getName(), protocol);
    }

    private void applyState(int index, MemoryState state) {
        memoryManager.setState(index, state);
        if (state == MemoryState.ENTANGLED) {
            scheduleExpiry(index);
        }
    }

    private void scheduleExpiry(int index) {
        long coherence = owner.getHardware().coherenceTime();
        if (coherence <= 0) {
            return;
        }
        var memory = memoryManager.getMemory(index);
        long version = memory.getVersion();
        if (expiryVersion[index] == version) {
            return;
        }
        expiryVersion[index] = version;
        var timeline = owner.getTimeline();
        long at = Math.max(timeline.now(), memory.getEntangleTime() + coherence);
        timeline.schedule(at, () -> expireMemory(index, version));
    }

    private void expireMemory(int index, long version) {
        var memory = memoryManager.getMemory(index);
        if (memory.getVersion() != version || !memory.isEntangled()) {
            return;
        }
        expiredMemories++;
        log.debug("{}: memory {} decohered", owner.getName(), memory.getId());
        var holder = owners.get(index);
        if (holder != null) {
            cancel(holder, null, "memory " + index + " expired");
            return;
        }
        memory.reset();
        applyState(index, MemoryState.RAW);
        evaluate();
    }

    private EntanglementProtocol find(String name) {
        var protocol = active.get(name);
        if (protocol == null) {
            protocol = awaiting.get(name);
        }
        if (protocol == null) {
            var negotiation = negotiations.get(name);
            protocol = negotiation == null ? null : negotiation.protocol;
        }
        return protocol;
    }

    private boolean ownsAny(EntanglementProtocol protocol) {
        for (var index : protocol.getMemoryIndices()) {
            if (owners.get(index) == protocol) {
                return true;
            }
        }
        return false;
    }

    private static String describe(EntanglementProtocol protocol) {
        return protocol == null ? "no protocol" : protocol.getName();
    }

    /**
     * @return the protocol owning the slot, or null
     */
    public EntanglementProtocol getOwner(int index) {
        return owners.get(index);
    }

    public RuleManager getRuleManager() {
        return ruleManager;
    }

    public MemoryManager getMemoryManager() {
        return memoryManager;
    }

    /**
     * @return protocols awaiting a peer's request
     */
    public PendingProtocols getPendingProtocols() {
        return awaiting;
    }

    /**
     * @return names of protocols awaiting responses to their own requests
     */
    public List<String> getNegotiatingProtocols() {
        return List.copyOf(negotiations.keySet());
    }

    public List<EntanglementProtocol> getActiveProtocols() {
        return List.copyOf(active.values());
    }

    public int getOutstandingRequirements() {
        return requirements.size();
    }

    public ResourceManagerConfig getConfig() {
        return config;
    }

    public Statistics getStatistics() {
        return new Statistics(requests, approvals, rejections, cancellations, ignoredResponses, expiredMemories);
    }

    @Override
    public String toString() {
        return String.format("ResourceManager{%s, rules=%d, pending=%d, negotiating=%d, active=%d}", owner.getName(),
                             ruleManager.size(), awaiting.size(), negotiations.size(), active.size());
    }
}
