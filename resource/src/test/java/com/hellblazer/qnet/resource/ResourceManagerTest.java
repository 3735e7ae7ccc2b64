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

import com.hellblazer.qnet.kernel.Timeline;
import com.hellblazer.qnet.network.ClassicalChannel;
import com.hellblazer.qnet.network.Message;
import com.hellblazer.qnet.network.Node;
import com.hellblazer.qnet.network.Payload;
import com.hellblazer.qnet.resource.hardware.HardwareConfig;
import com.hellblazer.qnet.resource.memory.MemoryId;
import com.hellblazer.qnet.resource.memory.MemoryState;
import com.hellblazer.qnet.resource.rule.ActionResult;
import com.hellblazer.qnet.resource.rule.Rule;
import com.hellblazer.qnet.resource.rule.RuleViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntPredicate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for rule evaluation, slot ownership and cross-node negotiation.
 *
 * @author hal.hildebrand
 */
class ResourceManagerTest {

    private static final long DELAY = 5_000_000L;

    record Ping(String value) implements Payload {
    }

    private static final ProtocolMatcher FIRST_PENDING = (pending, requester) -> pending.ofKind(
        ProtocolKind.GENERATION).stream().findFirst().map(Match::single);

    private Timeline      timeline;
    private QuantumRouter alice;

    @BeforeEach
    void setUp() {
        timeline = new Timeline();
        alice = router("alice", ResourceManagerConfig.defaultConfig());
    }

    private QuantumRouter router(String name, ResourceManagerConfig config) {
        return new QuantumRouter(name, timeline, HardwareConfig.builder().withMemorySize(4).build(), config);
    }

    private void connect(Node a, Node b) {
        new ClassicalChannel("cc_" + a.getName() + "_" + b.getName(), timeline, 1_000).setEnds(a, b);
    }

    /**
     * Claims single RAW slots accepted by the filter, at most budget times, in the given mode.
     */
    private static Rule rule(int priority, IntPredicate slots, AtomicInteger budget, ActionResult.Mode mode,
                             String peer, ProtocolMatcher matcher, List<HoldingProtocol> spawned) {
        return new Rule(priority, (memory, manager) -> {
            if (memory.state() != MemoryState.RAW || !slots.test(memory.index()) || budget.get() <= 0) {
                return List.of();
            }
            budget.decrementAndGet();
            return List.of(memory);
        }, (memories, router) -> {
            var protocol = new HoldingProtocol(router, List.of(memories.get(0).index()));
            spawned.add(protocol);
            return switch (mode) {
                case REQUEST -> ActionResult.request(protocol, peer, matcher);
                case RESPOND -> ActionResult.respond(protocol);
                case STANDALONE -> ActionResult.standalone(protocol);
            };
        });
    }

    private static Rule standalone(int priority, IntPredicate slots, List<HoldingProtocol> spawned) {
        return rule(priority, slots, new AtomicInteger(Integer.MAX_VALUE), ActionResult.Mode.STANDALONE, null, null,
                    spawned);
    }

    @Test
    void testPriorityDecidesOverlappingClaims() {
        var high = new ArrayList<HoldingProtocol>();
        var low = new ArrayList<HoldingProtocol>();
        var resourceManager = alice.getResourceManager();
        var lowRule = standalone(1, i -> true, low);
        var highRule = standalone(10, i -> i % 2 == 0, high);
        resourceManager.getRuleManager().load(lowRule);
        resourceManager.getRuleManager().load(highRule);

        resourceManager.evaluate();

        assertEquals(List.of(0, 2), high.stream().map(EntanglementProtocol::getKey).toList());
        assertEquals(List.of(1, 3), low.stream().map(EntanglementProtocol::getKey).toList());
        assertEquals(4, alice.getMemoryManager().count(MemoryState.OCCUPIED));
        for (int i = 0; i < 4; i++) {
            assertSame(i % 2 == 0 ? high.get(i / 2) : low.get(i / 2), resourceManager.getOwner(i));
        }

        // a released slot goes back to the higher priority rule
        high.get(0).release(MemoryState.RAW);
        assertEquals(3, high.size());
        assertSame(high.get(2), resourceManager.getOwner(0));
        assertEquals(2, low.size());
        assertEquals(List.of(high.get(1), high.get(2)), highRule.getProtocols());
    }

    @Test
    void testMultiSlotClaimsAreDisjoint() {
        var single = new ArrayList<HoldingProtocol>();
        var pairs = new ArrayList<HoldingProtocol>();
        var pairRule = new Rule(10, (memory, manager) -> {
            int next = memory.index() + 1;
            if (memory.state() != MemoryState.RAW || next >= manager.size()
                || manager.get(next).state() != MemoryState.RAW) {
                return List.of();
            }
            return List.of(memory, manager.get(next));
        }, (memories, router) -> {
            var protocol = new HoldingProtocol(router, List.of(memories.get(0).index(), memories.get(1).index()));
            pairs.add(protocol);
            return ActionResult.standalone(protocol);
        });
        var resourceManager = alice.getResourceManager();
        resourceManager.getRuleManager().load(standalone(1, i -> true, single));
        resourceManager.getRuleManager().load(pairRule);

        resourceManager.evaluate();

        assertTrue(single.isEmpty());
        assertEquals(List.of(List.of(0, 1), List.of(2, 3)),
                     pairs.stream().map(EntanglementProtocol::getMemoryIndices).toList());
        var owners = new HashSet<EntanglementProtocol>();
        for (int i = 0; i < 4; i++) {
            owners.add(resourceManager.getOwner(i));
        }
        assertEquals(new HashSet<>(pairs), owners);
    }

    @Test
    void testActionClaimingOwnedSlotIsViolation() {
        alice.load(standalone(5, i -> i == 0, new ArrayList<>()));

        var greedy = new Rule(1, (memory, manager) -> memory.index() == 1 ? List.of(memory) : List.of(),
                              (memories, router) -> ActionResult.standalone(
                              new HoldingProtocol(router, List.of(0, 1))));
        assertThrows(RuleViolationException.class, () -> alice.load(greedy));
    }

    @Test
    void testConditionReturningOccupiedSlotIsViolation() {
        alice.load(standalone(5, i -> i == 0, new ArrayList<>()));

        var stale = new Rule(1, (memory, manager) -> memory.index() == 1 ? List.of(manager.get(0)) : List.of(),
                             (memories, router) -> ActionResult.standalone(
                             new HoldingProtocol(router, List.of(memories.get(0).index()))));
        assertThrows(RuleViolationException.class, () -> alice.load(stale));
    }

    @Test
    void testUpdateRequiresOwnership() {
        var spawned = new ArrayList<HoldingProtocol>();
        alice.load(standalone(0, i -> i == 0, spawned));
        var resourceManager = alice.getResourceManager();

        assertThrows(IllegalStateException.class, () -> resourceManager.update(null, 0, MemoryState.RAW));
        assertThrows(IllegalArgumentException.class,
                     () -> resourceManager.update(spawned.get(0), 0, MemoryState.OCCUPIED));
        assertEquals(MemoryState.OCCUPIED, alice.getMemoryManager().get(0).state());
    }

    @Test
    void testSynchronousCompletionDuringPassIsCoalesced() {
        var spawned = new ArrayList<HoldingProtocol>();
        var budget = new AtomicInteger(3);
        var rule = new Rule(0, (memory, manager) -> {
            if (memory.index() != 0 || memory.state() != MemoryState.RAW || budget.get() <= 0) {
                return List.of();
            }
            budget.decrementAndGet();
            return List.of(memory);
        }, (memories, router) -> {
            var protocol = new HoldingProtocol(router, List.of(0));
            protocol.onStart = () -> protocol.release(MemoryState.RAW);
            spawned.add(protocol);
            return ActionResult.standalone(protocol);
        });

        alice.load(rule);

        assertEquals(3, spawned.size());
        for (var protocol : spawned) {
            assertEquals(ProtocolState.FAILED, protocol.getState());
            assertTrue(protocol.started);
        }
        assertEquals(MemoryState.RAW, alice.getMemoryManager().get(0).state());
        assertTrue(rule.getProtocols().isEmpty());
        assertTrue(alice.getProtocols().isEmpty());
        assertTrue(alice.getResourceManager().getActiveProtocols().isEmpty());
    }

    @Test
    void testNegotiationPairsProtocols() {
        var bob = router("bob", ResourceManagerConfig.defaultConfig());
        connect(alice, bob);
        var requesters = new ArrayList<HoldingProtocol>();
        var responders = new ArrayList<HoldingProtocol>();
        bob.load(rule(0, i -> i == 0, new AtomicInteger(1), ActionResult.Mode.RESPOND, null, null, responders));
        alice.load(
            rule(0, i -> i == 0, new AtomicInteger(1), ActionResult.Mode.REQUEST, "bob", FIRST_PENDING, requesters));

        assertEquals(1, bob.getResourceManager().getPendingProtocols().size());
        assertEquals(List.of(requesters.get(0).getName()), alice.getResourceManager().getNegotiatingProtocols());

        timeline.init();
        timeline.run();

        var requester = requesters.get(0);
        var responder = responders.get(0);
        assertEquals(2 * DELAY, timeline.now());
        assertEquals(ProtocolState.ACTIVE, requester.getState());
        assertEquals(ProtocolState.ACTIVE, responder.getState());
        assertEquals(new Peer("bob", responder.getName(), List.of(0)), requester.getPeer("bob"));
        assertEquals(new Peer("alice", requester.getName(), List.of(0)), responder.getPeer("alice"));
        assertTrue(bob.getResourceManager().getPendingProtocols().isEmpty());
        assertTrue(alice.getResourceManager().getNegotiatingProtocols().isEmpty());
        assertEquals(0, alice.getResourceManager().getOutstandingRequirements());
        assertEquals(1, alice.getResourceManager().getStatistics().requests());
        assertEquals(1, bob.getResourceManager().getStatistics().approvals());

        requester.sendToPeers(new Ping("hello"));
        timeline.run();
        assertEquals(List.of(new Ping("hello")), responder.received);
    }

    @Test
    void testRejectionRevertsSlots() {
        var bob = router("bob", ResourceManagerConfig.defaultConfig());
        connect(alice, bob);
        var requesters = new ArrayList<HoldingProtocol>();
        var rule = rule(0, i -> i == 0, new AtomicInteger(1), ActionResult.Mode.REQUEST, "bob", FIRST_PENDING,
                        requesters);
        alice.load(rule);

        timeline.run();

        var requester = requesters.get(0);
        assertEquals(ProtocolState.FAILED, requester.getState());
        assertTrue(requester.cancelled);
        assertFalse(requester.started);
        assertEquals(MemoryState.RAW, alice.getMemoryManager().get(0).state());
        assertTrue(rule.getProtocols().isEmpty());
        assertEquals(1, bob.getResourceManager().getStatistics().rejections());
        assertEquals(1, alice.getResourceManager().getStatistics().cancellations());
        assertEquals(0, alice.getResourceManager().getOutstandingRequirements());
    }

    @Test
    void testLateConfirmationAfterExpireIsIgnored() {
        var bob = router("bob", ResourceManagerConfig.defaultConfig());
        connect(alice, bob);
        var requesters = new ArrayList<HoldingProtocol>();
        var responders = new ArrayList<HoldingProtocol>();
        bob.load(rule(0, i -> i == 0, new AtomicInteger(1), ActionResult.Mode.RESPOND, null, null, responders));
        var rule = rule(0, i -> i == 0, new AtomicInteger(1), ActionResult.Mode.REQUEST, "bob", FIRST_PENDING,
                        requesters);
        alice.load(rule);

        // the request has been approved, the response is in flight
        timeline.runUntil(DELAY + 1);
        assertEquals(ProtocolState.ACTIVE, responders.get(0).getState());

        alice.expire(rule);
        assertEquals(MemoryState.RAW, alice.getMemoryManager().get(0).state());
        assertEquals(ProtocolState.FAILED, requesters.get(0).getState());

        timeline.run();

        assertEquals(1, alice.getResourceManager().getStatistics().ignoredResponses());
        assertFalse(requesters.get(0).started);
        assertTrue(requesters.get(0).getPeers().isEmpty());
        assertEquals(MemoryState.RAW, alice.getMemoryManager().get(0).state());
        // the approved partner was released
        assertTrue(responders.get(0).cancelled);
        assertEquals(MemoryState.RAW, bob.getMemoryManager().get(0).state());
        assertTrue(bob.getProtocols().isEmpty());
    }

    @Test
    @DisplayName("A rejection arriving after the rule expired is ignored without a release")
    void testLateRejectionAfterExpireIsIgnored() {
        var received = new ArrayList<Payload>();
        var bob = new QuantumRouter("bob", timeline, HardwareConfig.builder().withMemorySize(4).build(),
                                    ResourceManagerConfig.defaultConfig()) {
            @Override
            protected void receivedByResourceManager(String src, Message msg) {
                received.add(msg.payload());
                super.receivedByResourceManager(src, msg);
            }
        };
        connect(alice, bob);
        var requesters = new ArrayList<HoldingProtocol>();
        var rule = rule(0, i -> i == 0, new AtomicInteger(1), ActionResult.Mode.REQUEST, "bob", FIRST_PENDING,
                        requesters);
        alice.load(rule);

        // bob has nothing pending, so the request has been rejected and the rejection is in flight
        timeline.runUntil(DELAY + 1);
        assertEquals(1, bob.getResourceManager().getStatistics().rejections());

        alice.expire(rule);
        assertEquals(ProtocolState.FAILED, requesters.get(0).getState());
        assertEquals(MemoryState.RAW, alice.getMemoryManager().get(0).state());

        assertDoesNotThrow(() -> timeline.run());

        var statistics = alice.getResourceManager().getStatistics();
        assertEquals(1, statistics.ignoredResponses());
        assertEquals(1, statistics.cancellations());
        assertEquals(0, alice.getResourceManager().getOutstandingRequirements());
        assertEquals(MemoryState.RAW, alice.getMemoryManager().get(0).state());
        assertEquals(1, received.size());
        assertInstanceOf(ResourceManagerMessage.Request.class, received.get(0));
        assertEquals(2 * DELAY, timeline.now());
    }

    @Test
    void testExpireReleasesNegotiatedPeers() {
        var bob = router("bob", ResourceManagerConfig.defaultConfig());
        connect(alice, bob);
        var requesters = new ArrayList<HoldingProtocol>();
        var responders = new ArrayList<HoldingProtocol>();
        var bobRule = rule(0, i -> i == 0, new AtomicInteger(1), ActionResult.Mode.RESPOND, null, null, responders);
        bob.load(bobRule);
        alice.load(
            rule(0, i -> i == 0, new AtomicInteger(1), ActionResult.Mode.REQUEST, "bob", FIRST_PENDING, requesters));
        timeline.run();
        assertEquals(ProtocolState.ACTIVE, requesters.get(0).getState());

        bob.expire(bobRule);
        assertEquals(MemoryState.RAW, bob.getMemoryManager().get(0).state());
        timeline.run();

        assertTrue(requesters.get(0).cancelled);
        assertEquals(MemoryState.RAW, alice.getMemoryManager().get(0).state());
        assertTrue(alice.getProtocols().isEmpty());
        assertTrue(alice.getResourceManager().getActiveProtocols().isEmpty());
    }

    @Test
    void testNegotiationTimeout() {
        alice = router("alice2", ResourceManagerConfig.builder().withNegotiationTimeout(4 * DELAY).build());
        var silent = new Node("silent", timeline);
        connect(alice, silent);
        var requesters = new ArrayList<HoldingProtocol>();
        alice.load(rule(0, i -> i == 0, new AtomicInteger(1), ActionResult.Mode.REQUEST, "silent", FIRST_PENDING,
                        requesters));

        timeline.run();

        assertEquals(4 * DELAY, timeline.now());
        assertEquals(ProtocolState.FAILED, requesters.get(0).getState());
        assertEquals(MemoryState.RAW, alice.getMemoryManager().get(0).state());
        assertTrue(alice.getResourceManager().getNegotiatingProtocols().isEmpty());
        assertEquals(1, alice.getResourceManager().getStatistics().cancellations());
    }

    @Test
    void testInvalidTimeoutRejected() {
        assertThrows(IllegalArgumentException.class, () -> ResourceManagerConfig.builder().withNegotiationTimeout(0));
        assertFalse(ResourceManagerConfig.defaultConfig().isNegotiationTimeoutEnabled());
    }

    @Test
    void testMatcherMergesPendingProtocols() {
        var bob = router("bob", ResourceManagerConfig.defaultConfig());
        connect(alice, bob);
        var responders = new ArrayList<HoldingProtocol>();
        var requesters = new ArrayList<HoldingProtocol>();
        var bobRule = rule(0, i -> i < 2, new AtomicInteger(2), ActionResult.Mode.RESPOND, null, null, responders);
        bob.load(bobRule);
        ProtocolMatcher mergeFirstTwo = (pending, requester) -> {
            var candidates = pending.ofKind(ProtocolKind.GENERATION);
            return candidates.size() < 2 ? Optional.empty()
                                         : Optional.of(Match.merge(candidates.get(0), candidates.get(1)));
        };
        alice.load(rule(0, i -> i == 0, new AtomicInteger(1), ActionResult.Mode.REQUEST, "bob", mergeFirstTwo,
                        requesters));

        timeline.run();

        var bobManager = bob.getResourceManager();
        var merged = bobManager.getOwner(0);
        assertNotNull(merged);
        assertSame(merged, bobManager.getOwner(1));
        assertEquals(List.of(0, 1), merged.getMemoryIndices());
        assertEquals(ProtocolState.ACTIVE, merged.getState());
        assertEquals(List.of(merged), bobRule.getProtocols());
        assertEquals(List.of(merged), bobManager.getActiveProtocols());
        assertTrue(bobManager.getPendingProtocols().isEmpty());
        for (var original : responders) {
            assertEquals(ProtocolState.FAILED, original.getState());
            assertFalse(original.started);
        }
        assertEquals(List.of(0, 1), requesters.get(0).getPeer("bob").memories());
    }

    @Test
    void testCoherenceExpiryRevertsSlot() {
        alice = new QuantumRouter("alice2", timeline,
                                  HardwareConfig.builder().withMemorySize(2).withCoherenceTime(1_000_000L).build(),
                                  ResourceManagerConfig.defaultConfig());
        entangleSlotZero();
        assertEquals(MemoryState.ENTANGLED, alice.getMemoryManager().get(0).state());

        timeline.run();

        assertEquals(1_000_000L, timeline.now());
        assertEquals(MemoryState.RAW, alice.getMemoryManager().get(0).state());
        assertFalse(alice.getMemoryManager().getMemory(0).isEntangled());
        assertEquals(1, alice.getResourceManager().getStatistics().expiredMemories());
    }

    @Test
    void testCoherenceExpiryFailsHolder() {
        alice = new QuantumRouter("alice2", timeline,
                                  HardwareConfig.builder().withMemorySize(2).withCoherenceTime(1_000_000L).build(),
                                  ResourceManagerConfig.defaultConfig());
        entangleSlotZero();
        var holders = new ArrayList<HoldingProtocol>();
        alice.load(new Rule(0, (memory, manager) -> memory.isEntangled() && holders.isEmpty() ? List.of(memory)
                                                                                               : List.of(),
                            (memories, router) -> {
                                var protocol = new HoldingProtocol(router, List.of(memories.get(0).index()));
                                holders.add(protocol);
                                return ActionResult.standalone(protocol);
                            }));
        assertEquals(MemoryState.OCCUPIED, alice.getMemoryManager().get(0).state());

        timeline.run();

        assertTrue(holders.get(0).cancelled);
        assertEquals(MemoryState.RAW, alice.getMemoryManager().get(0).state());
        assertNull(alice.getResourceManager().getOwner(0));
    }

    private void entangleSlotZero() {
        var budget = new AtomicInteger(1);
        alice.load(new Rule(1, (memory, manager) -> {
            if (memory.index() != 0 || memory.state() != MemoryState.RAW || budget.get() <= 0) {
                return List.of();
            }
            budget.decrementAndGet();
            return List.of(memory);
        }, (memories, router) -> {
            var protocol = new HoldingProtocol(router, List.of(0));
            protocol.onStart = () -> {
                router.getMemoryManager().getMemory(0).entangle(new MemoryId("bob", 0), 0.9, timeline.now());
                protocol.release(MemoryState.ENTANGLED);
            };
            return ActionResult.standalone(protocol);
        }));
    }
}
