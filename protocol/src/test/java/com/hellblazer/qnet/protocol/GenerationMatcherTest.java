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

import com.hellblazer.qnet.kernel.Timeline;
import com.hellblazer.qnet.network.Payload;
import com.hellblazer.qnet.protocol.rules.RuleTemplates;
import com.hellblazer.qnet.resource.EntanglementProtocol;
import com.hellblazer.qnet.resource.Match;
import com.hellblazer.qnet.resource.ProtocolKind;
import com.hellblazer.qnet.resource.QuantumRouter;
import com.hellblazer.qnet.resource.ResourceManagerConfig;
import com.hellblazer.qnet.resource.hardware.HardwareConfig;
import com.hellblazer.qnet.resource.memory.MemoryState;
import com.hellblazer.qnet.resource.rule.ActionResult;
import com.hellblazer.qnet.resource.rule.Rule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GenerationMatcher against a router's pending table.
 *
 * @author hal.hildebrand
 */
class GenerationMatcherTest {

    private QuantumRouter router;

    @BeforeEach
    void setUp() {
        router = new QuantumRouter("alice", new Timeline(), HardwareConfig.builder().withMemorySize(2).build(),
                                   ResourceManagerConfig.defaultConfig());
    }

    /**
     * Tagged GENERATION without being an EntanglementGeneration.
     */
    private static class ForeignGeneration extends EntanglementProtocol {
        private final int memory;

        ForeignGeneration(QuantumRouter owner, int memory) {
            super(owner, owner.nextProtocolName("FG[" + memory + "]"));
            this.memory = memory;
        }

        @Override
        public ProtocolKind kind() {
            return ProtocolKind.GENERATION;
        }

        @Override
        public List<Integer> getMemoryIndices() {
            return List.of(memory);
        }

        @Override
        protected void start() {
        }

        @Override
        protected void onMessage(String src, Payload payload) {
        }
    }

    private void loadForeign(int priority) {
        router.load(new Rule(priority, (memory, manager) -> memory.index() == 0 && memory.state() == MemoryState.RAW
                                                            ? List.of(memory) : List.of(),
                             (memories, owner) -> ActionResult.respond(new ForeignGeneration(owner, 0))));
    }

    @Test
    void testForeignGenerationProtocolIsSkipped() {
        loadForeign(10);
        assertEquals(1, router.getResourceManager().getPendingProtocols().size());

        assertTrue(new GenerationMatcher().match(router.getResourceManager().getPendingProtocols(), "bob").isEmpty());
    }

    @Test
    void testSelectsGenerationWaitingForRequester() {
        loadForeign(10);
        router.load(RuleTemplates.generation(0, List.of(1), "bob", false));
        var pending = router.getResourceManager().getPendingProtocols();
        assertEquals(2, pending.size());

        var match = new GenerationMatcher().match(pending, "bob");

        assertTrue(match.isPresent());
        var selected = ((Match.Single) match.get()).protocol();
        assertInstanceOf(EntanglementGeneration.class, selected);
        assertEquals(1, selected.getKey());
        assertTrue(new GenerationMatcher().match(pending, "carol").isEmpty());
    }
}
