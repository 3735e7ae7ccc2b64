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
import com.hellblazer.qnet.resource.EntanglementProtocol;
import com.hellblazer.qnet.resource.ProtocolKind;
import com.hellblazer.qnet.resource.QuantumRouter;
import com.hellblazer.qnet.resource.hardware.DelayKind;
import com.hellblazer.qnet.resource.memory.MemoryState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * BBPSSW entanglement purification: consumes one pair (the measured slot) to raise the fidelity of another pair (the
 * kept slot) shared with the same remote router.
 * <p>
 * The requesting side owns both slots from the start. The responding side waits with one single-slot protocol per
 * eligible slot; the request's matcher merges the two that hold the partners of the kept and measured slots.
 * <p>
 * With kept fidelity {@code f} and consumed fidelity {@code k}, purification succeeds with probability
 * <pre>
 * Z = f·k + f(1-k)/3 + (1-f)k/3 + 5(1-f)(1-k)/9
 * </pre>
 * and on success the kept pair's fidelity becomes {@code (f·k + (1-f)(1-k)/9) / Z}.
 *
 * @author hal.hildebrand
 */
public class BBPSSW extends EntanglementProtocol {
    private static final Logger log = LoggerFactory.getLogger(BBPSSW.class);

    private final int     kept;
    private final int     measured;
    private final boolean primary;

    /**
     * Requesting side, owning both slots.
     */
    public BBPSSW(QuantumRouter owner, int kept, int measured) {
        this(owner, kept, measured, true);
    }

    /**
     * Responding side, waiting to be merged.
     */
    public BBPSSW(QuantumRouter owner, int kept) {
        this(owner, kept, -1, false);
    }

    private BBPSSW(QuantumRouter owner, int kept, int measured, boolean primary) {
        super(owner, owner.nextProtocolName(measured < 0 ? "EP[" + kept + "]" : "EP[" + kept + "," + measured + "]"));
        if (kept == measured) {
            throw new IllegalArgumentException("Kept and measured slots must differ: " + kept);
        }
        this.kept = kept;
        this.measured = measured;
        this.primary = primary;
    }

    /**
     * @return probability that purifying a pair of fidelity f with a pair of fidelity k succeeds
     */
    public static double successProbability(double f, double k) {
        return f * k + f * (1 - k) / 3 + (1 - f) * k / 3 + 5 * (1 - f) * (1 - k) / 9;
    }

    /**
     * @return fidelity of the kept pair after a successful purification
     */
    public static double improvedFidelity(double f, double k) {
        return (f * k + (1 - f) * (1 - k) / 9) / successProbability(f, k);
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.PURIFICATION;
    }

    @Override
    public List<Integer> getMemoryIndices() {
        return measured < 0 ? List.of(kept) : List.of(kept, measured);
    }

    public int getKept() {
        return kept;
    }

    /**
     * @return the consumed slot, or -1 for a responder that has not been merged
     */
    public int getMeasured() {
        return measured;
    }

    public boolean isPrimary() {
        return primary;
    }

    /**
     * The absorbed protocol's slot becomes the measured slot.
     */
    @Override
    public EntanglementProtocol merge(EntanglementProtocol absorbed) {
        if (measured >= 0 || absorbed.kind() != ProtocolKind.PURIFICATION
            || absorbed.getMemoryIndices().size() != 1) {
            throw new IllegalArgumentException(String.format("Cannot merge %s into %s", absorbed, this));
        }
        return new BBPSSW(owner, kept, absorbed.getKey(), false);
    }

    @Override
    protected void start() {
        if (measured < 0) {
            throw new IllegalStateException(name + " activated without a measured slot");
        }
        if (primary) {
            schedule(owner.getHardware().delay(DelayKind.PURIFICATION), this::purify);
        }
    }

    private void purify() {
        double f = memory(kept).getFidelity();
        double k = memory(measured).getFidelity();
        boolean success = owner.getHardware().drawSuccess(successProbability(f, k));
        double fidelity = success ? improvedFidelity(f, k) : 0.0;
        log.trace("{} on {} purified {} with {}: {}", name, owner.getName(), f, k,
                  success ? String.valueOf(fidelity) : "failed");
        for (var peer : getPeers()) {
            send(peer, new PurificationMessage(success, fidelity));
        }
        finish(success, fidelity);
    }

    @Override
    protected void onMessage(String src, Payload payload) {
        if (primary || !(payload instanceof PurificationMessage outcome)) {
            log.debug("{} on {} ignoring {} from {}", name, owner.getName(), payload, src);
            return;
        }
        finish(outcome.success(), outcome.fidelity());
    }

    private void finish(boolean success, double fidelity) {
        var updates = new LinkedHashMap<Integer, MemoryState>();
        memory(measured).reset();
        updates.put(measured, MemoryState.RAW);
        if (success) {
            memory(kept).setFidelity(fidelity);
            updates.put(kept, MemoryState.ENTANGLED);
        } else {
            memory(kept).reset();
            updates.put(kept, MemoryState.RAW);
        }
        complete(success);
        updateResources(updates);
    }
}
