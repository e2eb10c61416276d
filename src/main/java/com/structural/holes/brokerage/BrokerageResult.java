package com.structural.holes.brokerage;

import com.structural.holes.api.BrokerageRole;

import java.util.Collections;
import java.util.Map;

/**
 * Brokerage profiles of every vertex, keyed and iterated in ascending vertex
 * order.
 */
public final class BrokerageResult {
    private final Map<Integer, BrokerageProfile> profiles;

    BrokerageResult(Map<Integer, BrokerageProfile> profiles) {
        this.profiles = Collections.unmodifiableMap(profiles);
    }

    public Map<Integer, BrokerageProfile> profiles() {
        return profiles;
    }

    /**
     * @throws IllegalArgumentException if {@code node} was not classified.
     */
    public BrokerageProfile profile(int node) {
        BrokerageProfile p = profiles.get(node);
        if (p == null)
            throw new IllegalArgumentException("No brokerage profile for node " + node);
        return p;
    }

    /** Count of {@code role} summed over all egos. */
    public int total(BrokerageRole role) {
        int t = 0;
        for (BrokerageProfile p : profiles.values())
            t += p.count(role);
        return t;
    }

    /** All brokerage triads of all egos. */
    public int totalBrokerage() {
        int t = 0;
        for (BrokerageProfile p : profiles.values())
            t += p.total();
        return t;
    }
}
