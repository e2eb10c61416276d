package com.structural.holes.brokerage;

import com.structural.holes.api.BrokerageRole;

/** Role counts of one ego. */
public final class BrokerageProfile {
    private final int node;
    private final int[] counts = new int[BrokerageRole.values().length];

    BrokerageProfile(int node) {
        this.node = node;
    }

    void increment(BrokerageRole role) {
        counts[role.ordinal()]++;
    }

    public int node() {
        return node;
    }

    public int count(BrokerageRole role) {
        return counts[role.ordinal()];
    }

    public int coordinator() {
        return count(BrokerageRole.COORDINATOR);
    }

    public int gatekeeper() {
        return count(BrokerageRole.GATEKEEPER);
    }

    public int representative() {
        return count(BrokerageRole.REPRESENTATIVE);
    }

    public int liaison() {
        return count(BrokerageRole.LIAISON);
    }

    public int cosmopolitan() {
        return count(BrokerageRole.COSMOPOLITAN);
    }

    /** Sum over all roles. */
    public int total() {
        int t = 0;
        for (int c : counts)
            t += c;
        return t;
    }

    @Override
    public String toString() {
        return "BrokerageProfile[node=" + node + ", coordinator=" + coordinator() + ", gatekeeper=" + gatekeeper()
                + ", representative=" + representative() + ", liaison=" + liaison() + ", cosmopolitan="
                + cosmopolitan() + "]";
    }
}
