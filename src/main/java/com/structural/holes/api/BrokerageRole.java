package com.structural.holes.api;

/**
 * Gould-Fernandez brokerage roles for a triad {@code a -> ego -> b}, decided by
 * the group labels of ego, the in-neighbor a and the out-neighbor b.
 */
public enum BrokerageRole {
    /** All three in the same group. */
    COORDINATOR,
    /** Ego and b share a group, a is an outsider. */
    GATEKEEPER,
    /** Ego and a share a group, b is an outsider. */
    REPRESENTATIVE,
    /** a and b share a group, ego belongs to another one. */
    LIAISON,
    /** Three distinct groups. */
    COSMOPOLITAN
}
