package com.structural.holes.api;

/**
 * Thrown when a node id is non-positive, absent from the network, or the
 * network has no vertices at all.
 */
public class InvalidNodeException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final int node;

    public InvalidNodeException(int node, String message) {
        super(message);
        this.node = node;
    }

    public int node() {
        return node;
    }
}
