package com.structural.holes.api;

/**
 * Thrown when a negative edge weight is read while evaluating an investment or
 * constraint formula. Weights are never clamped or skipped.
 */
public class NegativeWeightException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final int from;
    private final int to;
    private final double weight;

    public NegativeWeightException(int from, int to, double weight) {
        super("Edge weight must be non-negative, got weight=" + weight + " for edge (" + from + ", " + to + ")");
        this.from = from;
        this.to = to;
        this.weight = weight;
    }

    public int from() {
        return from;
    }

    public int to() {
        return to;
    }

    public double weight() {
        return weight;
    }
}
