package com.structural.holes.engine;

import com.structural.holes.api.Mode;
import com.structural.holes.api.NegativeWeightException;
import com.structural.holes.api.NetworkView;

/**
 * Mode-aware tie strength between two nodes, and the neighbor enumeration the
 * formulas sum over.
 *
 * <p>
 * The weighted/unweighted decision is taken once per call from
 * {@link NetworkView#isWeighted()}: unweighted networks count edge presence
 * (0 or 1), weighted ones read the weight and reject negatives.
 */
final class TieStrength {
    private TieStrength() {
    }

    /**
     * Tie strength from {@code i} toward {@code k}:
     * {@code both: w(i,k)+w(k,i)}, {@code out: w(i,k)}, {@code in: w(k,i)}.
     */
    static double tie(NetworkView g, boolean weighted, int i, int k, Mode mode) {
        return switch (mode) {
            case BOTH -> read(g, weighted, i, k) + read(g, weighted, k, i);
            case OUT -> read(g, weighted, i, k);
            case IN -> read(g, weighted, k, i);
        };
    }

    /**
     * Total tie strength of {@code i} over its mode-selected neighbors, self
     * excluded. This is the investment denominator.
     */
    static double total(NetworkView g, boolean weighted, int i, Mode mode) {
        double sum = 0.0;
        for (int k : g.neighbors(i, mode)) {
            if (k == i)
                continue;
            sum += tie(g, weighted, i, k, mode);
        }
        return sum;
    }

    /**
     * Edge value used by the formulas: 0 when absent, 1 when present and
     * unweighted, the weight otherwise.
     *
     * @throws NegativeWeightException if a weighted edge has a negative weight.
     */
    static double read(NetworkView g, boolean weighted, int from, int to) {
        if (!g.hasEdge(from, to))
            return 0.0;
        if (!weighted)
            return 1.0;
        double w = g.weight(from, to);
        // Also rejects NaN.
        if (!(w >= 0))
            throw new NegativeWeightException(from, to, w);
        return w;
    }

    /** Mode-selected neighbors of {@code i} without {@code i} itself. */
    static int[] alters(NetworkView g, int i, Mode mode) {
        int[] all = g.neighbors(i, mode);
        int self = -1;
        for (int p = 0; p < all.length; p++) {
            if (all[p] == i) {
                self = p;
                break;
            }
        }
        if (self < 0)
            return all;
        int[] out = new int[all.length - 1];
        System.arraycopy(all, 0, out, 0, self);
        System.arraycopy(all, self + 1, out, self, all.length - self - 1);
        return out;
    }
}
