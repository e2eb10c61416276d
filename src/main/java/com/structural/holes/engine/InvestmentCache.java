package com.structural.holes.engine;

import com.structural.holes.api.Mode;
import com.structural.holes.api.NetworkView;

/**
 * Call-scoped memo for one {@code constraint(ego, mode)} evaluation.
 *
 * <p>
 * Keys are the ego's alters, densely renumbered by their position in the
 * sorted alter array. Two tables hang off that numbering:
 * <ul>
 * <li><b>direct:</b> {@code p(ego, q)} for every alter q, filled eagerly.</li>
 * <li><b>totals:</b> the investment denominator of alter q, filled on first
 * use when q acts as an intermediary.</li>
 * </ul>
 * An instance is created inside the call, passed down by parameter and dropped
 * on return. It is never shared between calls, egos or threads.
 */
final class InvestmentCache {
    private final NetworkView g;
    private final boolean weighted;
    private final Mode mode;
    private final int[] alters;
    private final double[] direct;
    private final double[] totals;
    private final boolean[] totalKnown;

    private InvestmentCache(NetworkView g, int[] alters, Mode mode) {
        this.g = g;
        this.weighted = g.isWeighted();
        this.mode = mode;
        this.alters = alters;
        this.direct = new double[alters.length];
        this.totals = new double[alters.length];
        this.totalKnown = new boolean[alters.length];
    }

    /**
     * Computes {@code p(ego, j)} for every alter j. The ego's denominator is
     * evaluated once and shared by all of them.
     */
    static InvestmentCache build(NetworkView g, int ego, int[] alters, Mode mode) {
        InvestmentCache cache = new InvestmentCache(g, alters, mode);
        double denom = TieStrength.total(g, cache.weighted, ego, mode);
        if (denom != 0) {
            for (int k = 0; k < alters.length; k++)
                cache.direct[k] = TieStrength.tie(g, cache.weighted, ego, alters[k], mode) / denom;
        }
        return cache;
    }

    int size() {
        return alters.length;
    }

    int alter(int slot) {
        return alters[slot];
    }

    /** {@code p(ego, alter(slot))}. */
    double direct(int slot) {
        return direct[slot];
    }

    /**
     * {@code p(alter(slot), j)}, reusing the alter's denominator across targets.
     */
    double fromAlter(int slot, int j) {
        int q = alters[slot];
        if (q == j)
            return 0.0;
        if (!totalKnown[slot]) {
            totals[slot] = TieStrength.total(g, weighted, q, mode);
            totalKnown[slot] = true;
        }
        double denom = totals[slot];
        if (denom == 0)
            return 0.0;
        return TieStrength.tie(g, weighted, q, j, mode) / denom;
    }
}
