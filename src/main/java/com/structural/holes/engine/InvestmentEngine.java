package com.structural.holes.engine;

import com.structural.holes.api.Mode;
import com.structural.holes.api.NetworkView;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Proportional investment between two nodes and its two-step indirect
 * extension.
 *
 * <h3>Investment</h3>
 * {@code p(i,j) = tie(i,j) / sum_k tie(i,k)}, where k ranges over the
 * mode-selected neighbors of i except i itself, and
 * <ul>
 * <li>{@code both}: {@code tie(i,k) = w(i,k) + w(k,i)}</li>
 * <li>{@code out}: {@code tie(i,k) = w(i,k)}</li>
 * <li>{@code in}: {@code tie(i,k) = w(k,i)}</li>
 * </ul>
 * Unweighted networks use edge presence (0/1) for {@code w}. Self-ties are
 * excluded everywhere, {@code p(i,i) = 0}, and a node with a zero denominator
 * invests nothing.
 *
 * <h3>Investment sum</h3>
 * {@code sum_q p(i,q) * p(q,j)} over the mode-selected neighbors q of i with
 * {@code q != i} and {@code q != j}: the strength of every length-2 path from
 * i to j.
 *
 * <p>
 * All methods are pure functions of their arguments. A negative weight read
 * on the way raises
 * {@link com.structural.holes.api.NegativeWeightException}.
 */
public final class InvestmentEngine {
    private static final Logger log = LogManager.getLogger(InvestmentEngine.class);

    private InvestmentEngine() {
        // Utility class
    }

    public static double investment(NetworkView g, int i, int j) {
        return investment(g, i, j, Mode.BOTH);
    }

    /**
     * Share of {@code i}'s total tie strength directed at {@code j}.
     *
     * @return A value in [0, 1].
     * @throws com.structural.holes.api.InvalidNodeException    on an invalid node.
     * @throws com.structural.holes.api.InvalidModeException    on a null mode.
     * @throws com.structural.holes.api.NegativeWeightException on a negative weight.
     */
    public static double investment(NetworkView g, int i, int j, Mode mode) {
        Validator.validateNodes(g, i, j);
        Validator.validateMode(mode);
        double p = compute(g, g.isWeighted(), i, j, mode);
        if (log.isTraceEnabled())
            log.trace("investment({} -> {}, {}) = {}", i, j, mode, p);
        return p;
    }

    public static double investmentSum(NetworkView g, int i, int j) {
        return investmentSum(g, i, j, Mode.BOTH);
    }

    /**
     * Indirect investment of {@code i} in {@code j} through shared neighbors.
     *
     * @throws com.structural.holes.api.InvalidNodeException    on an invalid node.
     * @throws com.structural.holes.api.InvalidModeException    on a null mode.
     * @throws com.structural.holes.api.NegativeWeightException on a negative weight.
     */
    public static double investmentSum(NetworkView g, int i, int j, Mode mode) {
        Validator.validateNodes(g, i, j);
        Validator.validateMode(mode);
        boolean weighted = g.isWeighted();
        double c = 0.0;
        for (int q : g.neighbors(i, mode)) {
            if (q == j || q == i)
                continue;
            c += compute(g, weighted, i, q, mode) * compute(g, weighted, q, j, mode);
        }
        return c;
    }

    /**
     * Memoized investment sum, used by the constraint computation. Direct
     * investments of the ego and the denominators of its alters come from the
     * cache, so only {@code tie(q, j)} is evaluated per intermediary.
     */
    static double investmentSum(InvestmentCache cache, int j) {
        double c = 0.0;
        for (int slot = 0; slot < cache.size(); slot++) {
            // Alters never include the ego itself.
            if (cache.alter(slot) == j)
                continue;
            c += cache.direct(slot) * cache.fromAlter(slot, j);
        }
        return c;
    }

    // Unvalidated core. Callers have checked nodes and mode.
    static double compute(NetworkView g, boolean weighted, int i, int j, Mode mode) {
        if (i == j)
            return 0.0;
        double denom = TieStrength.total(g, weighted, i, mode);
        if (denom == 0)
            return 0.0;
        return TieStrength.tie(g, weighted, i, j, mode) / denom;
    }
}
