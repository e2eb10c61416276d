package com.structural.holes.engine;

import com.structural.holes.api.Edge;
import com.structural.holes.api.Mode;
import com.structural.holes.api.NetworkView;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Burt's network constraint.
 *
 * <p>
 * Dyadic constraint of j on i: {@code c(i,j) = (p(i,j) + sum_q p(i,q) p(q,j))^2}.
 * Total constraint: {@code C(i) = sum_j c(i,j)} over the mode-selected
 * neighbors j of i, self excluded. High constraint means few structural holes
 * around i.
 *
 * <h3>Evaluation strategy</h3>
 * Evaluated naively, {@code C(i)} recomputes {@code p(i,q)} for every pair
 * (j, q), which is O(d^3) investment evaluations for degree d. {@link #constraint}
 * instead builds an {@link InvestmentCache} once per call:
 * <ol>
 * <li>Validate node and mode.</li>
 * <li>Enumerate the alters of i (self-loops dropped).</li>
 * <li>Compute {@code p(i,j)} for every alter, sharing i's denominator.</li>
 * <li>For each alter j, add {@code (p(i,j) + indirect(j))^2}, reading
 * {@code p(i,q)} and q's denominator from the cache.</li>
 * </ol>
 * The arithmetic is performed in the same order as the unmemoized path, so
 * {@code constraint(i)} equals the sum of {@code dyadicConstraint(i, j)} over
 * the alters.
 */
public final class ConstraintEngine {
    private static final Logger log = LogManager.getLogger(ConstraintEngine.class);

    private ConstraintEngine() {
        // Utility class
    }

    public static double dyadicConstraint(NetworkView g, int i, int j) {
        return dyadicConstraint(g, i, j, Mode.BOTH);
    }

    /**
     * Constraint that the tie to {@code j} places on {@code i}. Zero when the two
     * are not connected under {@code mode}, directly or through a shared
     * neighbor.
     */
    public static double dyadicConstraint(NetworkView g, int i, int j, Mode mode) {
        Validator.validateNodes(g, i, j);
        Validator.validateMode(mode);
        double s = InvestmentEngine.investment(g, i, j, mode) + InvestmentEngine.investmentSum(g, i, j, mode);
        return s * s;
    }

    public static double dyadicConstraint(NetworkView g, Edge e) {
        return dyadicConstraint(g, e.from(), e.to(), Mode.BOTH);
    }

    /** Same as {@code dyadicConstraint(g, e.from(), e.to(), mode)}. */
    public static double dyadicConstraint(NetworkView g, Edge e, Mode mode) {
        return dyadicConstraint(g, e.from(), e.to(), mode);
    }

    public static double constraint(NetworkView g, int i) {
        return constraint(g, i, Mode.BOTH);
    }

    /**
     * Total constraint on {@code i}. Returns 0 for a node without alters under
     * {@code mode}, including one whose only edge is a self-loop.
     *
     * @throws com.structural.holes.api.InvalidNodeException    on an invalid node.
     * @throws com.structural.holes.api.InvalidModeException    on a null mode.
     * @throws com.structural.holes.api.NegativeWeightException on a negative
     *                                                          weight read.
     */
    public static double constraint(NetworkView g, int i, Mode mode) {
        Validator.validateNode(g, i);
        Validator.validateMode(mode);

        int[] alters = TieStrength.alters(g, i, mode);
        if (alters.length == 0)
            return 0.0;

        InvestmentCache cache = InvestmentCache.build(g, i, alters, mode);
        double c = 0.0;
        for (int slot = 0; slot < cache.size(); slot++) {
            double s = cache.direct(slot) + InvestmentEngine.investmentSum(cache, cache.alter(slot));
            c += s * s;
        }
        log.debug("constraint(ego={}, mode={}) over {} alters = {}", i, mode, alters.length, c);
        return c;
    }

    public static Map<Integer, Double> constraints(NetworkView g) {
        return constraints(g, Mode.BOTH);
    }

    /**
     * Constraint of every vertex, in ascending vertex order. Each vertex gets
     * its own cache. Stops at the first error.
     */
    public static Map<Integer, Double> constraints(NetworkView g, Mode mode) {
        Validator.validateMode(mode);
        int[] vertices = g.vertices();
        Map<Integer, Double> out = new LinkedHashMap<>(vertices.length * 2);
        for (int v : vertices)
            out.put(v, constraint(g, v, mode));
        return out;
    }
}
