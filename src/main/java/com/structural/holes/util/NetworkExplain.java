package com.structural.holes.util;

import com.structural.holes.api.Mode;
import com.structural.holes.api.NetworkView;
import com.structural.holes.engine.ConstraintEngine;
import com.structural.holes.engine.InvestmentEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Diagnostic utility for inspecting constraint values.
 *
 * <p>
 * Generates human-readable breakdowns of an ego's constraint and tables of
 * constraint across the network.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, logging and reports.
 * Do <b>not</b> use on hot paths (allocates strings, recomputes every term
 * without memoization).
 */
public final class NetworkExplain {
    private final NetworkView network;

    public NetworkExplain(NetworkView network) {
        this.network = network;
    }

    /**
     * Dumps every alter of {@code ego} with its direct, indirect and dyadic
     * terms, followed by the total constraint.
     */
    public String explainNode(int ego, Mode mode) {
        double total = ConstraintEngine.constraint(network, ego, mode);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(ego).append('\n')
                .append("  Mode: ").append(mode.name().toLowerCase(Locale.ROOT)).append('\n');

        List<Integer> alters = alters(ego, mode);
        sb.append("  Alters (").append(alters.size()).append(")\n");
        if (!alters.isEmpty()) {
            sb.append(String.format(Locale.ROOT, "  %8s | %10s | %10s | %10s%n", "Alter", "Direct", "Indirect", "Dyadic"));
            for (int j : alters) {
                sb.append(String.format(Locale.ROOT, "  %8d | %10.6f | %10.6f | %10.6f%n",
                        j,
                        InvestmentEngine.investment(network, ego, j, mode),
                        InvestmentEngine.investmentSum(network, ego, j, mode),
                        ConstraintEngine.dyadicConstraint(network, ego, j, mode)));
            }
        }
        return sb.append(String.format(Locale.ROOT, "  Constraint: %.6f%n", total)).toString();
    }

    public String explainNode(int ego) {
        return explainNode(ego, Mode.BOTH);
    }

    /**
     * Returns a formatted table of every vertex's constraint, most constrained
     * first. Ties are ordered by node id.
     */
    public String constraintTable(Mode mode) {
        Map<Integer, Double> values = ConstraintEngine.constraints(network, mode);
        List<Map.Entry<Integer, Double>> rows = new ArrayList<>(values.entrySet());
        rows.sort((a, b) -> {
            int c = Double.compare(b.getValue(), a.getValue());
            return c != 0 ? c : Integer.compare(a.getKey(), b.getKey());
        });

        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%10s | %6s | %12s%n", "Node", "Alters", "Constraint"));
        sb.append("----------------------------------\n");
        for (var row : rows) {
            sb.append(String.format(Locale.ROOT, "%10d | %6d | %12.6f%n",
                    row.getKey(), alters(row.getKey(), mode).size(), row.getValue()));
        }
        return sb.toString();
    }

    // Neighbors under mode, self excluded.
    private List<Integer> alters(int ego, Mode mode) {
        List<Integer> out = new ArrayList<>();
        for (int j : network.neighbors(ego, mode)) {
            if (j != ego)
                out.add(j);
        }
        return out;
    }
}
