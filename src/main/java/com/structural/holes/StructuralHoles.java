package com.structural.holes;

import com.structural.holes.api.Edge;
import com.structural.holes.api.Mode;
import com.structural.holes.api.NetworkView;
import com.structural.holes.brokerage.BrokerageClassifier;
import com.structural.holes.brokerage.BrokerageResult;
import com.structural.holes.engine.ConstraintEngine;
import com.structural.holes.engine.InvestmentEngine;
import com.structural.holes.engine.Validator;
import com.structural.holes.io.JsonNetworkLoader;
import com.structural.holes.io.LoadedNetwork;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Single entry point for the structural-holes metrics.
 * <p>
 * This class handles:
 * <ul>
 * <li>Default mode selection ({@link Mode#BOTH} when none is given)</li>
 * <li>String mode selectors ({@code "both"}, {@code "out"}, {@code "in"})</li>
 * <li>Delegation to {@link InvestmentEngine}, {@link ConstraintEngine} and
 * {@link BrokerageClassifier}</li>
 * <li>Loading networks from JSON definitions</li>
 * </ul>
 * Every method is a pure function of its arguments.
 */
public final class StructuralHoles {
    private StructuralHoles() {
        // Utility class
    }

    public static double investment(NetworkView g, int i, int j) {
        return InvestmentEngine.investment(g, i, j, Mode.BOTH);
    }

    public static double investment(NetworkView g, int i, int j, Mode mode) {
        return InvestmentEngine.investment(g, i, j, mode);
    }

    public static double investment(NetworkView g, int i, int j, String mode) {
        return InvestmentEngine.investment(g, i, j, Validator.validateMode(mode));
    }

    public static double investmentSum(NetworkView g, int i, int j) {
        return InvestmentEngine.investmentSum(g, i, j, Mode.BOTH);
    }

    public static double investmentSum(NetworkView g, int i, int j, Mode mode) {
        return InvestmentEngine.investmentSum(g, i, j, mode);
    }

    public static double investmentSum(NetworkView g, int i, int j, String mode) {
        return InvestmentEngine.investmentSum(g, i, j, Validator.validateMode(mode));
    }

    public static double dyadicConstraint(NetworkView g, int i, int j) {
        return ConstraintEngine.dyadicConstraint(g, i, j, Mode.BOTH);
    }

    public static double dyadicConstraint(NetworkView g, int i, int j, Mode mode) {
        return ConstraintEngine.dyadicConstraint(g, i, j, mode);
    }

    public static double dyadicConstraint(NetworkView g, int i, int j, String mode) {
        return ConstraintEngine.dyadicConstraint(g, i, j, Validator.validateMode(mode));
    }

    public static double dyadicConstraint(NetworkView g, Edge e) {
        return ConstraintEngine.dyadicConstraint(g, e, Mode.BOTH);
    }

    public static double dyadicConstraint(NetworkView g, Edge e, Mode mode) {
        return ConstraintEngine.dyadicConstraint(g, e, mode);
    }

    public static double constraint(NetworkView g, int i) {
        return ConstraintEngine.constraint(g, i, Mode.BOTH);
    }

    public static double constraint(NetworkView g, int i, Mode mode) {
        return ConstraintEngine.constraint(g, i, mode);
    }

    public static double constraint(NetworkView g, int i, String mode) {
        return ConstraintEngine.constraint(g, i, Validator.validateMode(mode));
    }

    /** Constraint of every vertex in ascending vertex order. */
    public static Map<Integer, Double> constraints(NetworkView g, Mode mode) {
        return ConstraintEngine.constraints(g, mode);
    }

    /**
     * Gould-Fernandez role counts per vertex.
     *
     * @param groups A list or array of labels in ascending vertex order, or a
     *               map from vertex id to label.
     */
    public static BrokerageResult classifyBrokerage(NetworkView g, Object groups) {
        return BrokerageClassifier.classify(g, groups);
    }

    public static LoadedNetwork load(Path jsonPath) throws IOException {
        return JsonNetworkLoader.loadFile(jsonPath);
    }
}
