package com.structural.holes.engine;

import com.structural.holes.api.InvalidModeException;
import com.structural.holes.api.InvalidNodeException;
import com.structural.holes.api.Mode;
import com.structural.holes.api.NetworkView;

import java.util.Objects;

/**
 * Argument checks run at the top of every public engine entry point, before any
 * arithmetic.
 */
public final class Validator {
    private Validator() {
        // Utility class
    }

    /**
     * @throws InvalidNodeException if the network is empty, {@code i} is not
     *                              positive, or {@code i} is not a vertex.
     */
    public static void validateNode(NetworkView g, int i) {
        Objects.requireNonNull(g, "network");
        if (g.vertexCount() == 0)
            throw new InvalidNodeException(i, "Network has no vertices, cannot query node " + i);
        if (i <= 0)
            throw new InvalidNodeException(i, "Node index must be positive, got " + i);
        if (!g.containsVertex(i))
            throw new InvalidNodeException(i, "Node " + i + " is not in the network");
    }

    public static void validateNodes(NetworkView g, int i, int j) {
        validateNode(g, i);
        validateNode(g, j);
    }

    /** @throws InvalidModeException if {@code mode} is null. */
    public static Mode validateMode(Mode mode) {
        if (mode == null)
            throw new InvalidModeException("mode must be both, out or in, got null");
        return mode;
    }

    /** @throws InvalidModeException if {@code mode} names no {@link Mode}. */
    public static Mode validateMode(String mode) {
        return Mode.fromString(mode);
    }
}
