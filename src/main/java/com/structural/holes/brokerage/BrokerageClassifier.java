package com.structural.holes.brokerage;

import com.structural.holes.api.BrokerageRole;
import com.structural.holes.api.Mode;
import com.structural.holes.api.NetworkView;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Gould-Fernandez brokerage.
 *
 * <p>
 * For an ego, every open two-path {@code a -> ego -> b} (a is an in-neighbor,
 * b an out-neighbor, a and b distinct, no edge {@code a -> b}) is a brokerage
 * triad. Its role depends only on the three group labels, see
 * {@link #classifyRole}. Self-loops never form a triad.
 *
 * <p>
 * On undirected networks the neighbor set serves as both in- and out-set, so
 * each unordered pair of non-adjacent neighbors is counted in both orders.
 */
@Log4j2
public final class BrokerageClassifier {
    private BrokerageClassifier() {
        // Utility class
    }

    /**
     * Role of ego in the triad {@code in -> ego -> out}. Checked in order:
     * coordinator, gatekeeper, representative, liaison, otherwise cosmopolitan.
     */
    public static <G> BrokerageRole classifyRole(G groupEgo, G groupIn, G groupOut) {
        if (Objects.equals(groupEgo, groupIn) && Objects.equals(groupIn, groupOut))
            return BrokerageRole.COORDINATOR;
        if (Objects.equals(groupEgo, groupOut) && !Objects.equals(groupEgo, groupIn))
            return BrokerageRole.GATEKEEPER;
        if (Objects.equals(groupEgo, groupIn) && !Objects.equals(groupEgo, groupOut))
            return BrokerageRole.REPRESENTATIVE;
        if (Objects.equals(groupIn, groupOut) && !Objects.equals(groupIn, groupEgo))
            return BrokerageRole.LIAISON;
        return BrokerageRole.COSMOPOLITAN;
    }

    /**
     * @throws IllegalArgumentException if the groups do not cover {@code g}
     *                                  exactly, or have the wrong shape.
     */
    public static GroupAssignment<?> validateGroups(NetworkView g, Object groups) {
        GroupAssignment<?> assignment = groups instanceof GroupAssignment<?> ga ? ga : GroupAssignment.of(groups);
        assignment.validate(g);
        return assignment;
    }

    /**
     * Maps labels to 1, 2, 3, ... in order of first occurrence. Equal inputs
     * always give the same mapping.
     */
    public static <G> int[] groupsToIntegerLabels(List<G> groups) {
        Map<G, Integer> ids = new HashMap<>();
        int[] out = new int[groups.size()];
        for (int k = 0; k < out.length; k++) {
            G label = groups.get(k);
            Integer id = ids.get(label);
            if (id == null) {
                id = ids.size() + 1;
                ids.put(label, id);
            }
            out[k] = id;
        }
        return out;
    }

    /**
     * Brokerage profile of every vertex.
     *
     * @param groups A {@link GroupAssignment}, list, array or map of labels.
     * @throws IllegalArgumentException on a malformed group assignment.
     */
    public static BrokerageResult classify(NetworkView g, Object groups) {
        Objects.requireNonNull(g, "network");
        GroupAssignment<?> assignment = validateGroups(g, groups);
        Map<Integer, ?> labels = assignment.toMap(g);

        Map<Integer, BrokerageProfile> profiles = new LinkedHashMap<>(g.vertexCount() * 2);
        for (int ego : g.vertices())
            profiles.put(ego, profile(g, ego, labels));

        BrokerageResult result = new BrokerageResult(profiles);
        log.debug("Classified brokerage for {} vertices, {} triads", g.vertexCount(), result.totalBrokerage());
        return result;
    }

    private static BrokerageProfile profile(NetworkView g, int ego, Map<Integer, ?> labels) {
        BrokerageProfile profile = new BrokerageProfile(ego);
        Object groupEgo = labels.get(ego);
        int[] ins = g.neighbors(ego, Mode.IN);
        int[] outs = g.neighbors(ego, Mode.OUT);
        for (int a : ins) {
            if (a == ego)
                continue;
            for (int b : outs) {
                if (b == ego || b == a || g.hasEdge(a, b))
                    continue;
                profile.increment(classifyRole(groupEgo, labels.get(a), labels.get(b)));
            }
        }
        return profile;
    }
}
