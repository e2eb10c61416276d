package com.structural.holes.brokerage;

import com.structural.holes.api.NetworkView;

import java.util.*;

/**
 * Group label per vertex, supplied either positionally or by vertex id.
 *
 * <p>
 * Positional form: the k-th label belongs to the k-th vertex in ascending id
 * order. Keyed form: an explicit {@code vertex -> label} map. Labels are
 * compared with {@link Object#equals(Object)} only.
 *
 * @param <G> Label type.
 */
public final class GroupAssignment<G> {
    private final List<G> positional;
    private final Map<Integer, G> keyed;

    private GroupAssignment(List<G> positional, Map<Integer, G> keyed) {
        this.positional = positional;
        this.keyed = keyed;
    }

    /** @throws IllegalArgumentException if a label is null. */
    public static <G> GroupAssignment<G> ofList(List<G> labels) {
        return new GroupAssignment<>(List.copyOf(checkLabels(Objects.requireNonNull(labels, "labels"))), null);
    }

    /** @throws IllegalArgumentException if a key or a label is null. */
    public static <G> GroupAssignment<G> ofMap(Map<Integer, G> labels) {
        Objects.requireNonNull(labels, "labels");
        for (var e : labels.entrySet()) {
            if (e.getKey() == null)
                throw new IllegalArgumentException("Group keys must be vertex ids, got null");
            if (e.getValue() == null)
                throw new IllegalArgumentException("Vertex " + e.getKey() + " has a null group");
        }
        return new GroupAssignment<>(null, Map.copyOf(labels));
    }

    /**
     * Accepts a {@link List}, an object array or a {@link Map} keyed by vertex
     * id.
     *
     * @throws IllegalArgumentException for any other shape, a map with
     *                                  non-integer keys, or null labels.
     */
    @SuppressWarnings("unchecked")
    public static GroupAssignment<Object> of(Object groups) {
        if (groups instanceof List<?> list)
            return ofList((List<Object>) list);
        if (groups instanceof Object[] array)
            return ofList(Arrays.asList(array));
        if (groups instanceof Map<?, ?> map) {
            Map<Integer, Object> keyedLabels = new HashMap<>(map.size() * 2);
            for (var e : map.entrySet()) {
                if (!(e.getKey() instanceof Integer v))
                    throw new IllegalArgumentException("Group keys must be vertex ids, got " + e.getKey());
                keyedLabels.put(v, e.getValue());
            }
            return ofMap(keyedLabels);
        }
        throw new IllegalArgumentException("Groups must be a list, an array or a map, got "
                + (groups == null ? "null" : groups.getClass().getName()));
    }

    private static <G> List<G> checkLabels(List<G> labels) {
        for (int k = 0; k < labels.size(); k++) {
            if (labels.get(k) == null)
                throw new IllegalArgumentException("Group label at position " + k + " is null");
        }
        return labels;
    }

    public boolean isPositional() {
        return positional != null;
    }

    /**
     * Checks that every vertex of {@code g} has a label.
     *
     * @throws IllegalArgumentException if a positional assignment has the wrong
     *                                  length or a keyed one misses a vertex.
     */
    public void validate(NetworkView g) {
        if (positional != null) {
            if (positional.size() != g.vertexCount())
                throw new IllegalArgumentException("Group list length (" + positional.size()
                        + ") does not match number of vertices (" + g.vertexCount() + ")");
        } else {
            for (int v : g.vertices()) {
                if (!keyed.containsKey(v))
                    throw new IllegalArgumentException("Vertex " + v + " is missing from groups map");
            }
        }
    }

    /**
     * Labels in ascending vertex order. Assumes {@link #validate} passed.
     */
    public List<G> toList(NetworkView g) {
        if (positional != null)
            return positional;
        List<G> out = new ArrayList<>(g.vertexCount());
        for (int v : g.vertices())
            out.add(keyed.get(v));
        return out;
    }

    /** Label lookup by vertex id. Assumes {@link #validate} passed. */
    public Map<Integer, G> toMap(NetworkView g) {
        if (keyed != null)
            return keyed;
        int[] vertices = g.vertices();
        Map<Integer, G> out = new HashMap<>(vertices.length * 2);
        for (int k = 0; k < vertices.length; k++)
            out.put(vertices[k], positional.get(k));
        return out;
    }
}
