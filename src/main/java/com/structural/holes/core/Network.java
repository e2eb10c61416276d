package com.structural.holes.core;

import com.structural.holes.api.Edge;
import com.structural.holes.api.Mode;
import com.structural.holes.api.NetworkView;

import java.util.*;

/**
 * Immutable adjacency structure, built once and then only read.
 *
 * <p>
 * Vertex ids are mapped to dense indices (ascending id order) and every vertex
 * owns three sorted neighbor arrays:
 * <ul>
 * <li><b>successors:</b> targets of outgoing edges, with a parallel weight
 * array.</li>
 * <li><b>predecessors:</b> sources of incoming edges.</li>
 * <li><b>adjacent:</b> the de-duplicated union of both.</li>
 * </ul>
 * Edge lookups are a binary search in the successor array of the source.
 *
 * <p>
 * Undirected networks store every edge in both directions, so all three
 * arrays coincide. A self-loop is stored once.
 *
 * <p>
 * Accessors hand out copies; the stored arrays never leave this class.
 */
public final class Network implements NetworkView {
    private static final int[] NONE = new int[0];

    private final boolean directed;
    private final boolean weighted;

    // Ascending vertex ids; position is the dense index.
    private final int[] vertexIds;
    private final Map<Integer, Integer> idToIndex;

    private final int[][] successors;
    private final double[][] successorWeights;
    private final int[][] predecessors;
    private final int[][] adjacent;

    private final int edgeCount;

    private Network(boolean directed, boolean weighted, int[] vertexIds, Map<Integer, Integer> idToIndex,
            int[][] successors, double[][] successorWeights, int[][] predecessors, int[][] adjacent, int edgeCount) {
        this.directed = directed;
        this.weighted = weighted;
        this.vertexIds = vertexIds;
        this.idToIndex = idToIndex;
        this.successors = successors;
        this.successorWeights = successorWeights;
        this.predecessors = predecessors;
        this.adjacent = adjacent;
        this.edgeCount = edgeCount;
    }

    public static Builder builder(boolean directed, boolean weighted) {
        return new Builder(directed, weighted);
    }

    /** Unweighted undirected network. */
    public static Builder undirected() {
        return new Builder(false, false);
    }

    /** Unweighted directed network. */
    public static Builder directed() {
        return new Builder(true, false);
    }

    public static Builder weightedUndirected() {
        return new Builder(false, true);
    }

    public static Builder weightedDirected() {
        return new Builder(true, true);
    }

    @Override
    public boolean isDirected() {
        return directed;
    }

    @Override
    public boolean isWeighted() {
        return weighted;
    }

    @Override
    public int vertexCount() {
        return vertexIds.length;
    }

    @Override
    public int[] vertices() {
        return vertexIds.clone();
    }

    @Override
    public boolean containsVertex(int node) {
        return idToIndex.containsKey(node);
    }

    /**
     * Number of stored edges. An undirected edge counts once.
     */
    public int edgeCount() {
        return edgeCount;
    }

    @Override
    public int[] neighbors(int node, Mode mode) {
        Integer idx = idToIndex.get(node);
        if (idx == null)
            return NONE;
        int[] ids = switch (mode) {
            case OUT -> successors[idx];
            case IN -> predecessors[idx];
            case BOTH -> adjacent[idx];
        };
        return ids.length == 0 ? NONE : ids.clone();
    }

    @Override
    public boolean hasEdge(int from, int to) {
        return slot(from, to) >= 0;
    }

    @Override
    public double weight(int from, int to) {
        Integer idx = idToIndex.get(from);
        if (idx == null)
            return 0.0;
        int pos = Arrays.binarySearch(successors[idx], to);
        return pos < 0 ? 0.0 : successorWeights[idx][pos];
    }

    /** @return All edges {@code from -> to}, ordered by source then target. */
    public List<Edge> edges() {
        List<Edge> out = new ArrayList<>();
        for (int i = 0; i < vertexIds.length; i++) {
            int from = vertexIds[i];
            for (int to : successors[i]) {
                if (directed || from <= to)
                    out.add(new Edge(from, to));
            }
        }
        return out;
    }

    private int slot(int from, int to) {
        Integer idx = idToIndex.get(from);
        if (idx == null)
            return -1;
        return Arrays.binarySearch(successors[idx], to);
    }

    @Override
    public String toString() {
        return "Network[" + (directed ? "directed" : "undirected") + (weighted ? ", weighted" : "")
                + ", vertices=" + vertexIds.length + ", edges=" + edgeCount + "]";
    }

    /**
     * Builder for {@link Network}. Collects vertices and edges, then freezes them
     * into sorted arrays.
     */
    public static final class Builder {
        private final boolean directed;
        private final boolean weighted;
        private final TreeMap<Integer, TreeMap<Integer, Double>> out = new TreeMap<>();

        private Builder(boolean directed, boolean weighted) {
            this.directed = directed;
            this.weighted = weighted;
        }

        public Builder addVertex(int id) {
            if (id <= 0)
                throw new IllegalArgumentException("Vertex id must be positive, got " + id);
            out.computeIfAbsent(id, k -> new TreeMap<>());
            return this;
        }

        /** Adds vertices {@code from..to} inclusive. */
        public Builder addVertices(int from, int to) {
            for (int v = from; v <= to; v++)
                addVertex(v);
            return this;
        }

        /**
         * Adds an edge with weight 1.0. Missing endpoints are added as vertices.
         */
        public Builder addEdge(int from, int to) {
            return put(from, to, 1.0);
        }

        /**
         * Adds a weighted edge. Re-adding an existing edge replaces its weight.
         * Negative weights are stored; the engines reject them when read.
         */
        public Builder addEdge(int from, int to, double weight) {
            if (!weighted)
                throw new IllegalArgumentException("Cannot add weighted edge (" + from + ", " + to
                        + ") to an unweighted network");
            if (!Double.isFinite(weight))
                throw new IllegalArgumentException("Edge weight must be finite, got " + weight);
            return put(from, to, weight);
        }

        public Builder addEdge(Edge edge) {
            return addEdge(edge.from(), edge.to());
        }

        private Builder put(int from, int to, double weight) {
            addVertex(from);
            addVertex(to);
            out.get(from).put(to, weight);
            if (!directed)
                out.get(to).put(from, weight);
            return this;
        }

        public Network build() {
            int n = out.size();
            int[] ids = new int[n];
            Map<Integer, Integer> idToIndex = new HashMap<>(n * 2);
            int k = 0;
            for (int id : out.keySet()) {
                ids[k] = id;
                idToIndex.put(id, k++);
            }

            int[][] succ = new int[n][];
            double[][] succW = new double[n][];
            List<List<Integer>> pred = new ArrayList<>(n);
            for (int i = 0; i < n; i++)
                pred.add(new ArrayList<>());

            int edges = 0;
            for (int i = 0; i < n; i++) {
                TreeMap<Integer, Double> targets = out.get(ids[i]);
                succ[i] = new int[targets.size()];
                succW[i] = new double[targets.size()];
                int j = 0;
                for (var e : targets.entrySet()) {
                    succ[i][j] = e.getKey();
                    succW[i][j] = e.getValue();
                    j++;
                    // Sources are visited in ascending order, so predecessor lists stay sorted.
                    pred.get(idToIndex.get(e.getKey())).add(ids[i]);
                    if (directed || ids[i] <= e.getKey())
                        edges++;
                }
            }

            int[][] preds = new int[n][];
            int[][] adj = new int[n][];
            for (int i = 0; i < n; i++) {
                preds[i] = pred.get(i).stream().mapToInt(Integer::intValue).toArray();
                adj[i] = directed ? union(succ[i], preds[i]) : succ[i];
            }
            return new Network(directed, weighted, ids, idToIndex, succ, succW, preds, adj, edges);
        }

        // Merge of two sorted arrays without duplicates.
        private static int[] union(int[] a, int[] b) {
            int[] merged = new int[a.length + b.length];
            int i = 0, j = 0, m = 0;
            while (i < a.length || j < b.length) {
                int next;
                if (j >= b.length || (i < a.length && a[i] < b[j]))
                    next = a[i++];
                else if (i >= a.length || b[j] < a[i])
                    next = b[j++];
                else {
                    next = a[i++];
                    j++;
                }
                merged[m++] = next;
            }
            return Arrays.copyOf(merged, m);
        }
    }
}
