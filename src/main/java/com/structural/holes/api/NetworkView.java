package com.structural.holes.api;

/**
 * Read-only adjacency view consumed by the metric engines.
 *
 * <p>
 * The engines never mutate or store a view; they only query it. Implementations
 * must be side-effect free on read so that distinct node queries can run
 * concurrently against the same view.
 *
 * <p>
 * Vertex ids are positive integers and need not be contiguous.
 */
public interface NetworkView {

    /** @return {@code true} if edges have a direction. */
    boolean isDirected();

    /** @return {@code true} if edges carry weights; otherwise every edge counts 1. */
    boolean isWeighted();

    /** @return Number of vertices. */
    int vertexCount();

    /** @return All vertex ids in ascending order, as an array owned by the caller. */
    int[] vertices();

    /** @return {@code true} if {@code node} is a vertex of this network. */
    boolean containsVertex(int node);

    /**
     * Neighbors of {@code node} filtered by direction, in ascending order and
     * without duplicates. Self-loops are reported as-is; callers that must
     * ignore them filter them out.
     *
     * @param node A vertex id.
     * @param mode {@link Mode#OUT} for successors, {@link Mode#IN} for
     *             predecessors, {@link Mode#BOTH} for their union.
     * @return The neighbor ids, as an array owned by the caller.
     */
    int[] neighbors(int node, Mode mode);

    /** @return {@code true} if the edge {@code from -> to} exists. */
    boolean hasEdge(int from, int to);

    /**
     * Raw weight of {@code from -> to}: the stored weight for weighted networks,
     * 1.0 for an unweighted edge, 0.0 if the edge is absent. No sign check is
     * applied here.
     */
    double weight(int from, int to);
}
