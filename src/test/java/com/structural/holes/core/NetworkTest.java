package com.structural.holes.core;

import com.structural.holes.api.Edge;
import com.structural.holes.api.Mode;
import com.structural.holes.engine.ConstraintEngine;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class NetworkTest {

    @Test
    public void testEmptyNetwork() {
        Network g = Network.undirected().build();
        assertEquals(0, g.vertexCount());
        assertEquals(0, g.edgeCount());
        assertArrayEquals(new int[0], g.neighbors(1, Mode.BOTH));
        assertFalse(g.containsVertex(1));
    }

    @Test
    public void testUndirectedStoresBothDirections() {
        Network g = Network.undirected()
                .addEdge(1, 2)
                .addEdge(1, 3)
                .build();

        assertFalse(g.isDirected());
        assertFalse(g.isWeighted());
        assertEquals(3, g.vertexCount());
        assertEquals(2, g.edgeCount());
        assertTrue(g.hasEdge(1, 2));
        assertTrue(g.hasEdge(2, 1));
        assertFalse(g.hasEdge(2, 3));

        // All modes coincide
        assertArrayEquals(new int[] { 2, 3 }, g.neighbors(1, Mode.OUT));
        assertArrayEquals(new int[] { 2, 3 }, g.neighbors(1, Mode.IN));
        assertArrayEquals(new int[] { 2, 3 }, g.neighbors(1, Mode.BOTH));
        assertEquals(1.0, g.weight(2, 1), 0.0);
        assertEquals(0.0, g.weight(2, 3), 0.0);
    }

    @Test
    public void testDirectedNeighborSets() {
        // 1 -> 2, 3 -> 1, 1 <-> 4
        Network g = Network.directed()
                .addEdge(1, 2)
                .addEdge(3, 1)
                .addEdge(1, 4)
                .addEdge(4, 1)
                .build();

        assertTrue(g.isDirected());
        assertEquals(4, g.edgeCount());
        assertArrayEquals(new int[] { 2, 4 }, g.neighbors(1, Mode.OUT));
        assertArrayEquals(new int[] { 3, 4 }, g.neighbors(1, Mode.IN));
        // Union without duplicates, ascending
        assertArrayEquals(new int[] { 2, 3, 4 }, g.neighbors(1, Mode.BOTH));
        assertTrue(g.hasEdge(1, 2));
        assertFalse(g.hasEdge(2, 1));
    }

    @Test
    public void testSelfLoopStoredOnce() {
        Network g = Network.undirected()
                .addEdge(1, 1)
                .addEdge(1, 2)
                .build();

        assertEquals(2, g.edgeCount());
        assertArrayEquals(new int[] { 1, 2 }, g.neighbors(1, Mode.BOTH));
        assertTrue(g.hasEdge(1, 1));
    }

    @Test
    public void testNonContiguousVertexIds() {
        Network g = Network.undirected()
                .addVertex(40)
                .addEdge(7, 12)
                .build();

        assertArrayEquals(new int[] { 7, 12, 40 }, g.vertices());
        assertTrue(g.containsVertex(40));
        assertFalse(g.containsVertex(8));
        assertArrayEquals(new int[0], g.neighbors(40, Mode.BOTH));
    }

    @Test
    public void testWeightsAndReplacement() {
        Network g = Network.weightedDirected()
                .addEdge(1, 2, 2.5)
                .addEdge(2, 3, -1.0)
                .addEdge(1, 2, 4.0)
                .build();

        assertTrue(g.isWeighted());
        assertEquals(4.0, g.weight(1, 2), 0.0);
        // Negative weights are stored; the engines reject them on read
        assertEquals(-1.0, g.weight(2, 3), 0.0);
        assertEquals(0.0, g.weight(2, 1), 0.0);
        assertEquals(2, g.edgeCount());
    }

    @Test
    public void testEdgesListing() {
        Network undirected = Network.undirected().addEdge(2, 1).addEdge(2, 3).build();
        assertEquals(List.of(Edge.of(1, 2), Edge.of(2, 3)), undirected.edges());

        Network directed = Network.directed().addEdge(2, 1).addEdge(1, 3).build();
        assertEquals(List.of(Edge.of(1, 3), Edge.of(2, 1)), directed.edges());
    }

    @Test
    public void testAddVerticesRange() {
        Network g = Network.directed().addVertices(1, 5).build();
        assertEquals(5, g.vertexCount());
        assertEquals(0, g.edgeCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveVertexRejected() {
        Network.undirected().addVertex(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeEndpointRejected() {
        Network.directed().addEdge(-1, 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWeightOnUnweightedRejected() {
        Network.undirected().addEdge(1, 2, 3.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonFiniteWeightRejected() {
        Network.weightedUndirected().addEdge(1, 2, Double.NaN);
    }

    @Test
    public void testReturnedArraysDoNotAliasStorage() {
        Network g = Network.undirected()
                .addEdge(1, 2).addEdge(1, 3).addEdge(1, 4).addEdge(1, 5)
                .build();
        double before = ConstraintEngine.constraint(g, 1);

        g.neighbors(1, Mode.BOTH)[0] = 1;
        g.neighbors(1, Mode.OUT)[1] = 1;
        g.neighbors(1, Mode.IN)[2] = 1;
        g.vertices()[0] = 99;

        assertArrayEquals(new int[] { 2, 3, 4, 5 }, g.neighbors(1, Mode.BOTH));
        assertArrayEquals(new int[] { 1, 2, 3, 4, 5 }, g.vertices());
        assertEquals(0.25, before, 1e-10);
        assertEquals(before, ConstraintEngine.constraint(g, 1), 0.0);
    }
}
