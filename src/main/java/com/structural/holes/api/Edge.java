package com.structural.holes.api;

/** A directed pair of node ids. For undirected networks the order is irrelevant. */
public record Edge(int from, int to) {

    public static Edge of(int from, int to) {
        return new Edge(from, to);
    }
}
