package com.structural.holes.io;

import com.structural.holes.brokerage.GroupAssignment;
import com.structural.holes.core.Network;

import java.util.Optional;

/**
 * A network built from a definition, with its group labels if the document
 * carried any.
 */
public record LoadedNetwork(String name, Network network, GroupAssignment<Object> groups) {

    public Optional<GroupAssignment<Object>> groupAssignment() {
        return Optional.ofNullable(groups);
    }
}
