package com.structural.holes.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.structural.holes.brokerage.GroupAssignment;
import com.structural.holes.core.Network;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads {@link NetworkDefinition} documents and builds {@link Network}s from
 * them.
 *
 * <p>
 * Document shape:
 *
 * <pre>
 * { "network": { "name": "team", "directed": true, "weighted": true,
 *     "vertices": [1, 2, 3],
 *     "edges": [ { "from": 1, "to": 2, "weight": 2.0 } ],
 *     "groups": { "1": "Sales", "2": "Eng", "3": "Eng" } } }
 * </pre>
 *
 * {@code directed} defaults to false. {@code weighted} defaults to true if any
 * edge has a weight. Vertices referenced only by edges are added implicitly.
 */
public final class JsonNetworkLoader {
    private static final Logger log = LogManager.getLogger(JsonNetworkLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonNetworkLoader() {
        // Utility class
    }

    /** Parses a JSON file into a NetworkDefinition. */
    public static NetworkDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /**
     * Parses a JSON string into a NetworkDefinition.
     *
     * @throws IllegalArgumentException on malformed JSON or a missing
     *                                  {@code network} key.
     */
    public static NetworkDefinition parse(String json) {
        NetworkDefinition def;
        try {
            def = MAPPER.readValue(json, NetworkDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed network definition: " + e.getOriginalMessage(), e);
        }
        if (def == null || def.getNetwork() == null)
            throw new IllegalArgumentException("Missing 'network' key");
        return def;
    }

    public static LoadedNetwork loadFile(Path path) throws IOException {
        LoadedNetwork loaded = build(parseFile(path));
        log.info("Loaded {} from {}", loaded.network(), path);
        return loaded;
    }

    public static LoadedNetwork load(String json) {
        return build(parse(json));
    }

    /**
     * Builds the network described by {@code def}. Group labels are validated
     * against the built network.
     */
    public static LoadedNetwork build(NetworkDefinition def) {
        NetworkDefinition.NetworkInfo info = def.getNetwork();
        List<NetworkDefinition.EdgeDef> edges = info.getEdges() != null ? info.getEdges() : List.of();

        boolean directed = Boolean.TRUE.equals(info.getDirected());
        boolean weighted = info.getWeighted() != null
                ? info.getWeighted()
                : edges.stream().anyMatch(e -> e.getWeight() != null);

        Network.Builder builder = Network.builder(directed, weighted);
        if (info.getVertices() != null) {
            for (int v : info.getVertices())
                builder.addVertex(v);
        }
        for (NetworkDefinition.EdgeDef e : edges) {
            if (e.getWeight() == null)
                builder.addEdge(e.getFrom(), e.getTo());
            else if (weighted)
                builder.addEdge(e.getFrom(), e.getTo(), e.getWeight());
            else
                throw new IllegalArgumentException("Edge (" + e.getFrom() + ", " + e.getTo()
                        + ") has a weight but the network is declared unweighted");
        }
        Network network = builder.build();

        GroupAssignment<Object> groups = null;
        if (info.getGroups() != null) {
            groups = GroupAssignment.of(normalizeGroups(info.getGroups()));
            groups.validate(network);
        }
        return new LoadedNetwork(info.getName(), network, groups);
    }

    // JSON object keys are strings; turn them back into vertex ids.
    private static Object normalizeGroups(Object groups) {
        if (!(groups instanceof Map<?, ?> map))
            return groups;
        Map<Integer, Object> byVertex = new LinkedHashMap<>(map.size() * 2);
        for (var e : map.entrySet()) {
            String key = String.valueOf(e.getKey());
            try {
                byVertex.put(Integer.parseInt(key.trim()), e.getValue());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Group key '" + key + "' is not a vertex id", ex);
            }
        }
        return byVertex;
    }
}
