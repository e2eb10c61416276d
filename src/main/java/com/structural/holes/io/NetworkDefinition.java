package com.structural.holes.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a network document.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class NetworkDefinition {
    private NetworkInfo network;

    /** The network itself. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NetworkInfo {
        private String name;
        private Boolean directed;
        private Boolean weighted;
        private List<Integer> vertices;
        private List<EdgeDef> edges;
        /** Either a list of labels (ascending vertex order) or an object keyed by vertex id. */
        private Object groups;
    }

    /** A single edge. {@code weight} is optional. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class EdgeDef {
        private int from, to;
        private Double weight;
    }
}
