package com.trading.blueprint.io;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POJO representation of a saved blueprint.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "nodes", "connections" })
public final class GraphDocument {
    private List<NodeDoc> nodes = new ArrayList<>();
    private List<ConnectionDoc> connections = new ArrayList<>();

    /** One placed node. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({ "node_id", "node_type", "position", "parameters" })
    public static final class NodeDoc {
        @JsonProperty("node_id")
        private String nodeId;
        @JsonProperty("node_type")
        private String nodeType;
        private PositionDoc position;
        /** Absent in a document: the node keeps its schema defaults. */
        private Map<String, Object> parameters;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonPropertyOrder({ "x", "y" })
    public static final class PositionDoc {
        private double x, y;
    }

    /** One wire, output port to input port. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({ "source_node", "source_port", "target_node", "target_port" })
    public static final class ConnectionDoc {
        @JsonProperty("source_node")
        private String sourceNode;
        @JsonProperty("source_port")
        private String sourcePort;
        @JsonProperty("target_node")
        private String targetNode;
        @JsonProperty("target_port")
        private String targetPort;
    }
}
