package com.trading.blueprint.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.trading.blueprint.catalog.NodeCatalog;
import com.trading.blueprint.model.BlueprintGraph;
import com.trading.blueprint.model.BlueprintNode;
import com.trading.blueprint.model.Connection;
import com.trading.blueprint.model.Port;
import com.trading.blueprint.model.PortRef;
import com.trading.blueprint.model.Position;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;

import lombok.extern.log4j.Log4j2;

/**
 * Converts blueprints to and from their JSON document form.
 *
 * <p>
 * Output is pretty-printed with a fixed property order, so saving, loading
 * and saving again yields identical text. Loading is lenient: nodes of an
 * unknown type and connections whose ends cannot be resolved are skipped with
 * a warning.
 */
@Log4j2
public final class GraphSerializer {
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public GraphDocument toDocument(BlueprintGraph graph) {
        GraphDocument doc = new GraphDocument();
        for (BlueprintNode node : graph.nodes()) {
            Position p = node.position();
            doc.getNodes().add(new GraphDocument.NodeDoc(node.id(), node.type(),
                    new GraphDocument.PositionDoc(p.x(), p.y()), new LinkedHashMap<>(node.parameters())));
        }
        for (Connection c : graph.connections()) {
            doc.getConnections().add(new GraphDocument.ConnectionDoc(c.source().nodeId(), c.source().port(),
                    c.target().nodeId(), c.target().port()));
        }
        return doc;
    }

    /**
     * Replaces the content of {@code graph} with the document's nodes and
     * connections. Parameters are restored verbatim.
     */
    public void load(GraphDocument doc, BlueprintGraph graph) {
        graph.clear();
        NodeCatalog catalog = graph.catalog();
        int skipped = 0;
        if (doc.getNodes() != null) {
            for (GraphDocument.NodeDoc nd : doc.getNodes()) {
                if (nd.getNodeType() == null || !catalog.contains(nd.getNodeType())) {
                    log.warn("Skipping node {} of unknown type '{}'", nd.getNodeId(), nd.getNodeType());
                    skipped++;
                    continue;
                }
                if (nd.getNodeId() == null || nd.getNodeId().isBlank() || graph.node(nd.getNodeId()) != null) {
                    log.warn("Skipping node with missing, blank or duplicate id '{}'", nd.getNodeId());
                    skipped++;
                    continue;
                }
                GraphDocument.PositionDoc p = nd.getPosition();
                graph.addNode(nd.getNodeType(), nd.getNodeId(),
                        p == null ? Position.ORIGIN : new Position(p.getX(), p.getY()));
                if (nd.getParameters() != null)
                    graph.replaceParameters(nd.getNodeId(), nd.getParameters());
            }
        }
        if (doc.getConnections() != null) {
            for (GraphDocument.ConnectionDoc cd : doc.getConnections()) {
                PortRef source = PortRef.output(cd.getSourceNode(), cd.getSourcePort());
                PortRef target = PortRef.input(cd.getTargetNode(), cd.getTargetPort());
                Port out = cd.getSourceNode() == null ? null : graph.port(source);
                Port in = cd.getTargetNode() == null ? null : graph.port(target);
                if (out == null || in == null) {
                    log.warn("Skipping connection {} -> {}: endpoint not found", source, target);
                    skipped++;
                    continue;
                }
                try {
                    graph.addConnection(source, target);
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping connection {} -> {}: {}", source, target, e.getMessage());
                    skipped++;
                }
            }
        }
        log.debug("Loaded {} node(s), {} connection(s), skipped {}",
                graph.nodeCount(), graph.connectionCount(), skipped);
    }

    public String toJson(BlueprintGraph graph) {
        try {
            return mapper.writeValueAsString(toDocument(graph));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize blueprint", e);
        }
    }

    public GraphDocument parse(String json) {
        try {
            return mapper.readValue(json, GraphDocument.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Malformed blueprint document", e);
        }
    }

    /** Loads {@code json} into {@code graph}, replacing its content. */
    public void fromJson(String json, BlueprintGraph graph) {
        load(parse(json), graph);
    }

    /** New graph over a fresh catalog, loaded from {@code json}. */
    public BlueprintGraph fromJson(String json) {
        BlueprintGraph graph = new BlueprintGraph();
        fromJson(json, graph);
        return graph;
    }

    public void write(BlueprintGraph graph, Path file) throws IOException {
        Files.writeString(file, toJson(graph), StandardCharsets.UTF_8);
    }

    public BlueprintGraph read(Path file) throws IOException {
        return fromJson(Files.readString(file, StandardCharsets.UTF_8));
    }
}
