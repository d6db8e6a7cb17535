package com.trading.blueprint.model;

import com.trading.blueprint.api.DataType;
import com.trading.blueprint.api.GraphEvent;
import com.trading.blueprint.api.GraphListener;
import com.trading.blueprint.api.ParameterDefinition;
import com.trading.blueprint.api.PortDirection;
import com.trading.blueprint.catalog.NodeCatalog;
import com.trading.blueprint.util.CompositeGraphListener;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import lombok.extern.log4j.Log4j2;

/**
 * The editable blueprint: an arena of nodes and the connections between
 * their ports.
 *
 * <p>
 * Nodes and connections iterate in insertion order, which keeps analysis and
 * code generation deterministic. Every connection endpoint refers to a port of
 * a member node. Structural changes are reported to registered
 * {@link GraphListener}s after they are applied.
 *
 * <h3>Connection drag</h3>
 * Editors build wires with {@link #startConnection}, {@link #updateDragging},
 * {@link #finishConnection} and {@link #cancelConnection}. A drag may start at
 * either side; a rejected drop cancels the drag and leaves the graph
 * untouched.
 */
@Log4j2
public final class BlueprintGraph {
    private final NodeCatalog catalog;
    private final Map<String, BlueprintNode> nodes = new LinkedHashMap<>();
    private final Map<String, Connection> connections = new LinkedHashMap<>();
    private final CompositeGraphListener listeners = new CompositeGraphListener();
    private long connectionSeq;

    private ConnectionDrag drag;
    private ConnectionDrag.State dragState = ConnectionDrag.State.IDLE;

    public BlueprintGraph() {
        this(new NodeCatalog());
    }

    public BlueprintGraph(NodeCatalog catalog) {
        this.catalog = catalog;
    }

    public NodeCatalog catalog() {
        return catalog;
    }

    // ── Listeners ────────────────────────────────────────────────

    public void addListener(GraphListener listener) {
        listeners.add(listener);
    }

    public void removeListener(GraphListener listener) {
        listeners.remove(listener);
    }

    private void fire(GraphEvent.Kind kind, String nodeId, String detail) {
        listeners.onGraphChanged(new GraphEvent(kind, nodeId, detail));
    }

    // ── Nodes ────────────────────────────────────────────────────

    /** Adds a node of the given type under a fresh 8-character id. */
    public BlueprintNode addNode(String type, Position position) {
        String id;
        do {
            id = UUID.randomUUID().toString().substring(0, 8);
        } while (nodes.containsKey(id));
        return addNode(type, id, position);
    }

    /**
     * Adds a node under a caller-chosen id.
     *
     * @throws IllegalArgumentException if the type is unknown or the id taken
     */
    public BlueprintNode addNode(String type, String id, Position position) {
        if (id == null || id.isBlank())
            throw new IllegalArgumentException("Node id must not be blank");
        if (nodes.containsKey(id))
            throw new IllegalArgumentException("Duplicate node id: " + id);
        BlueprintNode node = catalog.create(type, id, position);
        nodes.put(id, node);
        fire(GraphEvent.Kind.NODE_ADDED, id, null);
        return node;
    }

    /** Removes a node after removing every connection incident to it. */
    public void removeNode(String id) {
        BlueprintNode node = requireNode(id);
        for (Port port : node.ports()) {
            for (String cid : List.copyOf(port.connectionIds()))
                removeConnection(cid);
        }
        if (drag != null && drag.origin().nodeId().equals(id))
            cancelConnection();
        nodes.remove(id);
        fire(GraphEvent.Kind.NODE_REMOVED, id, null);
    }

    /** Node by id, or {@code null}. */
    public BlueprintNode node(String id) {
        return nodes.get(id);
    }

    public BlueprintNode requireNode(String id) {
        BlueprintNode node = nodes.get(id);
        if (node == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return node;
    }

    /** Nodes in insertion order. */
    public List<BlueprintNode> nodes() {
        return List.copyOf(nodes.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /** Port by address, or {@code null} if the node or port does not exist. */
    public Port port(PortRef ref) {
        BlueprintNode node = nodes.get(ref.nodeId());
        return node == null ? null : node.port(ref.direction(), ref.port());
    }

    public Port requirePort(PortRef ref) {
        Port port = port(ref);
        if (port == null)
            throw new IllegalArgumentException("Unknown port: " + ref);
        return port;
    }

    public NodeScope scope(String nodeId) {
        return new NodeScope(this, requireNode(nodeId));
    }

    // ── Parameters & layout ──────────────────────────────────────

    /**
     * Writes one parameter. Keys declared in the node's schema are coerced to
     * the declared kind and clamped; other keys, input overrides included, are
     * stored as given.
     */
    public void setParameter(String nodeId, String key, Object value) {
        BlueprintNode node = requireNode(nodeId);
        ParameterDefinition def = node.spec().parameter(key);
        node.putParameter(key, def == null ? value : def.coerce(value));
        fire(GraphEvent.Kind.PARAMETER_CHANGED, nodeId, key);
    }

    /** Stores a literal typed into an input port, used while it is unconnected. */
    public void setInputOverride(String nodeId, String port, Object value) {
        if (requireNode(nodeId).input(port) == null)
            throw new IllegalArgumentException("Unknown input port: " + nodeId + "." + port);
        setParameter(nodeId, BlueprintNode.INPUT_OVERRIDE_PREFIX + port, value);
    }

    public void removeParameter(String nodeId, String key) {
        BlueprintNode node = requireNode(nodeId);
        if (!node.hasParameter(key))
            return;
        node.removeParameter(key);
        fire(GraphEvent.Kind.PARAMETER_CHANGED, nodeId, key);
    }

    /** Replaces the whole parameter map verbatim, as loading a saved graph does. */
    public void replaceParameters(String nodeId, Map<String, Object> values) {
        requireNode(nodeId).replaceParameters(values == null ? Map.of() : values);
        fire(GraphEvent.Kind.PARAMETER_CHANGED, nodeId, null);
    }

    /** Moves a node. Layout only, so listeners are not notified. */
    public void setPosition(String nodeId, Position position) {
        requireNode(nodeId).setPosition(position);
    }

    // ── Connections ──────────────────────────────────────────────

    /** Connections in insertion order. */
    public List<Connection> connections() {
        return List.copyOf(connections.values());
    }

    public Connection connection(String id) {
        return connections.get(id);
    }

    public int connectionCount() {
        return connections.size();
    }

    public List<Connection> connectionsAt(PortRef ref) {
        Port port = requirePort(ref);
        List<Connection> result = new ArrayList<>(port.connectionIds().size());
        for (String cid : port.connectionIds())
            result.add(connections.get(cid));
        return result;
    }

    /** Connections feeding the node, by input port declaration order. */
    public List<Connection> incomingConnections(String nodeId) {
        List<Connection> result = new ArrayList<>();
        for (Port in : requireNode(nodeId).inputs()) {
            for (String cid : in.connectionIds())
                result.add(connections.get(cid));
        }
        return result;
    }

    /** Connections leaving the node, by output port declaration order. */
    public List<Connection> outgoingConnections(String nodeId) {
        List<Connection> result = new ArrayList<>();
        for (Port out : requireNode(nodeId).outputs()) {
            for (String cid : out.connectionIds())
                result.add(connections.get(cid));
        }
        return result;
    }

    public Connection connect(String sourceNode, String sourcePort, String targetNode, String targetPort) {
        return addConnection(PortRef.output(sourceNode, sourcePort), PortRef.input(targetNode, targetPort));
    }

    /**
     * Wires an output to an input. A singular input that is already fed loses
     * its old connection first.
     *
     * @throws IllegalArgumentException if a port is unknown, the sides are
     *                                  wrong, both ends sit on one node or the
     *                                  types do not match
     */
    public Connection addConnection(PortRef source, PortRef target) {
        Port out = requirePort(source);
        Port in = requirePort(target);
        if (out.direction() != PortDirection.OUTPUT || in.direction() != PortDirection.INPUT)
            throw new IllegalArgumentException("Connections run from an output to an input: "
                    + source + " -> " + target);
        if (out.nodeId().equals(in.nodeId()))
            throw new IllegalArgumentException("Cannot connect a node to itself: " + source.nodeId());
        if (!DataType.canConnect(out.dataType(), in.dataType()))
            throw new IllegalArgumentException(String.format("Type mismatch: %s (%s) -> %s (%s)",
                    source, out.dataType(), target, in.dataType()));
        return link(out, in);
    }

    private Connection link(Port out, Port in) {
        if (!in.definition().multiConnect()) {
            for (String cid : List.copyOf(in.connectionIds()))
                removeConnection(cid);
        }
        Connection c = new Connection("conn_" + (++connectionSeq), out.ref(), in.ref());
        connections.put(c.id(), c);
        out.attach(c.id());
        in.attach(c.id());
        fire(GraphEvent.Kind.CONNECTION_ADDED, in.nodeId(), c.id());
        return c;
    }

    /** Detaches the connection from both ports and drops it. Unknown ids are ignored. */
    public void removeConnection(String id) {
        Connection c = connections.get(id);
        if (c == null)
            return;
        Port out = port(c.source());
        Port in = port(c.target());
        if (out != null)
            out.detach(id);
        if (in != null)
            in.detach(id);
        connections.remove(id);
        fire(GraphEvent.Kind.CONNECTION_REMOVED, c.target().nodeId(), id);
    }

    /** Drops every node and connection. */
    public void clear() {
        cancelConnection();
        connections.clear();
        nodes.clear();
        dragState = ConnectionDrag.State.IDLE;
        fire(GraphEvent.Kind.CLEARED, null, null);
    }

    // ── Connection drag ──────────────────────────────────────────

    /** Begins dragging a wire out of {@code origin}. Replaces any drag in progress. */
    public void startConnection(PortRef origin) {
        Port port = requirePort(origin);
        drag = new ConnectionDrag(port.ref(), nodes.get(port.nodeId()).position());
        dragState = ConnectionDrag.State.DRAGGING;
    }

    public void updateDragging(Position pointer) {
        if (drag != null)
            drag.moveTo(pointer);
    }

    /**
     * Drops the dragged wire on {@code dropTarget}.
     *
     * @return {@code true} if a connection was added; {@code false} if no drag
     *         was in progress or the drop was rejected, in which case the drag
     *         is cancelled and the graph is unchanged
     */
    public boolean finishConnection(PortRef dropTarget) {
        if (drag == null) {
            cancelConnection();
            return false;
        }
        Port dragPort = port(drag.origin());
        Port dropPort = dropTarget == null ? null : port(dropTarget);
        if (dragPort == null || dropPort == null || !dropPort.canAcceptConnection(dragPort)) {
            log.debug("Rejected connection {} -> {}", drag.origin(), dropTarget);
            cancelConnection();
            return false;
        }
        Port out = dragPort.direction() == PortDirection.OUTPUT ? dragPort : dropPort;
        Port in = out == dragPort ? dropPort : dragPort;
        link(out, in);
        drag = null;
        dragState = ConnectionDrag.State.FINALIZED;
        return true;
    }

    public void cancelConnection() {
        if (drag != null || dragState == ConnectionDrag.State.DRAGGING)
            dragState = ConnectionDrag.State.CANCELLED;
        drag = null;
    }

    public boolean isDragging() {
        return drag != null;
    }

    /** The drag in progress, or {@code null}. */
    public ConnectionDrag drag() {
        return drag;
    }

    /** Outcome of the most recent drag, {@code DRAGGING} while one is open. */
    public ConnectionDrag.State dragState() {
        return dragState;
    }
}
