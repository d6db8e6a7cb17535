package com.trading.blueprint.model;

import com.trading.blueprint.api.DataType;
import com.trading.blueprint.api.PortDefinition;
import com.trading.blueprint.api.PortDirection;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Live port of one node. Tracks the ids of the connections incident to it;
 * the connections themselves live in the owning {@link BlueprintGraph}.
 */
public final class Port {
    private final String nodeId;
    private final PortDefinition definition;
    private final List<String> connectionIds = new ArrayList<>(1);

    Port(String nodeId, PortDefinition definition) {
        this.nodeId = nodeId;
        this.definition = definition;
    }

    public String nodeId() {
        return nodeId;
    }

    public PortDefinition definition() {
        return definition;
    }

    public String name() {
        return definition.name();
    }

    public PortDirection direction() {
        return definition.direction();
    }

    public DataType dataType() {
        return definition.dataType();
    }

    public PortRef ref() {
        return new PortRef(nodeId, definition.direction(), definition.name());
    }

    /** Incident connection ids in the order they were attached. */
    public List<String> connectionIds() {
        return Collections.unmodifiableList(connectionIds);
    }

    public boolean isConnected() {
        return !connectionIds.isEmpty();
    }

    /**
     * Whether a wire between this port and {@code candidate} would be legal
     * right now: opposite sides, different nodes, a free slot on a singular
     * input, and compatible types read from the output end to the input end.
     */
    public boolean canAcceptConnection(Port candidate) {
        if (candidate == null || candidate.direction() == direction())
            return false;
        if (candidate.nodeId.equals(nodeId))
            return false;
        if (direction() == PortDirection.INPUT && !definition.multiConnect() && isConnected())
            return false;
        if (direction() == PortDirection.INPUT)
            return DataType.canConnect(candidate.dataType(), dataType());
        return DataType.canConnect(dataType(), candidate.dataType());
    }

    void attach(String connectionId) {
        connectionIds.add(connectionId);
    }

    void detach(String connectionId) {
        connectionIds.remove(connectionId);
    }

    @Override
    public String toString() {
        return ref() + ":" + dataType();
    }
}
