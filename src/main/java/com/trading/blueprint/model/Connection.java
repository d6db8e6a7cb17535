package com.trading.blueprint.model;

import com.trading.blueprint.api.PortDirection;

/**
 * A finalized edge from an output port to an input port.
 */
public record Connection(String id, PortRef source, PortRef target) {

    public Connection {
        if (source.direction() != PortDirection.OUTPUT || target.direction() != PortDirection.INPUT)
            throw new IllegalArgumentException("Connection must run from an output to an input: "
                    + source + " -> " + target);
    }

    public boolean touches(String nodeId) {
        return source.nodeId().equals(nodeId) || target.nodeId().equals(nodeId);
    }

    @Override
    public String toString() {
        return id + "[" + source + " -> " + target + "]";
    }
}
