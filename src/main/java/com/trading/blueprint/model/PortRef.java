package com.trading.blueprint.model;

import com.trading.blueprint.api.PortDirection;

/**
 * Address of a port: owning node id, side and port name.
 */
public record PortRef(String nodeId, PortDirection direction, String port) {

    public static PortRef input(String nodeId, String port) {
        return new PortRef(nodeId, PortDirection.INPUT, port);
    }

    public static PortRef output(String nodeId, String port) {
        return new PortRef(nodeId, PortDirection.OUTPUT, port);
    }

    @Override
    public String toString() {
        return nodeId + (direction == PortDirection.INPUT ? ".in." : ".out.") + port;
    }
}
