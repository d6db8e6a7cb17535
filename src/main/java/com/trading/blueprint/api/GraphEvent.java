package com.trading.blueprint.api;

/**
 * A structural change to a blueprint graph.
 *
 * @param kind   what happened
 * @param nodeId affected node, {@code null} for {@link Kind#CLEARED}
 * @param detail connection id for connection events, parameter key for
 *               {@link Kind#PARAMETER_CHANGED} ({@code null} when the whole
 *               parameter map was replaced)
 */
public record GraphEvent(Kind kind, String nodeId, String detail) {

    public enum Kind {
        NODE_ADDED,
        NODE_REMOVED,
        CONNECTION_ADDED,
        CONNECTION_REMOVED,
        PARAMETER_CHANGED,
        CLEARED
    }
}
