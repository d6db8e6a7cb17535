package com.trading.blueprint.model;

/**
 * Wire being dragged out of a port, not yet part of the graph.
 *
 * <p>
 * Analysis and generation never see a drag. The graph keeps at most one and
 * drops it when the drag is finished or cancelled.
 */
public final class ConnectionDrag {

    public enum State {
        IDLE,
        DRAGGING,
        FINALIZED,
        CANCELLED
    }

    private final PortRef origin;
    private Position pointer;

    ConnectionDrag(PortRef origin, Position pointer) {
        this.origin = origin;
        this.pointer = pointer;
    }

    /** The port the drag started from, input or output. */
    public PortRef origin() {
        return origin;
    }

    /** Loose end of the wire. */
    public Position pointer() {
        return pointer;
    }

    void moveTo(Position pointer) {
        this.pointer = pointer;
    }
}
