package com.trading.blueprint.engine;

/**
 * Thrown when an execution order is requested for a graph that contains a
 * cycle.
 */
public class CycleDetectedException extends IllegalStateException {
    private final int resolved;
    private final int total;

    public CycleDetectedException(int resolved, int total) {
        super("Cycle detected! Ordered " + resolved + " of " + total + " nodes");
        this.resolved = resolved;
        this.total = total;
    }

    public int resolved() {
        return resolved;
    }

    public int total() {
        return total;
    }
}
