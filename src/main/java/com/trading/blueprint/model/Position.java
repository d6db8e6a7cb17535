package com.trading.blueprint.model;

/** Canvas placement of a node. Layout only, never read by analysis. */
public record Position(double x, double y) {
    public static final Position ORIGIN = new Position(0, 0);
}
