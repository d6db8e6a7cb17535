package com.trading.blueprint.api;

/**
 * Observer of structural graph changes.
 *
 * <p>
 * Called synchronously on the mutating thread after the change has been
 * applied, so the graph is consistent when the listener reads it.
 */
@FunctionalInterface
public interface GraphListener {
    void onGraphChanged(GraphEvent event);
}
