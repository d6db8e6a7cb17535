package com.trading.blueprint.api;

import com.trading.blueprint.engine.CodeGenContext;
import com.trading.blueprint.model.NodeScope;

/**
 * Statement emission of a node variant.
 *
 * <p>
 * Appends zero or more statements and imports to the shared context. The
 * generator calls it at most once per node per generation pass, after every
 * producer wired into the node has emitted.
 */
@FunctionalInterface
public interface Emitter {
    Emitter NONE = (scope, ctx) -> {
    };

    void emit(NodeScope scope, CodeGenContext ctx);
}
