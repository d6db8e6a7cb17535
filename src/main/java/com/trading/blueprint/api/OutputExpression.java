package com.trading.blueprint.api;

import com.trading.blueprint.model.NodeScope;

/**
 * Source-level expression a consumer substitutes for one output port.
 */
@FunctionalInterface
public interface OutputExpression {
    OutputExpression NONE = (scope, port) -> "";

    String expression(NodeScope scope, String port);
}
