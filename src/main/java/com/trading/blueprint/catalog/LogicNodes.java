package com.trading.blueprint.catalog;

import com.trading.blueprint.api.DataType;
import com.trading.blueprint.api.NodeCategory;
import com.trading.blueprint.api.NodeSpec;

/**
 * Comparisons and boolean connectives. None of them emit statements; they
 * compose inline into the expression of whatever consumes them.
 */
final class LogicNodes {
    private LogicNodes() {
    }

    static void register(NodeCatalog catalog) {
        registerBinary(catalog, "logic.greater", "Greater >", "a > b", DataType.NUMBER, ">");
        registerBinary(catalog, "logic.less", "Less <", "a < b", DataType.NUMBER, "<");
        registerBinary(catalog, "logic.equal", "Equal ==", "a == b", DataType.NUMBER, "==");
        registerBinary(catalog, "logic.greater_equal", "Greater or Equal >=", "a >= b", DataType.NUMBER, ">=");
        registerBinary(catalog, "logic.less_equal", "Less or Equal <=", "a <= b", DataType.NUMBER, "<=");
        registerBinary(catalog, "logic.and", "AND", "Both conditions hold", DataType.BOOLEAN, "and");
        registerBinary(catalog, "logic.or", "OR", "Either condition holds", DataType.BOOLEAN, "or");

        catalog.register(NodeSpec.builder("logic.not", NodeCategory.LOGIC)
                .title("NOT")
                .description("Negates a condition")
                .input("input", DataType.BOOLEAN, "Input")
                .output("result", DataType.BOOLEAN, "Result")
                .expression((scope, port) -> "(not " + scope.inputOr("input", "None") + ")")
                .build());
    }

    private static void registerBinary(NodeCatalog catalog, String type, String title, String description,
            DataType operandType, String operator) {
        catalog.register(NodeSpec.builder(type, NodeCategory.LOGIC)
                .title(title)
                .description(description)
                .input("a", operandType, "A")
                .input("b", operandType, "B")
                .output("result", DataType.BOOLEAN, "Result")
                .expression((scope, port) -> "(" + scope.inputOr("a", "None") + " " + operator + " "
                        + scope.inputOr("b", "None") + ")")
                .build());
    }
}
