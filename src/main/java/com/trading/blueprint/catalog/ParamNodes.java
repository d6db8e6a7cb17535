package com.trading.blueprint.catalog;

import com.trading.blueprint.api.DataType;
import com.trading.blueprint.api.NodeCategory;
import com.trading.blueprint.api.NodeSpec;
import com.trading.blueprint.api.ParameterDefinition;

/**
 * Constants and arithmetic. Constants render their parameter as a literal;
 * arithmetic nodes compose inline.
 */
final class ParamNodes {
    private ParamNodes() {
    }

    static void register(NodeCatalog catalog) {
        registerConstant(catalog, "param.number", "Number", "Numeric constant", "value",
                ParameterDefinition.ofFloat("value", "Value", 0, -999999, 999999));
        registerConstant(catalog, "param.period", "Period", "Period length constant", "period",
                ParameterDefinition.ofInt("period", "Period", 20, 1, 500));
        registerConstant(catalog, "param.quantity", "Quantity", "Order size constant", "quantity",
                ParameterDefinition.ofInt("quantity", "Quantity", 100, 100, 100000));
        registerConstant(catalog, "param.percent", "Percent", "Percentage constant", "percent",
                ParameterDefinition.ofFloat("percent", "Percent", 5.0, 0, 100));

        registerArithmetic(catalog, "param.add", "Add +", "+", "0");
        registerArithmetic(catalog, "param.sub", "Subtract -", "-", "0");
        registerArithmetic(catalog, "param.mul", "Multiply ×", "*", "0");
        registerArithmetic(catalog, "param.div", "Divide ÷", "/", "1");

        catalog.register(NodeSpec.builder("param.get_last", NodeCategory.PARAM)
                .title("Last Value")
                .description("Most recent element of a series")
                .input("series", DataType.SERIES, "Series")
                .output("value", DataType.NUMBER, "Value")
                .expression((scope, port) -> scope.inputOr("series", "None") + "[-1]")
                .build());
    }

    private static void registerConstant(NodeCatalog catalog, String type, String title, String description,
            String key, ParameterDefinition schema) {
        catalog.register(NodeSpec.builder(type, NodeCategory.PARAM)
                .title(title)
                .description(description)
                .output(key, DataType.NUMBER, title)
                .parameter(schema)
                .expression((scope, port) -> scope.parameterText(key, schema.defaultValue()))
                .build());
    }

    /** {@code (a op b)}; the right operand falls back to {@code missingRight}. */
    private static void registerArithmetic(NodeCatalog catalog, String type, String title, String operator,
            String missingRight) {
        catalog.register(NodeSpec.builder(type, NodeCategory.PARAM)
                .title(title)
                .description("a " + operator + " b")
                .input("a", DataType.NUMBER, "A")
                .input("b", DataType.NUMBER, "B")
                .output("result", DataType.NUMBER, "Result")
                .expression((scope, port) -> "(" + scope.inputOr("a", "0") + " " + operator + " "
                        + scope.inputOr("b", missingRight) + ")")
                .build());
    }
}
