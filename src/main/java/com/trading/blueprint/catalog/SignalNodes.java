package com.trading.blueprint.catalog;

import com.trading.blueprint.api.DataType;
import com.trading.blueprint.api.NodeCategory;
import com.trading.blueprint.api.NodeSpec;
import com.trading.blueprint.api.ParameterDefinition;

/**
 * Trading signals. Crossovers need the full series and are bound once per
 * bar; threshold signals are plain comparisons and compose inline.
 */
final class SignalNodes {
    private SignalNodes() {
    }

    static void register(NodeCatalog catalog) {
        registerCross(catalog, "signal.cross_over", "Golden Cross", "Fast line crosses above the slow line",
                "cross_over");
        registerCross(catalog, "signal.cross_under", "Death Cross", "Fast line crosses below the slow line",
                "cross_under");

        registerBreak(catalog, "signal.break_up", "Break Up", "Price rises above a level", "Upper Level", ">");
        registerBreak(catalog, "signal.break_down", "Break Down", "Price falls below a level", "Lower Level", "<");

        registerThreshold(catalog, "signal.oversold", "Oversold", "Value below the oversold threshold", 30, "<");
        registerThreshold(catalog, "signal.overbought", "Overbought", "Value above the overbought threshold", 70,
                ">");
    }

    private static void registerCross(NodeCatalog catalog, String type, String title, String description,
            String fn) {
        catalog.register(NodeSpec.builder(type, NodeCategory.SIGNAL)
                .title(title)
                .description(description)
                .input("fast", DataType.SERIES, "Fast")
                .input("slow", DataType.SERIES, "Slow")
                .output("signal", DataType.BOOLEAN, "Signal")
                .emitter((scope, ctx) -> {
                    ctx.addImport(IndicatorNodes.IMPORT);
                    ctx.addCode(scope.variable(fn) + " = TechnicalIndicators." + fn + "("
                            + scope.inputOr("fast", "None") + ", " + scope.inputOr("slow", "None") + ")[-1]");
                })
                .expression((scope, port) -> scope.variable(fn))
                .build());
    }

    private static void registerBreak(NodeCatalog catalog, String type, String title, String description,
            String levelLabel, String operator) {
        catalog.register(NodeSpec.builder(type, NodeCategory.SIGNAL)
                .title(title)
                .description(description)
                .input("price", DataType.NUMBER, "Price")
                .input("level", DataType.NUMBER, levelLabel)
                .output("signal", DataType.BOOLEAN, "Signal")
                .expression((scope, port) -> "(" + scope.inputOr("price", "None") + " " + operator + " "
                        + scope.inputOr("level", "None") + ")")
                .build());
    }

    private static void registerThreshold(NodeCatalog catalog, String type, String title, String description,
            int threshold, String operator) {
        catalog.register(NodeSpec.builder(type, NodeCategory.SIGNAL)
                .title(title)
                .description(description)
                .input("value", DataType.NUMBER, "Value")
                .optionalInput("threshold", DataType.NUMBER, "Threshold", threshold)
                .output("signal", DataType.BOOLEAN, "Signal")
                .parameter(ParameterDefinition.ofFloat("threshold", title + " Threshold", threshold, 0, 100))
                .expression((scope, port) -> "(" + scope.inputOr("value", "None") + " " + operator + " "
                        + scope.inputOr("threshold", scope.parameterText("threshold", threshold)) + ")")
                .build());
    }
}
