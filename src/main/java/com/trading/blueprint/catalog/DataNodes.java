package com.trading.blueprint.catalog;

import com.trading.blueprint.api.DataType;
import com.trading.blueprint.api.NodeCategory;
import com.trading.blueprint.api.NodeSpec;
import com.trading.blueprint.api.ParameterDefinition;

/**
 * Market and account data sources: the current bar, windowed price history
 * and position/cash state.
 */
final class DataNodes {
    static final int DEFAULT_COUNT = 20;

    private DataNodes() {
    }

    static void register(NodeCatalog catalog) {
        catalog.register(NodeSpec.builder("data.bar", NodeCategory.DATA)
                .title("Bar")
                .description("Current bar, OHLCV fields")
                .output("open", DataType.NUMBER, "Open")
                .output("high", DataType.NUMBER, "High")
                .output("low", DataType.NUMBER, "Low")
                .output("close", DataType.NUMBER, "Close")
                .output("volume", DataType.NUMBER, "Volume")
                .output("bar", DataType.BAR, "Bar")
                .expression((scope, port) -> port.equals("bar") ? "bar" : "bar." + port)
                .build());

        registerWindow(catalog, "data.close_prices", "Close Prices", "Recent closing prices",
                "prices", "closes", "self.get_close_prices(%s)");
        registerWindow(catalog, "data.high_prices", "High Prices", "Recent bar highs",
                "prices", "highs", "[b.high for b in self.get_bars(%s)]");
        registerWindow(catalog, "data.low_prices", "Low Prices", "Recent bar lows",
                "prices", "lows", "[b.low for b in self.get_bars(%s)]");
        registerWindow(catalog, "data.open_prices", "Open Prices", "Recent bar opens",
                "prices", "opens", "[b.open for b in self.get_bars(%s)]");
        registerWindow(catalog, "data.volume_series", "Volume Series", "Recent bar volumes",
                "volumes", "volumes", "[b.volume for b in self.get_bars(%s)]");

        catalog.register(NodeSpec.builder("data.position", NodeCategory.DATA)
                .title("Position")
                .description("Current holding")
                .output("quantity", DataType.NUMBER, "Quantity")
                .output("has_position", DataType.BOOLEAN, "Has Position")
                .expression((scope, port) -> port.equals("has_position") ? "(self.position > 0)" : "self.position")
                .build());

        catalog.register(NodeSpec.builder("data.cash", NodeCategory.DATA)
                .title("Cash")
                .description("Available cash and total account value")
                .output("cash", DataType.NUMBER, "Cash")
                .output("total", DataType.NUMBER, "Total Value")
                .expression((scope, port) -> port.equals("total") ? "self.total_value" : "self.cash")
                .build());
    }

    /**
     * A history window: binds {@code <var> = <template % count>} once, the
     * series output reads the variable and {@code current} its last element.
     */
    private static void registerWindow(NodeCatalog catalog, String type, String title, String description,
            String seriesPort, String suffix, String template) {
        catalog.register(NodeSpec.builder(type, NodeCategory.DATA)
                .title(title)
                .description(description)
                .optionalInput("count", DataType.NUMBER, "Count", DEFAULT_COUNT)
                .output(seriesPort, DataType.SERIES, title)
                .output("current", DataType.NUMBER, "Current")
                .parameter(ParameterDefinition.ofInt("count", "Count", DEFAULT_COUNT, 1, 500))
                .emitter((scope, ctx) -> {
                    String count = scope.inputOr("count", scope.parameterText("count", DEFAULT_COUNT));
                    ctx.addCode(scope.variable(suffix) + " = " + String.format(template, count));
                })
                .expression((scope, port) -> port.equals("current")
                        ? scope.variable(suffix) + "[-1]"
                        : scope.variable(suffix))
                .build());
    }
}
