package com.trading.blueprint.catalog;

import com.trading.blueprint.api.DataType;
import com.trading.blueprint.api.NodeCategory;
import com.trading.blueprint.api.NodeSpec;
import com.trading.blueprint.api.ParameterDefinition;
import com.trading.blueprint.engine.CodeGenContext;
import com.trading.blueprint.model.NodeScope;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Technical indicators. Every variant binds the result of one
 * {@code TechnicalIndicators} call to a variable; consumers read the variable,
 * an attribute of it, or its last element.
 */
final class IndicatorNodes {
    static final String IMPORT = "from core.indicators.technical import TechnicalIndicators";

    private static final List<String> HLC = List.of("high", "low", "close");

    private static final Map<String, String> LABELS = Map.of(
            "data", "Data",
            "high", "High",
            "low", "Low",
            "close", "Close",
            "volume", "Volume");

    private IndicatorNodes() {
    }

    /** A numeric argument that may be wired in or falls back to a parameter. */
    private record Arg(String name, String label, Number defaultValue, ParameterDefinition schema) {
        static Arg ofInt(String name, String label, int defaultValue, int min, int max) {
            return new Arg(name, label, defaultValue, ParameterDefinition.ofInt(name, label, defaultValue, min, max));
        }

        static Arg ofFloat(String name, String label, double defaultValue, double min, double max) {
            return new Arg(name, label, defaultValue,
                    ParameterDefinition.ofFloat(name, label, defaultValue, min, max));
        }
    }

    static void register(NodeCatalog catalog) {
        // --- single series + current value ---
        registerSingle(catalog, "indicator.ma", "MA", "Simple moving average", "MA", "ma",
                List.of("data"), List.of(Arg.ofInt("period", "Period", 20, 1, 500)));
        registerSingle(catalog, "indicator.ema", "EMA", "Exponential moving average", "EMA", "ema",
                List.of("data"), List.of(Arg.ofInt("period", "Period", 20, 1, 500)));
        registerSingle(catalog, "indicator.wma", "WMA", "Weighted moving average", "WMA", "wma",
                List.of("data"), List.of(Arg.ofInt("period", "Period", 20, 1, 500)));
        registerSingle(catalog, "indicator.rsi", "RSI", "Relative strength index", "RSI", "rsi",
                List.of("data"), List.of(Arg.ofInt("period", "Period", 14, 1, 100)));
        registerSingle(catalog, "indicator.atr", "ATR", "Average true range", "ATR", "atr",
                HLC, List.of(Arg.ofInt("period", "Period", 14, 1, 100)));
        registerSingle(catalog, "indicator.cci", "CCI", "Commodity channel index", "CCI", "cci",
                HLC, List.of(Arg.ofInt("period", "Period", 20, 1, 200)));
        registerSingle(catalog, "indicator.obv", "OBV", "On-balance volume", "OBV", "obv",
                List.of("close", "volume"), List.of());
        registerSingle(catalog, "indicator.vwap", "VWAP", "Volume weighted average price", "VWAP", "vwap",
                List.of("high", "low", "close", "volume"), List.of());

        // --- result object with one attribute per output ---
        registerAttributes(catalog, "indicator.macd", "MACD", "Moving average convergence divergence", "MACD",
                "macd_result", List.of("data"),
                List.of(Arg.ofInt("fast", "Fast Period", 12, 1, 100),
                        Arg.ofInt("slow", "Slow Period", 26, 1, 200),
                        Arg.ofInt("signal", "Signal Period", 9, 1, 50)),
                List.of("dif", "dea", "macd"));
        registerAttributes(catalog, "indicator.boll", "Bollinger Bands", "Bollinger bands", "BOLL", "boll",
                List.of("data"),
                List.of(Arg.ofInt("period", "Period", 20, 1, 200),
                        Arg.ofFloat("std", "Std Dev", 2.0, 0.5, 5.0)),
                List.of("upper", "middle", "lower"));
        registerAttributes(catalog, "indicator.kdj", "KDJ", "Stochastic oscillator", "KDJ", "kdj",
                HLC, List.of(Arg.ofInt("n", "Period", 9, 1, 100)),
                List.of("k", "d", "j"));

        registerDmi(catalog);
    }

    private static NodeSpec.Builder base(String type, String title, String description, List<String> seriesInputs,
            List<Arg> args) {
        NodeSpec.Builder b = NodeSpec.builder(type, NodeCategory.INDICATOR)
                .title(title)
                .description(description);
        for (String in : seriesInputs)
            b.input(in, DataType.SERIES, label(in));
        for (Arg a : args) {
            b.optionalInput(a.name(), DataType.NUMBER, a.label(), a.defaultValue());
            b.parameter(a.schema());
        }
        return b;
    }

    /** {@code <var> = TechnicalIndicators.<fn>(<series...>, <args...>)} */
    private static void emitCall(NodeScope scope, CodeGenContext ctx, String target, String fn,
            List<String> seriesInputs, List<Arg> args) {
        List<String> values = new ArrayList<>(seriesInputs.size() + args.size());
        for (String in : seriesInputs)
            values.add(scope.inputOr(in, "None"));
        for (Arg a : args)
            values.add(scope.inputOr(a.name(), scope.parameterText(a.name(), a.defaultValue())));
        ctx.addImport(IMPORT);
        ctx.addCode(target + " = TechnicalIndicators." + fn + "(" + String.join(", ", values) + ")");
    }

    private static void registerSingle(NodeCatalog catalog, String type, String title, String description,
            String fn, String suffix, List<String> seriesInputs, List<Arg> args) {
        catalog.register(base(type, title, description, seriesInputs, args)
                .output(suffix, DataType.SERIES, fn + " Series")
                .output("current", DataType.NUMBER, "Current")
                .emitter((scope, ctx) -> emitCall(scope, ctx, scope.variable(suffix), fn, seriesInputs, args))
                .expression((scope, port) -> port.equals("current")
                        ? scope.variable(suffix) + "[-1]"
                        : scope.variable(suffix))
                .build());
    }

    private static void registerAttributes(NodeCatalog catalog, String type, String title, String description,
            String fn, String suffix, List<String> seriesInputs, List<Arg> args, List<String> fields) {
        NodeSpec.Builder b = base(type, title, description, seriesInputs, args);
        for (String f : fields)
            b.output(f, DataType.SERIES, f.toUpperCase());
        catalog.register(b
                .emitter((scope, ctx) -> emitCall(scope, ctx, scope.variable(suffix), fn, seriesInputs, args))
                .expression((scope, port) -> fields.contains(port)
                        ? scope.variable(suffix) + "." + port
                        : scope.variable(suffix))
                .build());
    }

    /** DMI returns a tuple, so it binds three variables at once. */
    private static void registerDmi(NodeCatalog catalog) {
        List<Arg> args = List.of(Arg.ofInt("period", "Period", 14, 2, 200));
        List<String> lines = List.of("pdi", "mdi", "adx");
        NodeSpec.Builder b = base("indicator.dmi", "DMI", "Directional movement index: PDI, MDI and ADX", HLC, args);
        for (String l : lines)
            b.output(l, DataType.SERIES, l.toUpperCase());
        catalog.register(b
                .emitter((scope, ctx) -> {
                    String stem = scope.variable("dmi");
                    String target = stem + "_pdi, " + stem + "_mdi, " + stem + "_adx";
                    emitCall(scope, ctx, target, "DMI", HLC, args);
                })
                .expression((scope, port) -> scope.variable("dmi") + "_" + (lines.contains(port) ? port : "pdi"))
                .build());
    }

    private static String label(String port) {
        return LABELS.getOrDefault(port, port);
    }
}
