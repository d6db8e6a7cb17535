package com.trading.blueprint.engine;

import com.trading.blueprint.CompilerOptions;
import com.trading.blueprint.model.BlueprintGraph;
import com.trading.blueprint.model.BlueprintNode;
import com.trading.blueprint.model.Connection;
import com.trading.blueprint.model.NodeScope;
import com.trading.blueprint.util.PythonLiterals;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import lombok.extern.log4j.Log4j2;

/**
 * Lowers a blueprint into the source of a strategy class with a single
 * {@code on_bar(self, bar)} callback.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>Validate; a graph with issues yields a diagnostic docstring.</li>
 * <li>Order the nodes; a cycle yields a diagnostic docstring.</li>
 * <li>Walk the order. Before a node emits, every producer wired into it emits
 * first, depth-first; each node emits once.</li>
 * <li>Assemble header, imports, class, parameter block, history guard and the
 * emitted statements.</li>
 * </ol>
 *
 * <p>
 * Every call starts from a fresh {@link CodeGenContext}, so an unchanged graph
 * always produces identical text. Failures never escape {@link #generate}:
 * they come back as a diagnostic artifact with no executable body.
 */
@Log4j2
public final class CodeGenerator {
    public static final String EMPTY_PREVIEW = "# Add nodes to the canvas and connect them to generate a strategy";

    private final BlueprintGraph graph;
    private final GraphAnalyzer analyzer;
    private final CompilerOptions options;

    public CodeGenerator(BlueprintGraph graph) {
        this(graph, CompilerOptions.defaults());
    }

    public CodeGenerator(BlueprintGraph graph, CompilerOptions options) {
        this.graph = graph;
        this.analyzer = new GraphAnalyzer(graph);
        this.options = options;
    }

    public String generate() {
        return generate(options.getStrategyName());
    }

    public String generate(String strategyName) {
        String name = className(strategyName);
        try {
            ValidationResult validation = analyzer.validate();
            if (!validation.valid()) {
                log.warn("Generation of {} blocked by {} validation issue(s)", name, validation.issues().size());
                return diagnostic(name + ": blueprint validation failed", validation.issues());
            }

            List<BlueprintNode> order;
            try {
                order = analyzer.executionOrder();
            } catch (CycleDetectedException e) {
                log.warn("Generation of {} blocked: {}", name, e.getMessage());
                return diagnostic(name + ": no execution order", List.of(e.getMessage()));
            }

            CodeGenContext ctx = new CodeGenContext();
            for (BlueprintNode node : order)
                generateNode(node, ctx);
            String source = assemble(name, ctx);
            log.debug("Generated {}: {} node(s), {} statement(s), {} import(s)",
                    name, ctx.generatedCount(), ctx.lines().size(), ctx.imports().size());
            return source;
        } catch (RuntimeException e) {
            log.warn("Generation of {} failed", name, e);
            return diagnostic(name + ": code generation failed", List.of(String.valueOf(e.getMessage())));
        }
    }

    /** Live-preview text: a placeholder for an empty graph, otherwise {@link #generate()}. */
    public String generatePreview() {
        if (graph.isEmpty())
            return EMPTY_PREVIEW;
        return generate();
    }

    private void generateNode(BlueprintNode node, CodeGenContext ctx) {
        if (ctx.isGenerated(node.id()))
            return;
        ctx.markGenerated(node.id());
        for (Connection c : graph.incomingConnections(node.id()))
            generateNode(graph.requireNode(c.source().nodeId()), ctx);
        node.spec().emitter().emit(new NodeScope(graph, node), ctx);
    }

    private String assemble(String name, CodeGenContext ctx) {
        String i1 = options.getIndent();
        String i2 = i1 + i1;
        List<String> lines = new ArrayList<>();

        lines.add("\"\"\"");
        lines.add(name);
        lines.add("Generated from a visual strategy blueprint");
        lines.add("\"\"\"");
        lines.add(options.getBaseImport());
        for (String imp : ctx.imports()) {
            if (!imp.equals(options.getBaseImport()))
                lines.add(imp);
        }
        lines.add("");
        lines.add("");

        lines.add("class " + name + "(" + options.getBaseClass() + "):");
        lines.add(i1 + "\"\"\"" + name + "\"\"\"");
        lines.add("");

        Map<String, Object> params = collectParameters();
        if (!params.isEmpty()) {
            lines.add(i1 + "# Strategy parameters");
            for (Map.Entry<String, Object> e : params.entrySet())
                lines.add(i1 + e.getKey() + " = " + PythonLiterals.repr(e.getValue()));
            lines.add("");
        }

        lines.add(i1 + "def on_bar(self, bar):");
        lines.add(i2 + "\"\"\"Per-bar callback\"\"\"");
        int lookback = analyzer.requiredLookback();
        if (lookback > 1) {
            lines.add(i2 + "# Wait for enough history");
            lines.add(i2 + "if len(self.get_close_prices(" + lookback + ")) < " + lookback + ":");
            lines.add(i2 + i1 + "return");
            lines.add("");
        }

        if (ctx.lines().isEmpty()) {
            lines.add(i2 + "pass");
        } else {
            for (String statement : ctx.lines()) {
                for (String line : statement.split("\n", -1))
                    lines.add(i2 + reindent(line, i1));
            }
        }
        lines.add("");
        return String.join("\n", lines);
    }

    /** Maps the four-space nesting emitters write to the configured indent. */
    private static String reindent(String line, String indent) {
        int n = 0;
        while (n < line.length() && line.charAt(n) == ' ')
            n++;
        if (n == 0 || indent.equals("    "))
            return line;
        return indent.repeat(n / 4) + " ".repeat(n % 4) + line.substring(n);
    }

    /**
     * One class attribute per node parameter, named
     * {@code <last type segment>_<key>}. A later node that would reuse a name
     * with a different value gets {@code _<nodeId>} appended instead.
     */
    Map<String, Object> collectParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        for (BlueprintNode node : graph.nodes()) {
            String type = node.type();
            String prefix = type.substring(type.lastIndexOf('.') + 1);
            for (Map.Entry<String, Object> e : node.parameters().entrySet()) {
                String key = identifier(prefix + "_" + e.getKey());
                if (params.containsKey(key) && !Objects.equals(params.get(key), e.getValue()))
                    key = identifier(key + "_" + node.id());
                params.putIfAbsent(key, e.getValue());
            }
        }
        return params;
    }

    private static String diagnostic(String title, List<String> issues) {
        StringBuilder sb = new StringBuilder(128).append("\"\"\"\n").append(title).append('\n');
        for (String issue : issues)
            sb.append("# Error: ").append(issue.replace("\"\"\"", "'''")).append('\n');
        return sb.append("\"\"\"").toString();
    }

    /** Sanitises a requested class name into an identifier. */
    static String className(String requested) {
        if (requested == null || requested.isBlank())
            return CompilerOptions.defaults().getStrategyName();
        return identifier(requested.trim());
    }

    private static String identifier(String s) {
        String id = s.replaceAll("[^a-zA-Z0-9_]", "_");
        return Character.isDigit(id.charAt(0)) ? "_" + id : id;
    }
}
