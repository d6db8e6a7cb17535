package com.trading.blueprint.model;

import com.trading.blueprint.util.PythonLiterals;

/**
 * A node seen from inside its graph, handed to the node's emission and
 * output-expression hooks.
 *
 * <p>
 * Resolves what each input port stands for in generated code:
 * <ol>
 * <li>the producer's output expression, if the port is wired;</li>
 * <li>else the {@code _input_<port>} override parameter;</li>
 * <li>else the parameter named like the port;</li>
 * <li>else the port's declared default;</li>
 * <li>else nothing ({@code null}).</li>
 * </ol>
 */
public record NodeScope(BlueprintGraph graph, BlueprintNode node) {

    public String nodeId() {
        return node.id();
    }

    /** Expression feeding {@code port}, or {@code null} if nothing does. */
    public String inputValue(String port) {
        Port in = node.input(port);
        if (in == null)
            return null;
        if (in.isConnected()) {
            Connection c = graph.connection(in.connectionIds().get(0));
            BlueprintNode producer = graph.requireNode(c.source().nodeId());
            return producer.spec().outputExpression()
                    .expression(new NodeScope(graph, producer), c.source().port());
        }
        return literalInput(in);
    }

    /** {@link #inputValue(String)}, or {@code fallback} when that is absent. */
    public String inputOr(String port, String fallback) {
        String v = inputValue(port);
        return v == null ? fallback : v;
    }

    /**
     * Whether {@code port} resolves to something without following its
     * connections: wired, overridden, parameterised or defaulted.
     */
    public boolean isSatisfied(String port) {
        Port in = node.input(port);
        return in != null && (in.isConnected() || literalInput(in) != null);
    }

    private String literalInput(Port in) {
        String key = in.name();
        Object override = node.parameter(BlueprintNode.INPUT_OVERRIDE_PREFIX + key);
        if (override != null)
            return PythonLiterals.text(override);
        Object param = node.parameter(key);
        if (param != null)
            return PythonLiterals.text(param);
        Object def = in.definition().defaultValue();
        return def == null ? null : PythonLiterals.text(def);
    }

    /** Parameter rendered as expression text, or {@code fallback} if unset. */
    public String parameterText(String key, Object fallback) {
        Object v = node.parameter(key);
        return PythonLiterals.text(v == null ? fallback : v);
    }

    public String variable(String suffix) {
        return node.variableName(suffix);
    }

    /** This node's own expression for one of its outputs. */
    public String outputExpression(String port) {
        return node.spec().outputExpression().expression(this, port);
    }
}
