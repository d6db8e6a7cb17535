package com.trading.blueprint.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node variant: type tag, port layout, parameter schema and the two code
 * generation hooks.
 *
 * <p>
 * Specs are immutable and shared by every node instance of the variant. Build
 * them with {@link #builder(String, NodeCategory)}.
 */
public final class NodeSpec {
    private final String type;
    private final NodeCategory category;
    private final String title;
    private final String description;
    private final List<PortDefinition> inputs;
    private final List<PortDefinition> outputs;
    private final Map<String, ParameterDefinition> parameters;
    private final Emitter emitter;
    private final OutputExpression outputExpression;

    private NodeSpec(Builder b) {
        this.type = b.type;
        this.category = b.category;
        this.title = b.title == null ? b.type : b.title;
        this.description = b.description == null ? "" : b.description;
        this.inputs = List.copyOf(b.inputs);
        this.outputs = List.copyOf(b.outputs);
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(b.parameters));
        this.emitter = b.emitter;
        this.outputExpression = b.outputExpression;
    }

    public String type() {
        return type;
    }

    public NodeCategory category() {
        return category;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public List<PortDefinition> inputs() {
        return inputs;
    }

    public List<PortDefinition> outputs() {
        return outputs;
    }

    /** Parameter schema keyed by parameter name, in declaration order. */
    public Map<String, ParameterDefinition> parameters() {
        return parameters;
    }

    public ParameterDefinition parameter(String name) {
        return parameters.get(name);
    }

    /** Fresh map of schema defaults for a newly created node. */
    public Map<String, Object> defaultParameters() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        for (ParameterDefinition p : parameters.values())
            defaults.put(p.name(), p.defaultValue());
        return defaults;
    }

    public Emitter emitter() {
        return emitter;
    }

    public OutputExpression outputExpression() {
        return outputExpression;
    }

    @Override
    public String toString() {
        return "NodeSpec[" + type + "]";
    }

    public static Builder builder(String type, NodeCategory category) {
        return new Builder(type, category);
    }

    public static final class Builder {
        private final String type;
        private final NodeCategory category;
        private String title;
        private String description;
        private final List<PortDefinition> inputs = new ArrayList<>();
        private final List<PortDefinition> outputs = new ArrayList<>();
        private final Map<String, ParameterDefinition> parameters = new LinkedHashMap<>();
        private Emitter emitter = Emitter.NONE;
        private OutputExpression outputExpression = OutputExpression.NONE;

        private Builder(String type, NodeCategory category) {
            if (type == null || type.isBlank())
                throw new IllegalArgumentException("Node type must not be blank");
            if (category == null)
                throw new IllegalArgumentException("Node type '" + type + "' needs a category");
            this.type = type;
            this.category = category;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder port(PortDefinition port) {
            List<PortDefinition> side = port.isInput() ? inputs : outputs;
            for (PortDefinition existing : side) {
                if (existing.name().equals(port.name()))
                    throw new IllegalArgumentException(
                            "Duplicate " + port.direction() + " port '" + port.name() + "' on " + type);
            }
            side.add(port);
            return this;
        }

        public Builder input(String name, DataType dataType, String label) {
            return port(PortDefinition.input(name, dataType, label));
        }

        public Builder optionalInput(String name, DataType dataType, String label, Object defaultValue) {
            return port(PortDefinition.optionalInput(name, dataType, label, defaultValue));
        }

        public Builder output(String name, DataType dataType, String label) {
            return port(PortDefinition.output(name, dataType, label));
        }

        public Builder parameter(ParameterDefinition parameter) {
            if (parameters.putIfAbsent(parameter.name(), parameter) != null)
                throw new IllegalArgumentException("Duplicate parameter '" + parameter.name() + "' on " + type);
            return this;
        }

        public Builder emitter(Emitter emitter) {
            this.emitter = emitter == null ? Emitter.NONE : emitter;
            return this;
        }

        public Builder expression(OutputExpression expression) {
            this.outputExpression = expression == null ? OutputExpression.NONE : expression;
            return this;
        }

        public NodeSpec build() {
            return new NodeSpec(this);
        }
    }
}
