package com.trading.blueprint.model;

import com.trading.blueprint.api.NodeSpec;
import com.trading.blueprint.api.PortDefinition;
import com.trading.blueprint.api.PortDirection;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One placed block of a blueprint.
 *
 * <p>
 * The type and port layout are fixed by the {@link NodeSpec} the node was
 * created from. Parameters and position are mutable, but parameter writes go
 * through {@link BlueprintGraph#setParameter} so listeners see them.
 */
public final class BlueprintNode {
    /** Parameter key prefix for a literal typed directly into an input port. */
    public static final String INPUT_OVERRIDE_PREFIX = "_input_";

    private final String id;
    private final NodeSpec spec;
    private final Map<String, Port> inputs = new LinkedHashMap<>();
    private final Map<String, Port> outputs = new LinkedHashMap<>();
    private final Map<String, Object> parameters;
    private Position position;

    public BlueprintNode(String id, NodeSpec spec, Position position) {
        this.id = id;
        this.spec = spec;
        this.position = position == null ? Position.ORIGIN : position;
        this.parameters = spec.defaultParameters();
        for (PortDefinition def : spec.inputs())
            inputs.put(def.name(), new Port(id, def));
        for (PortDefinition def : spec.outputs())
            outputs.put(def.name(), new Port(id, def));
    }

    public String id() {
        return id;
    }

    public String type() {
        return spec.type();
    }

    public String title() {
        return spec.title();
    }

    public NodeSpec spec() {
        return spec;
    }

    public Position position() {
        return position;
    }

    void setPosition(Position position) {
        this.position = position == null ? Position.ORIGIN : position;
    }

    public Port input(String name) {
        return inputs.get(name);
    }

    public Port output(String name) {
        return outputs.get(name);
    }

    public Port port(PortDirection direction, String name) {
        return direction == PortDirection.INPUT ? inputs.get(name) : outputs.get(name);
    }

    public List<Port> inputs() {
        return List.copyOf(inputs.values());
    }

    public List<Port> outputs() {
        return List.copyOf(outputs.values());
    }

    /** All ports, inputs first. */
    public List<Port> ports() {
        List<Port> all = new ArrayList<>(inputs.size() + outputs.size());
        all.addAll(inputs.values());
        all.addAll(outputs.values());
        return all;
    }

    public Map<String, Object> parameters() {
        return Collections.unmodifiableMap(parameters);
    }

    public Object parameter(String key) {
        return parameters.get(key);
    }

    public boolean hasParameter(String key) {
        return parameters.containsKey(key);
    }

    void putParameter(String key, Object value) {
        parameters.put(key, value);
    }

    void removeParameter(String key) {
        parameters.remove(key);
    }

    void replaceParameters(Map<String, Object> values) {
        parameters.clear();
        parameters.putAll(values);
    }

    /**
     * Identifier for a value this node binds in generated code,
     * {@code _<type>_<id>[_<suffix>]} with non-identifier characters replaced.
     */
    public String variableName(String suffix) {
        String base = "_" + spec.type().replace('.', '_') + "_" + id;
        if (suffix != null && !suffix.isEmpty())
            base = base + "_" + suffix;
        return base.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    @Override
    public String toString() {
        return spec.type() + "#" + id;
    }
}
