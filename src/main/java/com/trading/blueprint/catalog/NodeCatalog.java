package com.trading.blueprint.catalog;

import com.trading.blueprint.api.NodeCategory;
import com.trading.blueprint.api.NodeSpec;
import com.trading.blueprint.model.BlueprintNode;
import com.trading.blueprint.model.Position;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of node variants keyed by type tag. Built-in variants are
 * registered on construction; each catalog instance is independent.
 */
public final class NodeCatalog {
    private final Map<String, NodeSpec> specs = new LinkedHashMap<>();

    public NodeCatalog() {
        registerBuiltIns();
    }

    // ── Built-in Families ────────────────────────────────────────

    private void registerBuiltIns() {
        DataNodes.register(this);
        IndicatorNodes.register(this);
        SignalNodes.register(this);
        LogicNodes.register(this);
        TradeNodes.register(this);
        ParamNodes.register(this);
    }

    /**
     * Adds a variant.
     *
     * @throws IllegalArgumentException if the type tag is already registered
     */
    public NodeCatalog register(NodeSpec spec) {
        if (specs.putIfAbsent(spec.type(), spec) != null)
            throw new IllegalArgumentException("Duplicate node type: " + spec.type());
        return this;
    }

    public boolean contains(String type) {
        return specs.containsKey(type);
    }

    /**
     * @throws IllegalArgumentException for an unknown type tag
     */
    public NodeSpec spec(String type) {
        NodeSpec spec = specs.get(type);
        if (spec == null)
            throw new IllegalArgumentException("Unknown node type: " + type);
        return spec;
    }

    /** New unattached node of {@code type}, parameters at their schema defaults. */
    public BlueprintNode create(String type, String id, Position position) {
        return new BlueprintNode(id, spec(type), position);
    }

    /** Categories that hold at least one variant, in palette order. */
    public List<NodeCategory> categories() {
        List<NodeCategory> result = new ArrayList<>();
        for (NodeCategory c : NodeCategory.values()) {
            if (!specsIn(c).isEmpty())
                result.add(c);
        }
        return result;
    }

    public List<NodeSpec> specsIn(NodeCategory category) {
        List<NodeSpec> result = new ArrayList<>();
        for (NodeSpec s : specs.values()) {
            if (s.category() == category)
                result.add(s);
        }
        return result;
    }

    public List<String> typesIn(NodeCategory category) {
        return specsIn(category).stream().map(NodeSpec::type).toList();
    }

    /** Every registered type tag, in registration order. */
    public List<String> types() {
        return List.copyOf(specs.keySet());
    }

    public List<NodeSpec> specs() {
        return List.copyOf(specs.values());
    }
}
