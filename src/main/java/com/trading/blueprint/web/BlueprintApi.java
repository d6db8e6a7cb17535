package com.trading.blueprint.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trading.blueprint.CompilerOptions;
import com.trading.blueprint.api.NodeCategory;
import com.trading.blueprint.api.NodeSpec;
import com.trading.blueprint.api.ParameterDefinition;
import com.trading.blueprint.api.PortDefinition;
import com.trading.blueprint.catalog.NodeCatalog;
import com.trading.blueprint.engine.CodeGenerator;
import com.trading.blueprint.engine.GraphAnalyzer;
import com.trading.blueprint.engine.ValidationResult;
import com.trading.blueprint.io.GraphSerializer;
import com.trading.blueprint.model.BlueprintGraph;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request handling behind {@link BlueprintServer}, kept free of HTTP types.
 *
 * <p>
 * Each call loads the request body into a fresh graph, so concurrent requests
 * share no mutable state.
 */
public final class BlueprintApi {
    private final CompilerOptions options;
    private final GraphSerializer serializer = new GraphSerializer();
    private final ObjectMapper mapper = new ObjectMapper();
    private final String catalogJson;

    public BlueprintApi(CompilerOptions options) {
        this.options = options;
        this.catalogJson = writeJson(describeCatalog(new NodeCatalog()));
    }

    /** Palette listing: categories in order, each with its node variants. */
    public String catalogJson() {
        return catalogJson;
    }

    /** {@code {"valid", "issues", "lookback"}} for the posted graph. */
    public String validateJson(String body) {
        GraphAnalyzer analyzer = new GraphAnalyzer(load(body));
        ValidationResult result = analyzer.validate();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("valid", result.valid());
        out.put("issues", result.issues());
        out.put("lookback", analyzer.requiredLookback());
        return writeJson(out);
    }

    public String generate(String body, String strategyName) {
        CodeGenerator generator = new CodeGenerator(load(body), options);
        return strategyName == null || strategyName.isBlank() ? generator.generate() : generator.generate(strategyName);
    }

    public String preview(String body) {
        return new CodeGenerator(load(body), options).generatePreview();
    }

    public String errorJson(String message) {
        return writeJson(Map.of("error", String.valueOf(message)));
    }

    private BlueprintGraph load(String body) {
        if (body == null || body.isBlank())
            return new BlueprintGraph();
        return serializer.fromJson(body);
    }

    static List<Map<String, Object>> describeCatalog(NodeCatalog catalog) {
        List<Map<String, Object>> categories = new ArrayList<>();
        for (NodeCategory category : catalog.categories()) {
            List<Map<String, Object>> nodes = new ArrayList<>();
            for (NodeSpec spec : catalog.specsIn(category))
                nodes.add(describe(spec));
            Map<String, Object> c = new LinkedHashMap<>();
            c.put("category", category.tag());
            c.put("title", category.title());
            c.put("nodes", nodes);
            categories.add(c);
        }
        return categories;
    }

    private static Map<String, Object> describe(NodeSpec spec) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", spec.type());
        m.put("title", spec.title());
        m.put("description", spec.description());
        m.put("inputs", spec.inputs().stream().map(BlueprintApi::describe).toList());
        m.put("outputs", spec.outputs().stream().map(BlueprintApi::describe).toList());
        List<Map<String, Object>> params = new ArrayList<>();
        for (ParameterDefinition p : spec.parameters().values()) {
            Map<String, Object> pm = new LinkedHashMap<>();
            pm.put("name", p.name());
            pm.put("kind", p.kind().name().toLowerCase());
            pm.put("label", p.label());
            pm.put("default", p.defaultValue());
            pm.put("min", p.min());
            pm.put("max", p.max());
            params.add(pm);
        }
        m.put("parameters", params);
        return m;
    }

    private static Map<String, Object> describe(PortDefinition port) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", port.name());
        m.put("label", port.label());
        m.put("type", port.dataType().name());
        m.put("color", port.dataType().color());
        if (port.isInput()) {
            m.put("required", port.required());
            m.put("multi_connect", port.multiConnect());
            m.put("default", port.defaultValue());
        }
        return m;
    }

    private String writeJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write response", e);
        }
    }
}
