package com.trading.blueprint.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Mutable accumulator for one generation pass: emitted statements in order,
 * the sorted import set and the ids of nodes that already emitted.
 */
public final class CodeGenContext {
    private final List<String> lines = new ArrayList<>();
    private final Set<String> imports = new TreeSet<>();
    private final Set<String> generated = new HashSet<>();

    /**
     * Appends one statement. It may span several lines separated by
     * {@code \n}, nested lines indented by four spaces per level.
     */
    public void addCode(String statement) {
        lines.add(statement);
    }

    public void addImport(String statement) {
        imports.add(statement);
    }

    public void markGenerated(String nodeId) {
        generated.add(nodeId);
    }

    public boolean isGenerated(String nodeId) {
        return generated.contains(nodeId);
    }

    public List<String> lines() {
        return Collections.unmodifiableList(lines);
    }

    /** Imports, sorted and de-duplicated. */
    public Set<String> imports() {
        return Collections.unmodifiableSet(imports);
    }

    public int generatedCount() {
        return generated.size();
    }
}
