package com.trading.blueprint.engine;

import java.util.List;

/**
 * Outcome of {@link GraphAnalyzer#validate()}: valid iff there are no issues.
 */
public record ValidationResult(boolean valid, List<String> issues) {

    public ValidationResult {
        issues = List.copyOf(issues);
    }

    public static ValidationResult of(List<String> issues) {
        return new ValidationResult(issues.isEmpty(), issues);
    }
}
