package com.vidnyan.hint.domain.rule;

import com.vidnyan.hint.domain.lint.LintConfig;

import java.util.List;

/**
 * The ordered set of rule evaluators. Problems of a file are reported in this order.
 */
public final class RuleRegistry {

    private final List<RuleEvaluator> evaluators;

    public RuleRegistry(List<RuleEvaluator> evaluators) {
        this.evaluators = List.copyOf(evaluators);
    }

    public List<RuleEvaluator> evaluators() {
        return evaluators;
    }

    public List<RuleEvaluator> enabled(LintConfig config) {
        return evaluators.stream()
                .filter(e -> e.isEnabled(config))
                .toList();
    }
}
