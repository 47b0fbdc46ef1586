package com.vidnyan.hint.domain.rule;

import com.vidnyan.hint.domain.lint.FileContext;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.ProblemCollector;

/**
 * Interface for rule evaluators.
 * Each evaluator checks one group of conventions and is independent of every other evaluator.
 */
public interface RuleEvaluator {

    /**
     * Check if the rule group is switched on in the given configuration.
     */
    boolean isEnabled(LintConfig config);

    /**
     * Evaluate the rule against one file, reporting findings to the collector.
     * Constructs the rule cannot judge are skipped silently.
     */
    void evaluate(FileContext file, ProblemCollector problems);

    /**
     * Get the evaluator name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
