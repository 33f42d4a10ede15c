package com.vidnyan.rpax.domain.rule;

/**
 * A check run against a built call graph.
 */
public interface ValidationRule {

    /**
     * Stable identifier used in reports.
     */
    String id();

    /**
     * Check if this rule applies to the given context.
     */
    default boolean supports(ValidationContext context) {
        return true;
    }

    RuleResult validate(ValidationContext context);

    /**
     * Get the rule name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
