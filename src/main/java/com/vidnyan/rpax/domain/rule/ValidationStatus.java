package com.vidnyan.rpax.domain.rule;

/**
 * Verdict of a validation rule, ordered from best to worst.
 */
public enum ValidationStatus {
    PASS,
    WARN,
    FAIL;

    public ValidationStatus worst(ValidationStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }

    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
