package com.vidnyan.rpax.domain.rule;

import java.util.List;
import java.util.Map;

/**
 * A finding reported by a validation rule.
 * Immutable value object.
 */
public record ValidationIssue(
    String ruleId,
    ValidationStatus status,
    String message,
    String workflowId,
    List<String> chain,
    Map<String, Object> context
) {

    /**
     * Format the workflow chain for display.
     */
    public String formattedChain() {
        if (chain == null || chain.isEmpty()) {
            return "";
        }
        return String.join(" → ", chain);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String ruleId;
        private ValidationStatus status = ValidationStatus.FAIL;
        private String message;
        private String workflowId;
        private List<String> chain = List.of();
        private Map<String, Object> context = Map.of();

        public Builder ruleId(String id) { this.ruleId = id; return this; }
        public Builder status(ValidationStatus status) { this.status = status; return this; }
        public Builder message(String msg) { this.message = msg; return this; }
        public Builder workflowId(String id) { this.workflowId = id; return this; }
        public Builder chain(List<String> chain) { this.chain = chain; return this; }
        public Builder context(Map<String, Object> ctx) { this.context = ctx; return this; }

        public ValidationIssue build() {
            return new ValidationIssue(ruleId, status, message, workflowId, chain, context);
        }
    }
}
