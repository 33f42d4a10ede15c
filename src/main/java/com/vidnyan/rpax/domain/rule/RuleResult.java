package com.vidnyan.rpax.domain.rule;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Result of running one validation rule.
 */
public record RuleResult(
    String ruleId,
    ValidationStatus status,
    List<ValidationIssue> issues,
    Map<String, Integer> counters,
    Duration executionTime,
    ExecutionStatus execution,
    String errorMessage
) {

    public enum ExecutionStatus {
        SUCCESS,
        ERROR,
        SKIPPED
    }

    public RuleResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
        counters = counters == null ? Map.of() : Map.copyOf(counters);
    }

    /**
     * Create a completed result; the status is the worst issue status, PASS when there are none.
     */
    public static RuleResult completed(String ruleId, List<ValidationIssue> issues,
                                       Map<String, Integer> counters, Duration duration) {
        ValidationStatus status = issues.stream()
                .map(ValidationIssue::status)
                .reduce(ValidationStatus.PASS, ValidationStatus::worst);
        return new RuleResult(ruleId, status, issues, counters, duration, ExecutionStatus.SUCCESS, null);
    }

    /**
     * Create an error result. A rule that could not run fails the report.
     */
    public static RuleResult error(String ruleId, String message) {
        return new RuleResult(ruleId, ValidationStatus.FAIL, List.of(), Map.of(), Duration.ZERO,
                ExecutionStatus.ERROR, message);
    }

    public static RuleResult skipped(String ruleId, String reason) {
        return new RuleResult(ruleId, ValidationStatus.PASS, List.of(), Map.of(), Duration.ZERO,
                ExecutionStatus.SKIPPED, reason);
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    public int issueCount() {
        return issues.size();
    }
}
