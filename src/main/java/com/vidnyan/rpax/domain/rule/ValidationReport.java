package com.vidnyan.rpax.domain.rule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated verdict over all rules.
 */
public record ValidationReport(
    ValidationStatus status,
    List<RuleResult> results,
    Map<String, Integer> counters
) {

    public ValidationReport {
        results = List.copyOf(results);
        counters = counters == null ? Map.of() : Map.copyOf(counters);
    }

    public static ValidationReport of(List<RuleResult> results) {
        ValidationStatus status = results.stream()
                .map(RuleResult::status)
                .reduce(ValidationStatus.PASS, ValidationStatus::worst);
        Map<String, Integer> counters = new LinkedHashMap<>();
        for (RuleResult result : results) {
            result.counters().forEach((key, value) -> counters.merge(key, value, Integer::sum));
        }
        return new ValidationReport(status, results, counters);
    }

    public List<ValidationIssue> issues() {
        return results.stream().flatMap(r -> r.issues().stream()).toList();
    }

    public long count(ValidationStatus issueStatus) {
        return issues().stream().filter(i -> i.status() == issueStatus).count();
    }

    /**
     * Process exit code: 1 on FAIL, 0 otherwise.
     */
    public int exitCode() {
        return status == ValidationStatus.FAIL ? 1 : 0;
    }
}
