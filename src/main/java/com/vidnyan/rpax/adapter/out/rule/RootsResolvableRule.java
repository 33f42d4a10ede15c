package com.vidnyan.rpax.adapter.out.rule;

import com.vidnyan.rpax.domain.rule.RuleResult;
import com.vidnyan.rpax.domain.rule.ValidationContext;
import com.vidnyan.rpax.domain.rule.ValidationIssue;
import com.vidnyan.rpax.domain.rule.ValidationRule;
import com.vidnyan.rpax.domain.rule.ValidationStatus;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Each declared entry point must be a discovered workflow.
 */
@Component
@Order(50)
public class RootsResolvableRule implements ValidationRule {

    public static final String ID = "roots-resolvable";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean supports(ValidationContext context) {
        return context.project() != null;
    }

    @Override
    public RuleResult validate(ValidationContext context) {
        Instant start = Instant.now();
        List<String> declared = context.project().entryPointPaths();
        int resolved = context.callGraph().entryPoints().size();
        List<ValidationIssue> issues = new ArrayList<>();

        for (String path : declared) {
            boolean found = context.index().findByRelativePath(path).isPresent();
            if (!found) {
                issues.add(ValidationIssue.builder()
                        .ruleId(ID)
                        .status(ValidationStatus.FAIL)
                        .workflowId(path)
                        .message("Entry point " + path + " does not exist in the project")
                        .build());
            }
        }

        return RuleResult.completed(ID, issues,
                Map.of("entryPointsDeclared", declared.size(), "entryPointsResolved", resolved),
                Duration.between(start, Instant.now()));
    }
}
