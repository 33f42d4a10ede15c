package com.vidnyan.rpax.adapter.out.rule;

import com.vidnyan.rpax.domain.graph.InvocationEdge;
import com.vidnyan.rpax.domain.invocation.InvocationRecord;
import com.vidnyan.rpax.domain.rule.RuleResult;
import com.vidnyan.rpax.domain.rule.ValidationContext;
import com.vidnyan.rpax.domain.rule.ValidationIssue;
import com.vidnyan.rpax.domain.rule.ValidationRule;
import com.vidnyan.rpax.domain.rule.ValidationStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Every invocation must start at an indexed workflow; resolved targets must be indexed too.
 */
@Slf4j
@Component
@Order(10)
public class ReferentialIntegrityRule implements ValidationRule {

    public static final String ID = "referential-integrity";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleResult validate(ValidationContext context) {
        Instant start = Instant.now();
        List<ValidationIssue> issues = new ArrayList<>();

        for (InvocationRecord invocation : context.invocations()) {
            if (!context.isKnownWorkflow(invocation.from())) {
                issues.add(ValidationIssue.builder()
                        .ruleId(ID)
                        .status(ValidationStatus.FAIL)
                        .workflowId(invocation.from())
                        .message(String.format("Invocation source %s is not a discovered workflow", invocation.from()))
                        .context(Map.of("to", invocation.to()))
                        .build());
            }
        }

        for (InvocationEdge edge : context.callGraph().edges()) {
            if (edge.isResolved() && !context.isKnownWorkflow(edge.targetId())) {
                issues.add(ValidationIssue.builder()
                        .ruleId(ID)
                        .status(ValidationStatus.WARN)
                        .workflowId(edge.sourceId())
                        .message(String.format("Resolved target %s is not in the workflow index", edge.targetId()))
                        .chain(List.of(edge.sourceId(), edge.targetId()))
                        .build());
            }
        }

        log.debug("Referential integrity: {} issues", issues.size());
        return RuleResult.completed(ID, issues,
                Map.of("invocationsChecked", context.invocations().size()),
                Duration.between(start, Instant.now()));
    }
}
