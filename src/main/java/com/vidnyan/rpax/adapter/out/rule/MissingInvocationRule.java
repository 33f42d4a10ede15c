package com.vidnyan.rpax.adapter.out.rule;

import com.vidnyan.rpax.domain.graph.InvocationEdge;
import com.vidnyan.rpax.domain.invocation.InvocationKind;
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
 * Invocations whose target file does not exist.
 */
@Component
@Order(60)
public class MissingInvocationRule implements ValidationRule {

    public static final String ID = "missing-invocation";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleResult validate(ValidationContext context) {
        Instant start = Instant.now();
        ValidationStatus status = context.failOnMissing() ? ValidationStatus.FAIL : ValidationStatus.WARN;
        List<InvocationEdge> missing = context.callGraph().edgesOfKind(InvocationKind.MISSING);
        List<ValidationIssue> issues = new ArrayList<>();

        for (InvocationEdge edge : missing) {
            issues.add(ValidationIssue.builder()
                    .ruleId(ID)
                    .status(status)
                    .workflowId(edge.sourceId())
                    .message(String.format("%s invokes missing workflow %s", edge.sourceId(), edge.targetPath()))
                    .context(edge.nodeId() != null ? Map.of("nodeId", edge.nodeId()) : Map.of())
                    .build());
        }

        return RuleResult.completed(ID, issues, Map.of("missingInvocations", missing.size()),
                Duration.between(start, Instant.now()));
    }
}
