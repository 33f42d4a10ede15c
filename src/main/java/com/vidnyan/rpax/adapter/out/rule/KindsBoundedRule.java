package com.vidnyan.rpax.adapter.out.rule;

import com.vidnyan.rpax.domain.invocation.InvocationKind;
import com.vidnyan.rpax.domain.invocation.InvocationRecord;
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
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Invocation kinds stay within the closed set.
 */
@Component
@Order(20)
public class KindsBoundedRule implements ValidationRule {

    public static final String ID = "kinds-bounded";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleResult validate(ValidationContext context) {
        Instant start = Instant.now();
        List<ValidationIssue> issues = new ArrayList<>();
        Map<InvocationKind, Integer> counts = new EnumMap<>(InvocationKind.class);

        for (InvocationRecord invocation : context.invocations()) {
            if (invocation.kind() == null) {
                issues.add(ValidationIssue.builder()
                        .ruleId(ID)
                        .status(ValidationStatus.FAIL)
                        .workflowId(invocation.from())
                        .message("Invocation to " + invocation.to() + " has no kind")
                        .build());
            } else {
                counts.merge(invocation.kind(), 1, Integer::sum);
            }
        }

        Map<String, Integer> counters = new LinkedHashMap<>();
        for (InvocationKind kind : InvocationKind.values()) {
            counters.put(kind.wireName(), counts.getOrDefault(kind, 0));
        }
        return RuleResult.completed(ID, issues, counters, Duration.between(start, Instant.now()));
    }
}
