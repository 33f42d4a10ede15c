package com.vidnyan.rpax.adapter.out.rule;

import com.vidnyan.rpax.domain.graph.CallGraph;
import com.vidnyan.rpax.domain.graph.Cycle;
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
 * Reports workflows that invoke each other in a loop.
 */
@Slf4j
@Component
@Order(40)
public class CycleDetectionRule implements ValidationRule {

    public static final String ID = "cycle-detection";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleResult validate(ValidationContext context) {
        Instant start = Instant.now();
        ValidationStatus status = context.failOnCycles() ? ValidationStatus.FAIL : ValidationStatus.WARN;
        List<ValidationIssue> issues = new ArrayList<>();

        for (Cycle cycle : context.callGraph().cycles()) {
            List<String> chain = new ArrayList<>(cycle.workflowIds());
            chain.add(cycle.workflowIds().get(0));
            issues.add(ValidationIssue.builder()
                    .ruleId(ID)
                    .status(status)
                    .workflowId(cycle.workflowIds().get(0))
                    .message(String.format("Invocation cycle %s (%s): %s",
                            cycle.id(), cycle.cycleType().wireName(), CallGraph.formatCycle(chain)))
                    .chain(chain)
                    .context(Map.of("cycleLength", cycle.length()))
                    .build());
        }

        log.debug("Found {} invocation cycles", issues.size());
        return RuleResult.completed(ID, issues,
                Map.of("cycles", context.callGraph().cycles().size()),
                Duration.between(start, Instant.now()));
    }
}
