package com.vidnyan.rpax.adapter.out.rule;

import com.vidnyan.rpax.domain.invocation.InvocationRecord;
import com.vidnyan.rpax.domain.rule.RuleResult;
import com.vidnyan.rpax.domain.rule.ValidationContext;
import com.vidnyan.rpax.domain.rule.ValidationRule;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Informational: how many invocations pass arguments.
 */
@Component
@Order(30)
public class ArgumentsPresenceRule implements ValidationRule {

    public static final String ID = "arguments-presence";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleResult validate(ValidationContext context) {
        Instant start = Instant.now();
        int withArguments = (int) context.invocations().stream().filter(InvocationRecord::hasArguments).count();

        Map<String, Integer> counters = new LinkedHashMap<>();
        counters.put("invocationsWithArguments", withArguments);
        counters.put("invocationsWithoutArguments", context.invocations().size() - withArguments);
        return RuleResult.completed(ID, List.of(), counters, Duration.between(start, Instant.now()));
    }
}
