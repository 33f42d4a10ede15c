package com.vidnyan.rpax.domain.explain;

import com.vidnyan.rpax.domain.model.WorkflowArgument;

import java.util.List;
import java.util.Map;

/**
 * Summary of one workflow's role in its project: contract, callees, callers and classification.
 */
public record WorkflowExplanation(
    String workflowId,
    String displayName,
    String relativePath,
    String projectName,
    long fileSize,
    String lastModified,
    boolean parseSuccessful,
    List<String> parseErrors,
    List<WorkflowArgument> arguments,
    List<Callee> invokes,
    List<Caller> calledBy,
    boolean entryPoint,
    boolean orphan,
    boolean test,
    String folderCategory,
    int callDepth
) {

    public record Callee(String target, String targetId, String kind, Map<String, String> arguments) {}

    public record Caller(String workflowId, String kind, Map<String, String> arguments) {}

    public enum Complexity {
        SIMPLE("Simple"),
        MODERATE("Moderate"),
        COMPLEX("Complex"),
        VERY_COMPLEX("Very Complex");

        private final String label;

        Complexity(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public WorkflowExplanation {
        parseErrors = parseErrors == null ? List.of() : List.copyOf(parseErrors);
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        invokes = invokes == null ? List.of() : List.copyOf(invokes);
        calledBy = calledBy == null ? List.of() : List.copyOf(calledBy);
    }

    public int totalInvocations() {
        return invokes.size();
    }

    public int uniqueDependencies() {
        return (int) invokes.stream().map(Callee::target).distinct().count();
    }

    /**
     * Called from more than one place.
     */
    public boolean reusable() {
        return calledBy.size() > 1;
    }

    public Complexity complexity() {
        int total = totalInvocations();
        if (total == 0) {
            return Complexity.SIMPLE;
        }
        if (total <= 3) {
            return Complexity.MODERATE;
        }
        return total <= 8 ? Complexity.COMPLEX : Complexity.VERY_COMPLEX;
    }
}
