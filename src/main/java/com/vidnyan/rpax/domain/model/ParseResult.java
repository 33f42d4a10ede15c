package com.vidnyan.rpax.domain.model;

import com.vidnyan.rpax.domain.invocation.InvocationRecord;

import java.util.List;

/**
 * Outcome of parsing one workflow file: either a document with its activity tree
 * or a structured error. Never thrown.
 */
public record ParseResult(
    String filePath,
    String workflowId,
    WorkflowDocument document,
    ActivityTree tree,
    List<InvocationRecord> invocations,
    boolean success,
    List<String> errors,
    List<String> warnings,
    long parseTimeMs,
    ParseDiagnostics diagnostics
) {

    public ParseResult {
        invocations = invocations == null ? List.of() : List.copyOf(invocations);
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Create a failed result for a file that produced no tree.
     */
    public static ParseResult failure(String filePath, String workflowId, String error,
                                      long parseTimeMs, ParseDiagnostics diagnostics) {
        return new ParseResult(filePath, workflowId, null, null, List.of(), false,
                List.of(error), List.of(), parseTimeMs, diagnostics);
    }

    public boolean hasTree() {
        return tree != null;
    }

    public int activityCount() {
        return tree == null ? 0 : tree.size();
    }
}
