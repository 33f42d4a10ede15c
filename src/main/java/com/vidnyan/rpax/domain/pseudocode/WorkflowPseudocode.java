package com.vidnyan.rpax.domain.pseudocode;

import java.util.List;

/**
 * Readable outline of one workflow's activity tree, optionally expanded
 * through the workflows it invokes.
 */
public record WorkflowPseudocode(
    String workflowId,
    List<PseudocodeEntry> entries,
    int activityCount,
    List<String> expandedLines,
    String error
) {

    public WorkflowPseudocode {
        entries = entries == null ? List.of() : List.copyOf(entries);
        expandedLines = expandedLines == null ? List.of() : List.copyOf(expandedLines);
    }

    /**
     * Placeholder for a workflow without a tree.
     */
    public static WorkflowPseudocode failed(String workflowId, String error) {
        return new WorkflowPseudocode(workflowId, List.of(), 0, List.of(), error);
    }

    public WorkflowPseudocode withExpansion(List<String> lines) {
        return new WorkflowPseudocode(workflowId, entries, activityCount, lines, error);
    }

    public List<String> lines() {
        return entries.stream().map(PseudocodeEntry::formattedLine).toList();
    }

    public int totalLines() {
        return entries.size();
    }

    public boolean hasError() {
        return error != null;
    }

    public String renderText() {
        if (entries.isEmpty()) {
            return "# No pseudocode available for " + workflowId;
        }
        return String.join("\n", lines());
    }
}
