package com.vidnyan.rpax.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * All workflows discovered in one project, with scan bookkeeping.
 */
public record WorkflowIndex(
    String projectName,
    String projectRoot,
    String scanTimestamp,
    List<WorkflowEntry> workflows,
    List<String> excludedPatterns,
    List<String> excludedFiles
) {

    public WorkflowIndex {
        workflows = workflows == null ? List.of() : List.copyOf(workflows);
        excludedPatterns = excludedPatterns == null ? List.of() : List.copyOf(excludedPatterns);
        excludedFiles = excludedFiles == null ? List.of() : List.copyOf(excludedFiles);
    }

    public int totalWorkflows() {
        return workflows.size();
    }

    public int successfulParses() {
        return (int) workflows.stream().filter(WorkflowEntry::parseSuccessful).count();
    }

    public int failedParses() {
        return totalWorkflows() - successfulParses();
    }

    public Optional<WorkflowEntry> findByWorkflowId(String workflowId) {
        return workflows.stream()
                .filter(w -> w.workflowId().equals(workflowId))
                .findFirst();
    }

    public Optional<WorkflowEntry> findByRelativePath(String relativePath) {
        return workflows.stream()
                .filter(w -> w.relativePath().equalsIgnoreCase(relativePath))
                .findFirst();
    }
}
