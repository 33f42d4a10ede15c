package com.vidnyan.rpax.domain.model;

import java.util.List;

/**
 * Index entry for one discovered workflow file.
 */
public record WorkflowEntry(
    String id,
    String projectSlug,
    String workflowId,
    String contentHash,
    String relativePath,
    String fileName,
    String displayName,
    String description,
    long fileSize,
    String lastModified,
    String expressionLanguage,
    int totalActivities,
    int totalArguments,
    int totalVariables,
    boolean parseSuccessful,
    List<String> parseErrors
) {

    public WorkflowEntry {
        parseErrors = parseErrors == null ? List.of() : List.copyOf(parseErrors);
    }
}
