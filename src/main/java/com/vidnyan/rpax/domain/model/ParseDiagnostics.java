package com.vidnyan.rpax.domain.model;

import java.util.List;

/**
 * Counters and trace collected while parsing one file.
 */
public record ParseDiagnostics(
    int elementsProcessed,
    int activitiesFound,
    int argumentsFound,
    int variablesFound,
    int expressionsFound,
    int annotationsFound,
    int namespacesDetected,
    int skippedElements,
    int xmlDepth,
    long fileSizeBytes,
    String rootElementTag,
    List<String> processingSteps
) {

    public ParseDiagnostics {
        processingSteps = processingSteps == null ? List.of() : List.copyOf(processingSteps);
    }

    public static ParseDiagnostics empty(long fileSizeBytes, List<String> steps) {
        return new ParseDiagnostics(0, 0, 0, 0, 0, 0, 0, 0, 0, fileSizeBytes, null, steps);
    }
}
