package com.vidnyan.rpax.domain.graph;

/**
 * Aggregate figures of a call graph.
 */
public record CallGraphMetrics(
    int totalWorkflows,
    int totalDependencies,
    int entryPoints,
    int orphanedWorkflows,
    int maxCallDepth,
    int cyclesDetected,
    int staticInvocations,
    int dynamicInvocations,
    int missingInvocations,
    int codedInvocations
) {}
