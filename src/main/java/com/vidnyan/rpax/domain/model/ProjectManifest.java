package com.vidnyan.rpax.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Project-level summary written next to the other artifacts: identity, declared entry points,
 * discovery totals, the configuration the run used and where each artifact lives.
 */
public record ProjectManifest(
    String projectName,
    String projectId,
    String projectSlug,
    String projectType,
    String projectRoot,
    String schemaVersion,
    Instant generatedAt,
    String mainWorkflow,
    String description,
    String expressionLanguage,
    List<ProjectDescriptor.EntryPoint> entryPoints,
    Map<String, String> dependencies,
    int totalWorkflows,
    int totalInvocations,
    int parseErrors,
    Map<String, Object> scanConfig,
    Map<String, Object> validationConfig,
    Map<String, String> artifacts
) {

    public static final String SCHEMA_VERSION = "1.0";

    public ProjectManifest {
        entryPoints = entryPoints == null ? List.of() : List.copyOf(entryPoints);
        dependencies = copy(dependencies);
        scanConfig = copy(scanConfig);
        validationConfig = copy(validationConfig);
        artifacts = copy(artifacts);
    }

    public static ProjectManifest of(ProjectDescriptor project, String projectRoot, WorkflowIndex index,
                                     int totalInvocations, Instant generatedAt, Map<String, Object> scanConfig,
                                     Map<String, Object> validationConfig, Map<String, String> artifacts) {
        return new ProjectManifest(
                project.name(),
                project.effectiveProjectId(),
                project.slug(),
                project.outputType(),
                projectRoot,
                SCHEMA_VERSION,
                generatedAt,
                project.main(),
                project.description(),
                project.expressionLanguage(),
                project.entryPoints(),
                project.dependencies(),
                index.totalWorkflows(),
                totalInvocations,
                index.failedParses(),
                scanConfig,
                validationConfig,
                artifacts);
    }

    /**
     * Share of discovered workflows that parsed; 1.0 for an empty project.
     */
    public double successRate() {
        return totalWorkflows == 0 ? 1.0 : (double) (totalWorkflows - parseErrors) / totalWorkflows;
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
