package com.vidnyan.rpax.adapter.out.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.rpax.application.port.out.ArtifactWriter;
import com.vidnyan.rpax.domain.graph.CallGraph;
import com.vidnyan.rpax.domain.graph.CallGraphMetrics;
import com.vidnyan.rpax.domain.graph.Cycle;
import com.vidnyan.rpax.domain.graph.InvocationEdge;
import com.vidnyan.rpax.domain.graph.WorkflowNode;
import com.vidnyan.rpax.domain.invocation.InvocationKind;
import com.vidnyan.rpax.domain.invocation.InvocationRecord;
import com.vidnyan.rpax.domain.model.WorkflowEntry;
import com.vidnyan.rpax.domain.model.WorkflowIndex;
import com.vidnyan.rpax.domain.rule.RuleResult;
import com.vidnyan.rpax.domain.rule.ValidationIssue;
import com.vidnyan.rpax.domain.rule.ValidationReport;
import com.vidnyan.rpax.domain.model.ParseResult;
import com.vidnyan.rpax.domain.model.ProjectManifest;
import com.vidnyan.rpax.domain.pseudocode.WorkflowPseudocode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JSON persistence of analysis artifacts: manifest, call graph, workflow index, invocation stream
 * (one JSON object per line), validation verdict, and per-workflow activity trees and pseudocode.
 * Field names are camelCase, instants ISO-8601.
 */
@Slf4j
@Component
public class CallGraphJsonCodec implements ArtifactWriter {

    private final ObjectMapper objectMapper;
    private final WorkflowJsonCodec workflowCodec;

    public CallGraphJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.workflowCodec = new WorkflowJsonCodec(objectMapper);
    }

    public WorkflowJsonCodec workflowCodec() {
        return workflowCodec;
    }

    @Override
    public List<Path> write(Path outputDir, Artifacts artifacts) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>();

        if (artifacts.manifest() != null) {
            Path manifestFile = outputDir.resolve(MANIFEST_FILE);
            writeManifest(artifacts.manifest(), manifestFile);
            written.add(manifestFile);
        }

        Path graphFile = outputDir.resolve(CALL_GRAPH_FILE);
        writeCallGraph(artifacts.callGraph(), graphFile);
        written.add(graphFile);

        Path indexFile = outputDir.resolve(INDEX_FILE);
        writeIndex(artifacts.index(), indexFile);
        written.add(indexFile);

        Path invocationsFile = outputDir.resolve(INVOCATIONS_FILE);
        writeInvocations(artifacts.invocations(), invocationsFile);
        written.add(invocationsFile);

        if (artifacts.validation() != null) {
            Path validationFile = outputDir.resolve(VALIDATION_FILE);
            objectMapper.writeValue(validationFile.toFile(), toDocument(artifacts.validation()));
            written.add(validationFile);
        }

        Path activitiesDir = outputDir.resolve(ACTIVITIES_DIR);
        for (ParseResult result : artifacts.parseResults()) {
            Path file = workflowCodec.writeActivityTree(activitiesDir, result);
            if (file != null) {
                written.add(file);
            }
        }

        if (!artifacts.pseudocode().isEmpty()) {
            Path pseudocodeDir = outputDir.resolve(PSEUDOCODE_DIR);
            String projectId = artifacts.callGraph().projectId();
            String projectSlug = artifacts.callGraph().projectSlug();
            for (WorkflowPseudocode pseudocode : artifacts.pseudocode()) {
                written.add(workflowCodec.writePseudocode(pseudocodeDir, pseudocode, projectId, projectSlug));
            }
            written.add(workflowCodec.writePseudocodeIndex(outputDir.resolve(PSEUDOCODE_INDEX_FILE),
                    projectId, projectSlug, artifacts.pseudocode()));
        }

        log.info("Wrote {} artifacts to {}", written.size(), outputDir);
        return written;
    }

    // --- manifest ---

    public void writeManifest(ProjectManifest manifest, Path file) throws IOException {
        objectMapper.writeValue(file.toFile(), manifest);
    }

    public ProjectManifest readManifest(Path file) throws IOException {
        return objectMapper.readValue(file.toFile(), ProjectManifest.class);
    }

    // --- call graph ---

    public void writeCallGraph(CallGraph graph, Path file) throws IOException {
        objectMapper.writeValue(file.toFile(), toDocument(graph));
    }

    public CallGraph readCallGraph(Path file) throws IOException {
        return fromDocument(objectMapper.readValue(file.toFile(), CallGraphDocument.class));
    }

    CallGraphDocument toDocument(CallGraph graph) {
        Map<String, NodeDocument> workflows = new LinkedHashMap<>();
        for (WorkflowNode node : graph.workflows().values()) {
            List<EdgeDocument> edges = node.dependencies().stream()
                    .map(e -> new EdgeDocument(e.targetPath(), e.targetId(), e.kind().wireName(),
                            e.arguments(), e.nodeId(), e.activityName()))
                    .toList();
            workflows.put(node.workflowId(), new NodeDocument(node.workflowId(), node.filePath(),
                    node.displayName(), node.isEntryPoint(), node.callDepth(), edges,
                    new ArrayList<>(node.dependents())));
        }
        List<CycleDocument> cycles = graph.cycles().stream()
                .map(c -> new CycleDocument(c.id(), c.workflowIds(), c.cycleType().wireName()))
                .toList();
        return new CallGraphDocument(graph.projectId(), graph.projectSlug(), graph.schemaVersion(),
                graph.generatedAt(), graph.entryPoints(), workflows, cycles, graph.metrics(),
                graph.generationConfig());
    }

    CallGraph fromDocument(CallGraphDocument document) {
        Map<String, WorkflowNode> workflows = new LinkedHashMap<>();
        document.workflows().forEach((id, node) -> {
            List<InvocationEdge> edges = new ArrayList<>();
            for (EdgeDocument edge : node.dependencies()) {
                edges.add(new InvocationEdge(id, edge.targetPath(), edge.targetId(),
                        InvocationKind.fromWireName(edge.kind()), edge.arguments(), edge.nodeId(),
                        edge.activityName()));
            }
            workflows.put(id, WorkflowNode.restore(id, node.filePath(), node.displayName(),
                    node.entryPoint(), node.callDepth(), edges, new LinkedHashSet<>(node.dependents())));
        });
        List<Cycle> cycles = document.cycles().stream()
                .map(c -> new Cycle(c.id(), c.workflowIds(), Cycle.CycleType.fromWireName(c.cycleType())))
                .toList();
        return new CallGraph(document.projectId(), document.projectSlug(), document.schemaVersion(),
                document.generatedAt(), workflows, document.entryPoints(), cycles, document.metrics(),
                document.generationConfig() != null ? document.generationConfig() : Map.of());
    }

    // --- workflow index ---

    public void writeIndex(WorkflowIndex index, Path file) throws IOException {
        objectMapper.writeValue(file.toFile(), new IndexDocument(index.projectName(), index.projectRoot(),
                index.scanTimestamp(), index.totalWorkflows(), index.successfulParses(), index.failedParses(),
                index.workflows(), index.excludedPatterns(), index.excludedFiles()));
    }

    public WorkflowIndex readIndex(Path file) throws IOException {
        IndexDocument document = objectMapper.readValue(file.toFile(), IndexDocument.class);
        return new WorkflowIndex(document.projectName(), document.projectRoot(), document.scanTimestamp(),
                document.workflows(), document.excludedPatterns(), document.excludedFiles());
    }

    // --- invocations ---

    public void writeInvocations(List<InvocationRecord> invocations, Path file) throws IOException {
        ObjectWriter lineWriter = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (InvocationRecord invocation : invocations) {
                writer.write(lineWriter.writeValueAsString(new InvocationDocument(
                        invocation.kind().wireName(), invocation.from(), invocation.to(),
                        invocation.arguments(), invocation.activityName(), invocation.targetPath(),
                        invocation.nodeId())));
                writer.newLine();
            }
        }
    }

    public List<InvocationRecord> readInvocations(Path file) throws IOException {
        List<InvocationRecord> invocations = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            InvocationDocument document = objectMapper.readValue(line, InvocationDocument.class);
            invocations.add(new InvocationRecord(InvocationKind.fromWireName(document.kind()),
                    document.from(), document.to(), document.arguments(), document.activityName(),
                    document.targetPath(), document.nodeId()));
        }
        return invocations;
    }

    // --- validation ---

    ValidationDocument toDocument(ValidationReport report) {
        List<RuleDocument> rules = new ArrayList<>();
        for (RuleResult result : report.results()) {
            List<IssueDocument> issues = new ArrayList<>();
            for (ValidationIssue issue : result.issues()) {
                issues.add(new IssueDocument(issue.status().wireName(), issue.message(), issue.workflowId(),
                        issue.chain(), issue.context()));
            }
            rules.add(new RuleDocument(result.ruleId(), result.status().wireName(),
                    result.execution().name().toLowerCase(Locale.ROOT), result.errorMessage(),
                    result.executionTime().toMillis(), result.counters(), issues));
        }
        return new ValidationDocument(report.status().wireName(), report.exitCode(), report.counters(), rules);
    }

    // Serialized shapes

    public record CallGraphDocument(
        String projectId,
        String projectSlug,
        String schemaVersion,
        Instant generatedAt,
        List<String> entryPoints,
        Map<String, NodeDocument> workflows,
        List<CycleDocument> cycles,
        CallGraphMetrics metrics,
        Map<String, Object> generationConfig
    ) {}

    public record NodeDocument(
        String workflowId,
        String filePath,
        String displayName,
        boolean entryPoint,
        int callDepth,
        List<EdgeDocument> dependencies,
        List<String> dependents
    ) {}

    public record EdgeDocument(
        String targetPath,
        String targetId,
        String kind,
        Map<String, String> arguments,
        String nodeId,
        String activityName
    ) {}

    public record CycleDocument(String id, List<String> workflowIds, String cycleType) {}

    public record IndexDocument(
        String projectName,
        String projectRoot,
        String scanTimestamp,
        int totalWorkflows,
        int successfulParses,
        int failedParses,
        List<WorkflowEntry> workflows,
        List<String> excludedPatterns,
        List<String> excludedFiles
    ) {}

    public record InvocationDocument(
        String kind,
        String from,
        String to,
        Map<String, String> arguments,
        String activityName,
        String targetPath,
        String nodeId
    ) {}

    public record ValidationDocument(
        String status,
        int exitCode,
        Map<String, Integer> counters,
        List<RuleDocument> rules
    ) {}

    public record RuleDocument(
        String ruleId,
        String status,
        String execution,
        String errorMessage,
        long durationMs,
        Map<String, Integer> counters,
        List<IssueDocument> issues
    ) {}

    public record IssueDocument(
        String status,
        String message,
        String workflowId,
        List<String> chain,
        Map<String, Object> context
    ) {}
}
