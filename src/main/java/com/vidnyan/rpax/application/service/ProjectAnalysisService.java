package com.vidnyan.rpax.application.service;

import com.vidnyan.rpax.RpaxProperties;
import com.vidnyan.rpax.application.port.in.AnalyzeProjectUseCase;
import com.vidnyan.rpax.application.port.out.ArtifactWriter;
import com.vidnyan.rpax.application.port.out.ProjectDescriptorReader;
import com.vidnyan.rpax.application.port.out.WorkflowParser;
import com.vidnyan.rpax.domain.graph.CallGraph;
import com.vidnyan.rpax.domain.graph.CallGraphBuilder;
import com.vidnyan.rpax.domain.invocation.InvocationRecord;
import com.vidnyan.rpax.domain.model.ParseDiagnostics;
import com.vidnyan.rpax.domain.model.ParseResult;
import com.vidnyan.rpax.domain.model.ProjectDescriptor;
import com.vidnyan.rpax.domain.model.ProjectManifest;
import com.vidnyan.rpax.domain.model.WorkflowDocument;
import com.vidnyan.rpax.domain.model.WorkflowEntry;
import com.vidnyan.rpax.domain.model.WorkflowIndex;
import com.vidnyan.rpax.domain.pseudocode.PseudocodeExpander;
import com.vidnyan.rpax.domain.pseudocode.PseudocodeGenerator;
import com.vidnyan.rpax.domain.pseudocode.WorkflowPseudocode;
import com.vidnyan.rpax.domain.rule.RuleResult;
import com.vidnyan.rpax.domain.rule.ValidationContext;
import com.vidnyan.rpax.domain.rule.ValidationReport;
import com.vidnyan.rpax.domain.rule.ValidationRule;
import com.vidnyan.rpax.domain.xaml.ActivityIdGenerator;
import com.vidnyan.rpax.domain.xaml.ContentHasher;
import com.vidnyan.rpax.scanner.WorkflowScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Main application service that orchestrates a project analysis.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectAnalysisService implements AnalyzeProjectUseCase {

    private static final int ENTRY_HASH_LENGTH = 16;

    private final ProjectDescriptorReader projectDescriptorReader;
    private final WorkflowScanner workflowScanner;
    private final WorkflowParser workflowParser;
    private final CallGraphBuilder callGraphBuilder;
    private final PseudocodeGenerator pseudocodeGenerator;
    private final List<ValidationRule> validationRules;
    private final ArtifactWriter artifactWriter;
    private final RpaxProperties properties;

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        Instant startTime = Instant.now();
        Path projectRoot = request.projectPath().toAbsolutePath().normalize();
        log.info("Starting analysis of: {}", projectRoot);

        // Step 1: Read project declaration
        log.info("Step 1: Reading project declaration...");
        ProjectDescriptor project = projectDescriptorReader.read(projectRoot);
        String projectId = project.effectiveProjectId();

        // Step 2: Discover workflows
        log.info("Step 2: Discovering workflows...");
        List<String> excludePatterns = properties.getScan().getExcludePatterns();
        WorkflowScanner.ScanResult scan;
        try {
            scan = workflowScanner.scan(projectRoot, excludePatterns);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan " + projectRoot, e);
        }

        // Step 3: Parse workflows, one file at a time
        log.info("Step 3: Parsing {} workflows...", scan.workflows().size());
        List<ParseResult> parseResults = new ArrayList<>();
        List<WorkflowEntry> entries = new ArrayList<>();
        List<InvocationRecord> invocations = new ArrayList<>();
        for (Path file : scan.workflows()) {
            String relativePath = WorkflowScanner.relativePath(projectRoot, file);
            ParseResult result = parseIsolated(file, new WorkflowParser.ParsingOptions(
                    projectId,
                    ActivityIdGenerator.workflowId(relativePath),
                    projectRoot,
                    request.maxDepth(),
                    request.strictMode()));
            parseResults.add(result);
            entries.add(toEntry(project, projectRoot, file, relativePath, result));
            invocations.addAll(result.invocations());
        }
        int failures = (int) parseResults.stream().filter(r -> !r.success()).count();
        log.info("Parsed: {} workflows, {} failures, {} invocations",
                parseResults.size(), failures, invocations.size());

        WorkflowIndex index = new WorkflowIndex(project.name(), projectRoot.toString(),
                startTime.toString(), entries, excludePatterns, scan.excludedFiles());

        // Step 4: Build call graph
        log.info("Step 4: Building call graph...");
        CallGraph callGraph = callGraphBuilder.build(new CallGraphBuilder.Request(
                projectId, project.slug(), entries, project.entryPointPaths(), invocations));

        // Step 5: Validate
        log.info("Step 5: Evaluating validation rules...");
        ValidationContext context = new ValidationContext(project, index, invocations, callGraph,
                properties.getValidation().isFailOnCycles(), properties.getValidation().isFailOnMissing());
        ValidationReport validation = validate(context);
        log.info("Validation status: {}", validation.status());

        // Step 6: Pseudocode
        log.info("Step 6: Generating pseudocode...");
        List<WorkflowPseudocode> pseudocode = generatePseudocode(parseResults, callGraph);

        ProjectManifest manifest = ProjectManifest.of(project, projectRoot.toString(), index, invocations.size(),
                callGraph.generatedAt(), scanConfig(), validationConfig(), artifactReferences());

        // Step 7: Write artifacts
        List<Path> artifacts = List.of();
        if (request.outputPath() != null) {
            log.info("Step 7: Writing artifacts...");
            try {
                artifacts = artifactWriter.write(request.outputPath(), new ArtifactWriter.Artifacts(
                        manifest, callGraph, index, invocations, validation, parseResults, pseudocode));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot write artifacts to " + request.outputPath(), e);
            }
        }

        Duration totalDuration = Duration.between(startTime, Instant.now());
        AnalysisStats stats = new AnalysisStats(
                scan.workflows().size(),
                parseResults.size() - failures,
                failures,
                parseResults.stream().mapToInt(ParseResult::activityCount).sum(),
                invocations.size(),
                validationRules.size(),
                totalDuration.toMillis()
        );

        log.info("Analysis complete: {} workflows, {} edges in {}ms",
                callGraph.size(), callGraph.metrics().totalDependencies(), stats.totalDurationMs());

        return new AnalysisResult(project, manifest, index, parseResults, invocations, callGraph, validation,
                pseudocode, artifacts, stats);
    }

    /**
     * One file's failure never affects the others.
     */
    private ParseResult parseIsolated(Path file, WorkflowParser.ParsingOptions options) {
        try {
            return workflowParser.parse(file, options);
        } catch (RuntimeException e) {
            log.warn("Unexpected failure parsing {}: {}", file, e.getMessage());
            return ParseResult.failure(file.toString(), options.workflowId(),
                    "Unexpected failure: " + e.getMessage(), 0, ParseDiagnostics.empty(0, List.of()));
        }
    }

    /**
     * One outline per workflow; expansion inlines statically invoked workflows when enabled.
     */
    private List<WorkflowPseudocode> generatePseudocode(List<ParseResult> parseResults, CallGraph callGraph) {
        Map<String, WorkflowPseudocode> byWorkflow = new LinkedHashMap<>();
        for (ParseResult result : parseResults) {
            WorkflowPseudocode pseudocode = result.hasTree()
                    ? pseudocodeGenerator.generate(result.workflowId(), result.tree())
                    : WorkflowPseudocode.failed(result.workflowId(), String.join("; ", result.errors()));
            byWorkflow.put(result.workflowId(), pseudocode);
        }

        RpaxProperties.Pseudocode config = properties.getPseudocode();
        if (!config.isGenerateExpanded()) {
            return new ArrayList<>(byWorkflow.values());
        }
        PseudocodeExpander expander = new PseudocodeExpander(callGraph, config.getMaxExpansionDepth(),
                config.getCycleHandling());
        List<WorkflowPseudocode> expanded = new ArrayList<>();
        for (WorkflowPseudocode pseudocode : byWorkflow.values()) {
            expanded.add(pseudocode.hasError() ? pseudocode
                    : pseudocode.withExpansion(expander.expand(pseudocode.workflowId(), byWorkflow)));
        }
        return expanded;
    }

    private Map<String, Object> scanConfig() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("excludePatterns", List.copyOf(properties.getScan().getExcludePatterns()));
        config.put("maxDepth", properties.getParser().getMaxDepth());
        config.put("strictMode", properties.getParser().isStrictMode());
        return config;
    }

    private Map<String, Object> validationConfig() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("failOnCycles", properties.getValidation().isFailOnCycles());
        config.put("failOnMissing", properties.getValidation().isFailOnMissing());
        config.put("rules", validationRules.stream().map(ValidationRule::id).toList());
        return config;
    }

    private static Map<String, String> artifactReferences() {
        Map<String, String> references = new LinkedHashMap<>();
        references.put("callGraphFile", ArtifactWriter.CALL_GRAPH_FILE);
        references.put("workflowIndexFile", ArtifactWriter.INDEX_FILE);
        references.put("invocationsFile", ArtifactWriter.INVOCATIONS_FILE);
        references.put("validationFile", ArtifactWriter.VALIDATION_FILE);
        references.put("activitiesDir", ArtifactWriter.ACTIVITIES_DIR + "/");
        references.put("pseudocodeDir", ArtifactWriter.PSEUDOCODE_DIR + "/");
        references.put("pseudocodeIndexFile", ArtifactWriter.PSEUDOCODE_INDEX_FILE);
        return references;
    }

    private ValidationReport validate(ValidationContext context) {
        List<RuleResult> results = new ArrayList<>();
        for (ValidationRule rule : validationRules) {
            if (!rule.supports(context)) {
                results.add(RuleResult.skipped(rule.id(), "Not applicable"));
                continue;
            }
            try {
                RuleResult result = rule.validate(context);
                results.add(result);
                if (result.hasIssues()) {
                    log.info("  {} reported {} issues ({})", rule.id(), result.issueCount(), result.status());
                }
            } catch (Exception e) {
                log.error("Error evaluating rule {}: {}", rule.id(), e.getMessage());
                results.add(RuleResult.error(rule.id(), e.getMessage()));
            }
        }
        return ValidationReport.of(results);
    }

    private WorkflowEntry toEntry(ProjectDescriptor project, Path projectRoot, Path file, String relativePath,
                                  ParseResult result) {
        String contentHash;
        long size;
        String lastModified;
        try {
            contentHash = ContentHasher.sha256Hex(Files.readAllBytes(file));
            size = Files.size(file);
            lastModified = Files.getLastModifiedTime(file).toInstant().toString();
        } catch (IOException e) {
            log.warn("Cannot read file attributes of {}: {}", relativePath, e.getMessage());
            contentHash = "";
            size = 0;
            lastModified = null;
        }

        WorkflowDocument document = result.document();
        String workflowId = result.workflowId();
        String fileName = file.getFileName().toString();
        return new WorkflowEntry(
                project.slug() + "#" + workflowId + "#"
                        + contentHash.substring(0, Math.min(ENTRY_HASH_LENGTH, contentHash.length())),
                project.slug(),
                workflowId,
                contentHash,
                relativePath,
                fileName,
                document != null ? document.displayName() : ActivityIdGenerator.workflowId(fileName),
                document != null ? document.description() : null,
                size,
                lastModified,
                document != null ? document.expressionLanguage() : project.expressionLanguage(),
                result.activityCount(),
                document != null ? document.arguments().size() : 0,
                document != null ? document.variables().size() : 0,
                result.success(),
                result.errors());
    }
}
