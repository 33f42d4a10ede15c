package com.vidnyan.rpax.application.port.in;

import com.vidnyan.rpax.domain.graph.CallGraph;
import com.vidnyan.rpax.domain.graph.InvocationEdge;
import com.vidnyan.rpax.domain.invocation.InvocationKind;
import com.vidnyan.rpax.domain.invocation.InvocationRecord;
import com.vidnyan.rpax.domain.model.ParseResult;
import com.vidnyan.rpax.domain.model.ProjectDescriptor;
import com.vidnyan.rpax.domain.model.ProjectManifest;
import com.vidnyan.rpax.domain.model.WorkflowDocument;
import com.vidnyan.rpax.domain.model.WorkflowIndex;
import com.vidnyan.rpax.domain.pseudocode.WorkflowPseudocode;
import com.vidnyan.rpax.domain.rule.ValidationReport;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Primary use case: parse every workflow of a project and build its call graph.
 * This is the main entry point to the application.
 */
public interface AnalyzeProjectUseCase {

    /**
     * Analyze a project directory.
     * @param request Analysis request parameters
     * @return parsed workflows, call graph and validation verdict
     */
    AnalysisResult analyze(AnalysisRequest request);

    /**
     * Analysis request parameters.
     *
     * @param outputPath artifact directory, or null to skip writing artifacts
     */
    record AnalysisRequest(
        Path projectPath,
        Path outputPath,
        boolean strictMode,
        int maxDepth
    ) {
        public static AnalysisRequest forPath(Path path) {
            return new AnalysisRequest(path, null, false, 100);
        }
    }

    /**
     * Analysis result.
     */
    record AnalysisResult(
        ProjectDescriptor project,
        ProjectManifest manifest,
        WorkflowIndex index,
        List<ParseResult> parseResults,
        List<InvocationRecord> invocations,
        CallGraph callGraph,
        ValidationReport validation,
        List<WorkflowPseudocode> pseudocode,
        List<Path> artifacts,
        AnalysisStats stats
    ) {
        /**
         * Parsed documents by workflow id; failed parses are absent.
         */
        public Map<String, WorkflowDocument> documents() {
            Map<String, WorkflowDocument> documents = new LinkedHashMap<>();
            for (ParseResult result : parseResults) {
                if (result.document() != null) {
                    documents.put(result.workflowId(), result.document());
                }
            }
            return documents;
        }

        public Optional<WorkflowPseudocode> pseudocodeOf(String workflowId) {
            return pseudocode.stream().filter(p -> p.workflowId().equals(workflowId)).findFirst();
        }

        public int invocationCount(InvocationKind kind) {
            return (int) invocations.stream()
                    .filter(i -> i.kind() == kind)
                    .count();
        }

        public List<String> failedFiles() {
            return parseResults.stream()
                    .filter(r -> !r.success())
                    .map(ParseResult::filePath)
                    .toList();
        }

        /**
         * Targets of edges that do not point at an indexed workflow, as written.
         */
        public List<String> unresolvedTargets() {
            return callGraph.edges().stream()
                    .filter(e -> !e.isResolved())
                    .map(InvocationEdge::targetPath)
                    .distinct()
                    .toList();
        }
    }

    /**
     * Analysis statistics.
     */
    record AnalysisStats(
        int workflowsDiscovered,
        int workflowsParsed,
        int parseFailures,
        int activitiesExtracted,
        int invocationsFound,
        int rulesEvaluated,
        long totalDurationMs
    ) {}
}
