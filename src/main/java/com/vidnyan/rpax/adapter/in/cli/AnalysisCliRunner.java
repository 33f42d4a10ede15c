package com.vidnyan.rpax.adapter.in.cli;

import com.vidnyan.rpax.RpaxProperties;
import com.vidnyan.rpax.application.port.in.AnalyzeProjectUseCase;
import com.vidnyan.rpax.application.port.in.AnalyzeProjectUseCase.AnalysisRequest;
import com.vidnyan.rpax.application.port.in.AnalyzeProjectUseCase.AnalysisResult;
import com.vidnyan.rpax.application.port.out.ProjectDescriptorReader.ProjectDescriptorException;
import com.vidnyan.rpax.domain.explain.WorkflowExplainer;
import com.vidnyan.rpax.domain.explain.WorkflowExplanation;
import com.vidnyan.rpax.domain.graph.CallGraph;
import com.vidnyan.rpax.domain.graph.CallGraphMetrics;
import com.vidnyan.rpax.domain.graph.Cycle;
import com.vidnyan.rpax.domain.model.WorkflowArgument;
import com.vidnyan.rpax.domain.rule.RuleResult;
import com.vidnyan.rpax.domain.rule.ValidationIssue;
import com.vidnyan.rpax.domain.rule.ValidationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * CLI Runner for standalone project analysis.
 * Runs analysis when the rpax.project-path property is set; the exit code follows the validation verdict.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisCliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_ABORTED = 2;
    private static final int MAX_LISTED = 50;

    private final AnalyzeProjectUseCase analyzeProjectUseCase;
    private final RpaxProperties properties;
    private final WorkflowExplainer workflowExplainer;

    private int exitCode;

    @Override
    public void run(String... args) {
        String projectPath = properties.getProjectPath();
        if (projectPath == null || projectPath.isBlank()) {
            log.info("No project path specified. Set rpax.project-path property.");
            return;
        }

        log.info("╔══════════════════════════════════════════════════════════════╗");
        log.info("║           RPAX - Workflow Call Graph Analyzer                ║");
        log.info("╠══════════════════════════════════════════════════════════════╣");
        log.info("║ Project: {}", truncatePath(projectPath, 50));
        log.info("║ Output:  {}", truncatePath(properties.getOutputPath(), 50));
        log.info("╚══════════════════════════════════════════════════════════════╝");

        try {
            AnalysisRequest request = new AnalysisRequest(
                    Path.of(projectPath),
                    Path.of(properties.getOutputPath()),
                    properties.getParser().isStrictMode(),
                    properties.getParser().getMaxDepth());
            AnalysisResult result = analyzeProjectUseCase.analyze(request);

            printResults(result);
            printValidation(result);
            for (String identifier : properties.getExplain()) {
                printExplanation(result, identifier);
            }

            exitCode = result.validation().exitCode();
            log.info("");
            log.info("Analysis complete!");
        } catch (ProjectDescriptorException e) {
            log.error("Cannot analyze project: {}", e.getMessage());
            exitCode = EXIT_ABORTED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void printResults(AnalysisResult result) {
        CallGraph graph = result.callGraph();
        CallGraphMetrics metrics = graph.metrics();

        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" ANALYSIS RESULTS: {} ({})", result.project().name(), result.project().slug());
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Workflows:        {}", result.stats().workflowsDiscovered());
        log.info(" Parse failures:   {}", result.stats().parseFailures());
        log.info(" Activities:       {}", result.stats().activitiesExtracted());
        log.info(" Entry points:     {}", metrics.entryPoints());
        log.info(" Duration:         {}ms", result.stats().totalDurationMs());
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" INVOCATIONS:      {}", metrics.totalDependencies());
        log.info("   invoke:         {}", metrics.staticInvocations());
        log.info("   invoke-dynamic: {}", metrics.dynamicInvocations());
        log.info("   invoke-missing: {}", metrics.missingInvocations());
        log.info("   invoke-coded:   {}", metrics.codedInvocations());
        log.info(" Max call depth:   {}", metrics.maxCallDepth());
        log.info(" Orphans:          {}", metrics.orphanedWorkflows());
        log.info(" Cycles:           {}", metrics.cyclesDetected());
        log.info("═══════════════════════════════════════════════════════════════");

        printList(" FAILED FILES:", result.failedFiles());
        printList(" UNRESOLVED TARGETS:", result.unresolvedTargets());
        for (Cycle cycle : graph.cycles()) {
            log.info(" Cycle {} ({}): {}", cycle.id(), cycle.cycleType().wireName(),
                    CallGraph.formatCycle(cycle.workflowIds()));
        }
        if (!result.artifacts().isEmpty()) {
            printList(" ARTIFACTS:", result.artifacts().stream().map(Path::toString).toList());
        }
    }

    private void printValidation(AnalysisResult result) {
        log.info("");
        log.info(" VALIDATION: {}", result.validation().status());
        log.info("───────────────────────────────────────────────────────────────");
        for (RuleResult rule : result.validation().results()) {
            log.info("   {} {} ({} issues)", marker(rule.status()), rule.ruleId(), rule.issueCount());
            if (rule.errorMessage() != null) {
                log.info("      {}", rule.errorMessage());
            }
        }

        int count = 0;
        for (ValidationIssue issue : result.validation().issues()) {
            count++;
            if (count > MAX_LISTED) {
                log.info(" ... and {} more issues", result.validation().issues().size() - MAX_LISTED);
                break;
            }
            log.info("");
            log.info(" {} [{}] {}", marker(issue.status()), issue.ruleId(), issue.message());
            if (!issue.formattedChain().isEmpty()) {
                log.info(" Chain:    {}", issue.formattedChain());
            }
        }
    }

    private void printExplanation(AnalysisResult result, String identifier) {
        Optional<WorkflowExplanation> found = workflowExplainer.explain(identifier, result.index(),
                result.callGraph(), result.documents());
        if (found.isEmpty()) {
            log.warn("Workflow not found: {}", identifier);
            return;
        }
        WorkflowExplanation explanation = found.get();

        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" WORKFLOW: {} ({})", explanation.displayName(), explanation.relativePath());
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Entry point:  {}", explanation.entryPoint());
        log.info(" Orphan:       {}", explanation.orphan());
        log.info(" Call depth:   {}", explanation.callDepth());
        log.info(" Complexity:   {} ({} invocations, {} unique)", explanation.complexity().label(),
                explanation.totalInvocations(), explanation.uniqueDependencies());
        if (!explanation.parseSuccessful()) {
            printList(" PARSE ERRORS:", explanation.parseErrors());
        }
        printList(" ARGUMENTS:", explanation.arguments().stream()
                .map(a -> a.direction().wireName() + " " + a.name() + typeSuffix(a))
                .toList());
        printList(" INVOKES:", explanation.invokes().stream()
                .map(c -> c.target() + " (" + c.kind() + ")")
                .toList());
        printList(" CALLED BY:", explanation.calledBy().stream()
                .map(c -> c.workflowId() + " (" + c.kind() + ")")
                .toList());
        result.pseudocodeOf(explanation.workflowId()).ifPresent(pseudocode -> {
            List<String> lines = pseudocode.expandedLines().isEmpty() ? pseudocode.lines() : pseudocode.expandedLines();
            printList(" PSEUDOCODE:", lines);
        });
    }

    private static String typeSuffix(WorkflowArgument argument) {
        return argument.type() == null ? "" : " : " + argument.type();
    }

    private void printList(String title, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        log.info("");
        log.info(title);
        items.stream().limit(MAX_LISTED).forEach(item -> log.info("   - {}", item));
        if (items.size() > MAX_LISTED) {
            log.info("   ... and {} more", items.size() - MAX_LISTED);
        }
    }

    private static String marker(ValidationStatus status) {
        return switch (status) {
            case PASS -> "✅ PASS";
            case WARN -> "🟡 WARN";
            case FAIL -> "🔴 FAIL";
        };
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
