package com.vidnyan.rpax.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.rpax.RpaxProperties;
import com.vidnyan.rpax.adapter.out.json.CallGraphJsonCodec;
import com.vidnyan.rpax.adapter.out.project.JsonProjectDescriptorReader;
import com.vidnyan.rpax.adapter.out.rule.ArgumentsPresenceRule;
import com.vidnyan.rpax.adapter.out.rule.CycleDetectionRule;
import com.vidnyan.rpax.adapter.out.rule.KindsBoundedRule;
import com.vidnyan.rpax.adapter.out.rule.MissingInvocationRule;
import com.vidnyan.rpax.adapter.out.rule.ReferentialIntegrityRule;
import com.vidnyan.rpax.adapter.out.rule.RootsResolvableRule;
import com.vidnyan.rpax.adapter.out.xaml.DomWorkflowParser;
import com.vidnyan.rpax.application.port.in.AnalyzeProjectUseCase.AnalysisRequest;
import com.vidnyan.rpax.application.port.in.AnalyzeProjectUseCase.AnalysisResult;
import com.vidnyan.rpax.application.port.out.ArtifactWriter;
import com.vidnyan.rpax.application.port.out.ProjectDescriptorReader.ProjectDescriptorException;
import com.vidnyan.rpax.config.RpaxConfiguration;
import com.vidnyan.rpax.domain.graph.CallGraphBuilder;
import com.vidnyan.rpax.domain.invocation.InvocationKind;
import com.vidnyan.rpax.domain.invocation.InvocationResolver;
import com.vidnyan.rpax.domain.model.ProjectManifest;
import com.vidnyan.rpax.domain.model.WorkflowEntry;
import com.vidnyan.rpax.domain.pseudocode.PseudocodeGenerator;
import com.vidnyan.rpax.domain.pseudocode.WorkflowPseudocode;
import com.vidnyan.rpax.domain.rule.RuleResult;
import com.vidnyan.rpax.domain.rule.ValidationContext;
import com.vidnyan.rpax.domain.rule.ValidationRule;
import com.vidnyan.rpax.domain.rule.ValidationStatus;
import com.vidnyan.rpax.domain.xaml.XamlFixtures;
import com.vidnyan.rpax.scanner.WorkflowScanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectAnalysisServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new RpaxConfiguration().objectMapper();
    private RpaxProperties properties;

    @BeforeEach
    void setUp() throws IOException {
        properties = new RpaxProperties();
        properties.init();

        Files.writeString(tempDir.resolve("project.json"), """
                {
                  "name": "Claims Robot",
                  "projectId": "claims-1",
                  "main": "Main.xaml",
                  "entryPoints": [ { "filePath": "Main.xaml" }, { "filePath": "Tests/Smoke.xaml" } ]
                }
                """);
        Files.createDirectories(tempDir.resolve("Flows"));
        Files.createDirectories(tempDir.resolve(".local"));
        Files.writeString(tempDir.resolve("Main.xaml"), XamlFixtures.workflow("<Sequence DisplayName=\"Main\">"
                + "<ui:InvokeWorkflowFile DisplayName=\"Login\" WorkflowFileName=\"Flows\\Login.xaml\"/>"
                + "<ui:InvokeWorkflowFile DisplayName=\"Gone\" WorkflowFileName=\"Flows\\Gone.xaml\"/>"
                + "<ui:InvokeWorkflowFile DisplayName=\"Pick\" WorkflowFileName=\"[Path.Combine(dir, name)]\"/>"
                + "</Sequence>"));
        Files.writeString(tempDir.resolve("Flows/Login.xaml"), XamlFixtures.workflow("<Sequence DisplayName=\"Login\">"
                + "<ui:InvokeWorkflowFile DisplayName=\"Back\" WorkflowFileName=\"Main.xaml\"/>"
                + "</Sequence>"));
        Files.writeString(tempDir.resolve("Orphan.xaml"), XamlFixtures.workflow("<Sequence DisplayName=\"Unused\"/>"));
        Files.writeString(tempDir.resolve("Broken.xaml"), "<Activity><Sequence>");
        Files.writeString(tempDir.resolve(".local/Copy.xaml"), XamlFixtures.workflow("<Sequence/>"));
    }

    private ProjectAnalysisService service(List<ValidationRule> rules) {
        return new ProjectAnalysisService(
                new JsonProjectDescriptorReader(objectMapper),
                new WorkflowScanner(),
                new DomWorkflowParser(new InvocationResolver(
                        properties.getInvocation().getDynamicIndicators(),
                        properties.getInvocation().getCodedExtensions(),
                        Files::isRegularFile), properties),
                new CallGraphBuilder(),
                new PseudocodeGenerator(),
                rules,
                new CallGraphJsonCodec(objectMapper),
                properties);
    }

    private static List<ValidationRule> allRules() {
        return List.of(new ReferentialIntegrityRule(), new KindsBoundedRule(), new ArgumentsPresenceRule(),
                new CycleDetectionRule(), new RootsResolvableRule(), new MissingInvocationRule());
    }

    @Test
    void analyze_ShouldParseGraphAndValidateProject() {
        // Act
        AnalysisResult result = service(allRules()).analyze(AnalysisRequest.forPath(tempDir));

        // Assert
        assertEquals("Claims Robot", result.project().name());
        assertEquals(4, result.stats().workflowsDiscovered());
        assertEquals(3, result.stats().workflowsParsed());
        assertEquals(1, result.stats().parseFailures());
        assertEquals(List.of(".local/Copy.xaml"), result.index().excludedFiles());
        assertEquals(1, result.failedFiles().size());
        assertTrue(result.failedFiles().get(0).endsWith("Broken.xaml"));

        assertEquals(2, result.invocationCount(InvocationKind.STATIC));
        assertEquals(1, result.invocationCount(InvocationKind.MISSING));
        assertEquals(1, result.invocationCount(InvocationKind.DYNAMIC));
        assertTrue(result.unresolvedTargets().contains("Flows/Gone.xaml"));

        assertEquals(List.of("Main"), result.callGraph().entryPoints());
        assertEquals(1, result.callGraph().node("Flows/Login").orElseThrow().callDepth());
        assertEquals(List.of("Broken", "Orphan"), result.callGraph().orphans());
        assertEquals(1, result.callGraph().cycles().size());

        assertEquals(ValidationStatus.FAIL, result.validation().status());
        assertEquals(1, result.validation().exitCode());
        assertEquals(6, result.validation().results().size());
        assertTrue(result.artifacts().isEmpty());
    }

    @Test
    void analyze_ShouldIndexFailedParsesWithHashes() {
        AnalysisResult result = service(allRules()).analyze(AnalysisRequest.forPath(tempDir));

        WorkflowEntry broken = result.index().findByWorkflowId("Broken").orElseThrow();
        assertFalse(broken.parseSuccessful());
        assertFalse(broken.parseErrors().isEmpty());
        assertEquals(64, broken.contentHash().length());
        assertTrue(broken.id().startsWith(result.project().slug() + "#Broken#"));
        assertEquals(1, result.index().failedParses());
    }

    @Test
    void analyze_ShouldWarnOnlyWhenCyclesAreTolerated() {
        properties.getValidation().setFailOnCycles(false);

        AnalysisResult result = service(allRules()).analyze(AnalysisRequest.forPath(tempDir));

        // Tests/Smoke.xaml is declared but absent
        assertEquals(ValidationStatus.FAIL, result.validation().status());
        RuleResult roots = result.validation().results().stream()
                .filter(r -> r.ruleId().equals(RootsResolvableRule.ID)).findFirst().orElseThrow();
        assertEquals(ValidationStatus.FAIL, roots.status());
        RuleResult cycles = result.validation().results().stream()
                .filter(r -> r.ruleId().equals(CycleDetectionRule.ID)).findFirst().orElseThrow();
        assertEquals(ValidationStatus.WARN, cycles.status());
    }

    @Test
    void analyze_ShouldRecordFailingRuleAsError() {
        // Arrange
        ValidationRule exploding = new ValidationRule() {
            @Override
            public String id() {
                return "exploding";
            }

            @Override
            public RuleResult validate(ValidationContext context) {
                throw new IllegalStateException("boom");
            }
        };
        List<ValidationRule> rules = new ArrayList<>(List.of(new ArgumentsPresenceRule()));
        rules.add(exploding);

        // Act
        AnalysisResult result = service(rules).analyze(AnalysisRequest.forPath(tempDir));

        // Assert
        RuleResult error = result.validation().results().get(1);
        assertEquals(RuleResult.ExecutionStatus.ERROR, error.execution());
        assertEquals("boom", error.errorMessage());
        assertEquals(ValidationStatus.FAIL, result.validation().status());
    }

    @Test
    void analyze_ShouldWriteArtifactsWhenOutputIsGiven() {
        Path output = tempDir.resolve("out");

        AnalysisResult result = service(allRules()).analyze(new AnalysisRequest(tempDir, output, false, 100));

        // manifest, 4 graph files, 3 activity trees, 4 pseudocode files and their index
        assertEquals(13, result.artifacts().size());
        assertTrue(Files.isRegularFile(output.resolve(ArtifactWriter.MANIFEST_FILE)));
        assertTrue(Files.isRegularFile(output.resolve(ArtifactWriter.CALL_GRAPH_FILE)));
        assertTrue(Files.isRegularFile(output.resolve(ArtifactWriter.INVOCATIONS_FILE)));
        assertTrue(Files.isRegularFile(output.resolve(ArtifactWriter.ACTIVITIES_DIR).resolve("Main.json")));
        assertTrue(Files.isRegularFile(output.resolve(ArtifactWriter.ACTIVITIES_DIR).resolve("Flows/Login.json")));
        assertFalse(Files.exists(output.resolve(ArtifactWriter.ACTIVITIES_DIR).resolve("Broken.json")));
        assertTrue(Files.isRegularFile(output.resolve(ArtifactWriter.PSEUDOCODE_DIR).resolve("Broken.json")));
        assertTrue(Files.isRegularFile(output.resolve(ArtifactWriter.PSEUDOCODE_INDEX_FILE)));
    }

    @Test
    void analyze_ShouldDescribeProjectInManifest() {
        // Act
        AnalysisResult result = service(allRules()).analyze(AnalysisRequest.forPath(tempDir));

        // Assert
        ProjectManifest manifest = result.manifest();
        assertEquals("Claims Robot", manifest.projectName());
        assertEquals("claims-1", manifest.projectId());
        assertEquals(result.project().slug(), manifest.projectSlug());
        assertEquals("Main.xaml", manifest.mainWorkflow());
        assertEquals(4, manifest.totalWorkflows());
        assertEquals(1, manifest.parseErrors());
        assertEquals(4, manifest.totalInvocations());
        assertEquals(result.callGraph().generatedAt(), manifest.generatedAt());
        assertEquals(properties.getScan().getExcludePatterns(), manifest.scanConfig().get("excludePatterns"));
        assertEquals(ArtifactWriter.CALL_GRAPH_FILE, manifest.artifacts().get("callGraphFile"));
    }

    @Test
    void analyze_ShouldExpandPseudocodeThroughInvokedWorkflows() {
        // Act
        AnalysisResult result = service(allRules()).analyze(AnalysisRequest.forPath(tempDir));

        // Assert
        WorkflowPseudocode main = result.pseudocodeOf("Main").orElseThrow();
        assertEquals("- [Main] Sequence (Path: /Sequence[0])", main.lines().get(0));
        assertEquals(4, main.totalLines());
        assertTrue(main.expandedLines().contains("    - [Login] Sequence (Path: /Sequence[0])"));
        assertTrue(main.expandedLines().stream()
                .anyMatch(line -> line.trim().equals("[CYCLE DETECTED: Main] (already expanded above)")));

        WorkflowPseudocode broken = result.pseudocodeOf("Broken").orElseThrow();
        assertTrue(broken.hasError());
        assertTrue(broken.expandedLines().isEmpty());
    }

    @Test
    void analyze_ShouldSkipExpansionWhenDisabled() {
        properties.getPseudocode().setGenerateExpanded(false);

        AnalysisResult result = service(allRules()).analyze(AnalysisRequest.forPath(tempDir));

        WorkflowPseudocode main = result.pseudocodeOf("Main").orElseThrow();
        assertEquals(4, main.totalLines());
        assertTrue(main.expandedLines().isEmpty());
    }

    @Test
    void analyze_ShouldAbortWithoutProjectFile() throws IOException {
        Files.delete(tempDir.resolve("project.json"));

        assertThrows(ProjectDescriptorException.class,
                () -> service(allRules()).analyze(AnalysisRequest.forPath(tempDir)));
    }
}
