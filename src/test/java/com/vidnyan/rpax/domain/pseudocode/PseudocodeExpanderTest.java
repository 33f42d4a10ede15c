package com.vidnyan.rpax.domain.pseudocode;

import com.vidnyan.rpax.domain.graph.CallGraph;
import com.vidnyan.rpax.domain.invocation.InvocationKind;
import com.vidnyan.rpax.domain.invocation.InvocationRecord;
import com.vidnyan.rpax.domain.pseudocode.PseudocodeExpander.CycleHandling;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.vidnyan.rpax.domain.graph.GraphFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class PseudocodeExpanderTest {

    private static final String INVOKE_NODE = "/Sequence[0]/InvokeWorkflowFile[0]";
    private static final String PICK_NODE = "/Sequence[0]/InvokeWorkflowFile[1]";

    // Main -> Flows/A -> Flows/B -> Flows/A, plus a dynamic call from Main
    private final CallGraph graph = build(entries("Main", "Flows/A", "Flows/B"), List.of("Main.xaml"), List.of(
            call(InvocationKind.STATIC, "Main", "Flows/A.xaml", INVOKE_NODE),
            call(InvocationKind.DYNAMIC, "Main", "[Path.Combine(dir, name)]", PICK_NODE),
            call(InvocationKind.STATIC, "Flows/A", "Flows/B.xaml", INVOKE_NODE),
            call(InvocationKind.STATIC, "Flows/B", "Flows/A.xaml", INVOKE_NODE)));

    private static InvocationRecord call(InvocationKind kind, String from, String to, String nodeId) {
        return new InvocationRecord(kind, from, to, Map.of(), "Call", to, nodeId);
    }

    private static PseudocodeEntry entry(int indent, String name, String type, String nodeId, boolean invocation) {
        return new PseudocodeEntry(indent, name, type, nodeId, "id-" + nodeId, indent, true, invocation, null,
                PseudocodeGenerator.formatLine(indent, name, type, nodeId));
    }

    private static WorkflowPseudocode outline(String workflowId) {
        return new WorkflowPseudocode(workflowId, List.of(
                entry(0, workflowId, "Sequence", "/Sequence[0]", false),
                entry(1, "Call", "InvokeWorkflowFile", INVOKE_NODE, true)), 2, List.of(), null);
    }

    private static Map<String, WorkflowPseudocode> outlines(String... workflowIds) {
        Map<String, WorkflowPseudocode> outlines = new LinkedHashMap<>();
        for (String workflowId : workflowIds) {
            outlines.put(workflowId, outline(workflowId));
        }
        return outlines;
    }

    @Test
    void expand_ShouldInlineInvokedWorkflowsAndMarkCycle() {
        // Arrange
        PseudocodeExpander expander = new PseudocodeExpander(graph, 3, CycleHandling.DETECT_AND_MARK);

        // Act
        List<String> lines = expander.expand("Main", outlines("Main", "Flows/A", "Flows/B"));

        // Assert
        assertEquals(List.of(
                "- [Main] Sequence (Path: /Sequence[0])",
                "  - [Call] InvokeWorkflowFile (Path: /Sequence[0]/InvokeWorkflowFile[0])",
                "    - [Flows/A] Sequence (Path: /Sequence[0])",
                "      - [Call] InvokeWorkflowFile (Path: /Sequence[0]/InvokeWorkflowFile[0])",
                "        - [Flows/B] Sequence (Path: /Sequence[0])",
                "          - [Call] InvokeWorkflowFile (Path: /Sequence[0]/InvokeWorkflowFile[0])",
                "            [CYCLE DETECTED: Flows/A] (already expanded above)"), lines);
    }

    @Test
    void expand_ShouldStopAtDepthLimit() {
        PseudocodeExpander expander = new PseudocodeExpander(graph, 1, CycleHandling.DETECT_AND_MARK);

        List<String> lines = expander.expand("Main", outlines("Main", "Flows/A", "Flows/B"));

        assertEquals(5, lines.size());
        assertEquals("        [DEPTH LIMIT REACHED: Flows/B] (max depth: 1)", lines.get(4));
    }

    @Test
    void expand_ShouldNotInlineAtDepthZero() {
        PseudocodeExpander expander = new PseudocodeExpander(graph, 0, CycleHandling.DETECT_AND_MARK);

        List<String> lines = expander.expand("Main", outlines("Main", "Flows/A", "Flows/B"));

        assertEquals(List.of(
                "- [Main] Sequence (Path: /Sequence[0])",
                "  - [Call] InvokeWorkflowFile (Path: /Sequence[0]/InvokeWorkflowFile[0])",
                "    [DEPTH LIMIT REACHED: Flows/A] (max depth: 0)"), lines);
    }

    @Test
    void expand_ShouldMarkMissingPseudocode() {
        PseudocodeExpander expander = new PseudocodeExpander(graph, 3, CycleHandling.DETECT_AND_MARK);

        List<String> lines = expander.expand("Main", outlines("Main", "Flows/A"));

        assertEquals("        [MISSING WORKFLOW: Flows/B] (pseudocode not found)", lines.get(lines.size() - 1));
    }

    @Test
    void expand_ShouldFollowCycleHandling() {
        Map<String, WorkflowPseudocode> outlines = outlines("Main", "Flows/A", "Flows/B");

        List<String> stopped = new PseudocodeExpander(graph, 3, CycleHandling.DETECT_AND_STOP)
                .expand("Main", outlines);
        List<String> ignored = new PseudocodeExpander(graph, 3, CycleHandling.IGNORE)
                .expand("Main", outlines);

        assertEquals("            [CYCLE DETECTED: Flows/A] (expansion stopped)", stopped.get(stopped.size() - 1));
        assertEquals(6, ignored.size());
        assertTrue(ignored.stream().noneMatch(line -> line.contains("CYCLE")));
    }

    @Test
    void expand_ShouldLeaveDynamicInvocationsUnexpanded() {
        // Arrange
        Map<String, WorkflowPseudocode> outlines = outlines("Flows/A", "Flows/B");
        outlines.put("Main", new WorkflowPseudocode("Main", List.of(
                entry(0, "Main", "Sequence", "/Sequence[0]", false),
                entry(1, "Pick", "InvokeWorkflowFile", PICK_NODE, true)), 2, List.of(), null));
        PseudocodeExpander expander = new PseudocodeExpander(graph, 3, CycleHandling.DETECT_AND_MARK);

        // Act
        List<String> lines = expander.expand("Main", outlines);

        // Assert
        assertEquals(outlines.get("Main").lines(), lines);
    }

    @Test
    void expand_ShouldReportUnknownRoot() {
        PseudocodeExpander expander = new PseudocodeExpander(graph, 3, CycleHandling.DETECT_AND_MARK);

        assertEquals(List.of("[MISSING WORKFLOW: Nowhere] (pseudocode not found)"),
                expander.expand("Nowhere", Map.of()));
    }

    @Test
    void constructor_ShouldRejectNegativeDepth() {
        assertThrows(IllegalArgumentException.class,
                () -> new PseudocodeExpander(graph, -1, CycleHandling.DETECT_AND_MARK));
    }
}
