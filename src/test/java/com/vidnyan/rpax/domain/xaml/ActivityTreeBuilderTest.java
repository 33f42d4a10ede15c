package com.vidnyan.rpax.domain.xaml;

import com.vidnyan.rpax.domain.model.Activity;
import com.vidnyan.rpax.domain.model.ActivityTree;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActivityTreeBuilderTest {

    private static final String PROJECT = "proj-1234567890";
    private static final String WORKFLOW = "Main";

    private ActivityTree build(String body, int maxDepth, TraversalContext context) {
        ActivityExtractor extractor = new ActivityExtractor(new ExpressionExtractor("VisualBasic"), maxDepth);
        return new ActivityTreeBuilder(extractor, maxDepth)
                .build(XamlFixtures.parse(XamlFixtures.workflow(body)), PROJECT, WORKFLOW, context);
    }

    private ActivityTree build(String body) {
        return build(body, ActivityTreeBuilder.DEFAULT_MAX_DEPTH, new TraversalContext());
    }

    private static List<String> nodeIds(ActivityTree tree) {
        return tree.activities().stream().map(Activity::nodeId).toList();
    }

    @Test
    void build_ShouldAssignHierarchicalNodeIds() {
        // Arrange
        String body = "<Sequence DisplayName=\"Main Sequence\">"
                + "<Assign DisplayName=\"Set x\"/>"
                + "<ui:LogMessage Level=\"Info\" Message=\"[x]\"/>"
                + "</Sequence>";

        // Act
        ActivityTree tree = build(body);

        // Assert
        assertEquals(List.of("/Sequence[0]", "/Sequence[0]/Assign[0]", "/Sequence[0]/LogMessage[0]"), nodeIds(tree));
        Activity sequence = tree.root();
        assertEquals("/Sequence[0]", sequence.nodeId());
        assertEquals(0, sequence.depth());
        assertEquals(1, tree.findByNodeId("/Sequence[0]/Assign[0]").orElseThrow().depth());
        assertEquals(2, tree.childrenOf(sequence.activityId()).size());
        assertFalse(tree.isSyntheticRoot());
    }

    @Test
    void build_ShouldIndexSiblingsPerTag() {
        String body = "<Sequence>"
                + "<ui:LogMessage Message=\"a\"/>"
                + "<Assign DisplayName=\"one\"/>"
                + "<ui:LogMessage Message=\"b\"/>"
                + "</Sequence>";

        ActivityTree tree = build(body);

        assertEquals(List.of("/Sequence[0]", "/Sequence[0]/LogMessage[0]", "/Sequence[0]/Assign[0]",
                "/Sequence[0]/LogMessage[1]"), nodeIds(tree));
    }

    @Test
    void build_ShouldUseMemberNameOfPropertyElements() {
        // Arrange
        String body = "<Sequence>"
                + "<If DisplayName=\"Check\" Condition=\"[count &gt; 0]\">"
                + "<If.Then><ui:LogMessage Message=\"yes\"/></If.Then>"
                + "<If.Else><ui:LogMessage Message=\"no\"/></If.Else>"
                + "</If>"
                + "</Sequence>";

        // Act
        ActivityTree tree = build(body);

        // Assert
        Activity branch = tree.findByNodeId("/Sequence[0]/If[0]").orElseThrow();
        Activity then = tree.findByNodeId("/Sequence[0]/If[0]/Then/LogMessage[0]").orElseThrow();
        Activity otherwise = tree.findByNodeId("/Sequence[0]/If[0]/Else/LogMessage[0]").orElseThrow();
        assertEquals(branch.activityId(), then.parentActivityId());
        assertEquals(branch.activityId(), otherwise.parentActivityId());
        assertEquals(2, then.depth());
        assertEquals("If.Then", then.containerType());
    }

    @Test
    void build_ShouldSkipDesignerMetadata() {
        // Arrange
        String body = "<Sequence>"
                + "<Sequence.Variables><Variable x:TypeArguments=\"x:String\" Name=\"name\"/></Sequence.Variables>"
                + "<sap:WorkflowViewStateService.ViewState><scg:Dictionary xmlns:scg=\"urn:scg\"/></sap:WorkflowViewStateService.ViewState>"
                + "<ui:LogMessage Message=\"hello\"/>"
                + "</Sequence>";
        TraversalContext context = new TraversalContext();

        // Act
        ActivityTree tree = build(body, ActivityTreeBuilder.DEFAULT_MAX_DEPTH, context);

        // Assert
        assertEquals(List.of("/Sequence[0]", "/Sequence[0]/LogMessage[0]"), nodeIds(tree));
        assertTrue(context.skippedElements() > 0);
        assertTrue(context.elementsProcessed() > tree.size());
    }

    @Test
    void build_ShouldKeepIdsStableUnderDesignerEdits() {
        // Arrange
        String original = "<Sequence sap2010:WorkflowViewState.IdRef=\"Sequence_1\">"
                + "<ui:LogMessage sap:VirtualizedContainerService.HintSize=\"200,40\" Message=\"hello\"/>"
                + "</Sequence>";
        String moved = "<Sequence sap2010:WorkflowViewState.IdRef=\"Sequence_9\">"
                + "<ui:LogMessage sap:VirtualizedContainerService.HintSize=\"640,88\" Message=\"hello\"/>"
                + "</Sequence>";
        String edited = "<Sequence sap2010:WorkflowViewState.IdRef=\"Sequence_1\">"
                + "<ui:LogMessage sap:VirtualizedContainerService.HintSize=\"200,40\" Message=\"goodbye\"/>"
                + "</Sequence>";

        // Act
        ActivityTree first = build(original);
        ActivityTree second = build(moved);
        ActivityTree third = build(edited);

        // Assert
        assertEquals(first.activities().get(0).activityId(), second.activities().get(0).activityId());
        assertEquals(first.activities().get(1).activityId(), second.activities().get(1).activityId());
        assertEquals(first.activities().get(0).activityId(), third.activities().get(0).activityId());
        assertNotEquals(first.activities().get(1).activityId(), third.activities().get(1).activityId());
    }

    @Test
    void build_ShouldTruncateBelowDepthLimit() {
        // Arrange
        String body = "<Sequence><Sequence><Sequence><Sequence/></Sequence></Sequence></Sequence>";
        TraversalContext context = new TraversalContext();

        // Act
        ActivityTree tree = build(body, 2, context);

        // Assert
        assertEquals(List.of("/Sequence[0]", "/Sequence[0]/Sequence[0]"), nodeIds(tree));
        assertEquals(1, tree.warnings().size());
        assertEquals(1, context.truncatedSubtrees());
        assertTrue(tree.errors().isEmpty());
    }

    @Test
    void build_ShouldIsolateFailedActivity() {
        // Arrange
        ActivityExtractor failing = new ActivityExtractor(new ExpressionExtractor("VisualBasic"), 10) {
            @Override
            public Activity extract(Element element, Position position) {
                if ("Parallel".equals(XamlNames.localName(element))) {
                    throw new IllegalStateException("unsupported");
                }
                return super.extract(element, position);
            }
        };
        String body = "<Sequence>"
                + "<Parallel><ui:LogMessage Message=\"inner\"/></Parallel>"
                + "<ui:LogMessage Message=\"after\"/>"
                + "</Sequence>";

        // Act
        ActivityTree tree = new ActivityTreeBuilder(failing, 10)
                .build(XamlFixtures.parse(XamlFixtures.workflow(body)), PROJECT, WORKFLOW);

        // Assert
        assertEquals(List.of("/Sequence[0]", "/Sequence[0]/Parallel[0]/LogMessage[0]", "/Sequence[0]/LogMessage[0]"),
                nodeIds(tree));
        assertEquals(1, tree.errors().size());
        assertEquals("/Sequence[0]/Parallel[0]", tree.errors().get(0).nodeId());
        Activity inner = tree.findByNodeId("/Sequence[0]/Parallel[0]/LogMessage[0]").orElseThrow();
        assertEquals(tree.root().activityId(), inner.parentActivityId());
    }

    @Test
    void build_ShouldCreateSyntheticRootForSeveralTopLevelActivities() {
        String body = "<Flowchart/><ui:LogMessage Message=\"loose\"/>";

        ActivityTree tree = build(body);

        assertTrue(tree.isSyntheticRoot());
        assertEquals(ActivityTree.SYNTHETIC_ROOT_TYPE, tree.root().activityType());
        assertEquals(2, tree.topLevel().size());
    }

    @Test
    void build_ShouldReturnEmptyTreeWithoutVisibleActivities() {
        ActivityTree tree = build("<x:Members/>");

        assertNull(tree.root());
        assertEquals(0, tree.size());
    }

    @Test
    void build_ShouldCaptureInvocationTargetAndArguments() {
        // Arrange
        String body = "<Sequence>"
                + "<ui:InvokeWorkflowFile DisplayName=\"Invoke Login\" WorkflowFileName=\"Flows\\Login.xaml\">"
                + "<ui:InvokeWorkflowFile.Arguments>"
                + "<InArgument x:TypeArguments=\"x:String\" x:Key=\"in_User\">[userName]</InArgument>"
                + "</ui:InvokeWorkflowFile.Arguments>"
                + "</ui:InvokeWorkflowFile>"
                + "</Sequence>";

        // Act
        ActivityTree tree = build(body);

        // Assert
        assertEquals(1, tree.invocations().size());
        Activity invoke = tree.invocations().get(0);
        assertEquals("/Sequence[0]/InvokeWorkflowFile[0]", invoke.nodeId());
        assertEquals("Flows\\Login.xaml", invoke.invocationTarget());
        assertEquals("[userName]", invoke.invocationArguments().get("in_User"));
    }
}
