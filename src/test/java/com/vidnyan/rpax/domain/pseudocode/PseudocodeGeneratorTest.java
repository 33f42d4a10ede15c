package com.vidnyan.rpax.domain.pseudocode;

import com.vidnyan.rpax.domain.model.ActivityTree;
import com.vidnyan.rpax.domain.xaml.ActivityExtractor;
import com.vidnyan.rpax.domain.xaml.ActivityTreeBuilder;
import com.vidnyan.rpax.domain.xaml.ExpressionExtractor;
import com.vidnyan.rpax.domain.xaml.XamlFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PseudocodeGeneratorTest {

    private final PseudocodeGenerator generator = new PseudocodeGenerator();

    private static ActivityTree tree(String body) {
        ActivityExtractor extractor = new ActivityExtractor(new ExpressionExtractor("VisualBasic"), 100);
        return new ActivityTreeBuilder(extractor, 100)
                .build(XamlFixtures.parse(XamlFixtures.workflow(body)), "proj-1234567890", "Main");
    }

    @Test
    void generate_ShouldIndentChildrenInDocumentOrder() {
        // Arrange
        ActivityTree tree = tree("<Sequence DisplayName=\"Main\">"
                + "<Sequence DisplayName=\"Prepare\"><Assign DisplayName=\"Set x\"/>"
                + "<ui:LogMessage DisplayName=\"Log x\" Message=\"[x]\"/></Sequence>"
                + "<ui:InvokeWorkflowFile DisplayName=\"Login\" WorkflowFileName=\"Flows\\Login.xaml\"/>"
                + "</Sequence>");

        // Act
        WorkflowPseudocode pseudocode = generator.generate("Main", tree);

        // Assert
        assertEquals(List.of(
                "- [Main] Sequence (Path: /Sequence[0])",
                "  - [Prepare] Sequence (Path: /Sequence[0]/Sequence[0])",
                "    - [Set x] Assign (Path: /Sequence[0]/Sequence[0]/Assign[0])",
                "    - [Log x] LogMessage (Path: /Sequence[0]/Sequence[0]/LogMessage[0])",
                "  - [Login] InvokeWorkflowFile (Path: /Sequence[0]/InvokeWorkflowFile[0])"), pseudocode.lines());
        assertEquals(tree.size(), pseudocode.activityCount());
        assertFalse(pseudocode.hasError());

        PseudocodeEntry invoke = pseudocode.entries().get(4);
        assertTrue(invoke.invocation());
        assertEquals("Flows\\Login.xaml", invoke.invocationTarget());
        assertEquals(1, invoke.indent());
    }

    @Test
    void generate_ShouldOutlineEveryTopLevelActivity() {
        ActivityTree tree = tree("<Sequence DisplayName=\"First\"/><Sequence DisplayName=\"Second\"/>");

        WorkflowPseudocode pseudocode = generator.generate("Main", tree);

        assertEquals(List.of(
                "- [First] Sequence (Path: /Sequence[0])",
                "- [Second] Sequence (Path: /Sequence[1])"), pseudocode.lines());
    }

    @Test
    void generate_ShouldReportMissingTree() {
        WorkflowPseudocode pseudocode = generator.generate("Broken", null);

        assertTrue(pseudocode.hasError());
        assertEquals(0, pseudocode.totalLines());
        assertEquals("# No pseudocode available for Broken", pseudocode.renderText());
    }

    @Test
    void formatLine_ShouldOmitBlankDisplayName() {
        assertEquals("    - Assign (Path: /Sequence[0]/Assign[0])",
                PseudocodeGenerator.formatLine(2, " ", "Assign", "/Sequence[0]/Assign[0]"));
        assertEquals("- [Set] Assign (Path: /Assign[0])",
                PseudocodeGenerator.formatLine(0, "Set", "Assign", "/Assign[0]"));
    }
}
