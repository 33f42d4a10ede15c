package com.vidnyan.rpax.domain.xaml;

import com.vidnyan.rpax.domain.model.ArgumentDirection;
import com.vidnyan.rpax.domain.model.WorkflowArgument;
import com.vidnyan.rpax.domain.model.WorkflowDocument;
import com.vidnyan.rpax.domain.model.WorkflowVariable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowMetadataExtractorTest {

    private static final String PROCESS = "<Activity x:Class=\"Process\"" + XamlFixtures.NAMESPACES
            + " xmlns:this=\"clr-namespace:\""
            + " this:Process.in_User=\"admin\""
            + " sap2010:ExpressionActivityEditor.ExpressionActivityEditor=\"C#\""
            + " sap2010:Annotation.AnnotationText=\"Processes one queue item\">"
            + "<x:Members>"
            + "<x:Property Name=\"in_User\" Type=\"InArgument(x:String)\"/>"
            + "<x:Property Name=\"out_Result\" Type=\"OutArgument(x:Int32)\"/>"
            + "<x:Property Name=\"io_State\" Type=\"InOutArgument(x:String)\"/>"
            + "</x:Members>"
            + "<TextExpression.NamespacesForImplementation>"
            + "<sco:Collection x:TypeArguments=\"x:String\"><x:String>System</x:String><x:String>System.Data</x:String></sco:Collection>"
            + "</TextExpression.NamespacesForImplementation>"
            + "<TextExpression.ReferencesForImplementation>"
            + "<sco:Collection x:TypeArguments=\"AssemblyReference\">"
            + "<AssemblyReference>System.Data</AssemblyReference>"
            + "<AssemblyReference>UiPath.System.Activities</AssemblyReference>"
            + "</sco:Collection>"
            + "</TextExpression.ReferencesForImplementation>"
            + "<Sequence DisplayName=\"Process Item\">"
            + "<Sequence.Variables><Variable x:TypeArguments=\"x:String\" Name=\"greeting\" Default=\"hi\"/></Sequence.Variables>"
            + "<ui:LogMessage Message=\"[greeting]\"/>"
            + "</Sequence>"
            + "</Activity>";

    private final WorkflowMetadataExtractor extractor = new WorkflowMetadataExtractor("VisualBasic");

    @Test
    void extract_ShouldReadWorkflowMetadata() {
        // Act
        WorkflowDocument document = extractor.extract(XamlFixtures.parse(PROCESS), "Process", "Process.xaml", "Process");

        // Assert
        assertEquals("Process", document.workflowId());
        assertEquals("Process Item", document.displayName());
        assertEquals("Processes one queue item", document.rootAnnotation());
        assertEquals(WorkflowMetadataExtractor.CSHARP, document.expressionLanguage());
        assertEquals(List.of("System", "System.Data"), document.imports());
        assertEquals(List.of("System.Data", "UiPath.System.Activities"), document.assemblyReferences());
        assertEquals(XamlNamespaces.UIPATH_ACTIVITIES, document.namespaces().get("ui"));
        assertEquals("clr-namespace:", document.namespaces().get("this"));
    }

    @Test
    void extract_ShouldReadArgumentsWithDirections() {
        WorkflowDocument document = extractor.extract(XamlFixtures.parse(PROCESS), "Process", "Process.xaml", "Process");

        List<WorkflowArgument> arguments = document.arguments();
        assertEquals(3, arguments.size());
        assertEquals(ArgumentDirection.IN, arguments.get(0).direction());
        assertEquals("admin", arguments.get(0).defaultValue());
        assertEquals(ArgumentDirection.OUT, arguments.get(1).direction());
        assertNull(arguments.get(1).defaultValue());
        assertEquals(ArgumentDirection.INOUT, arguments.get(2).direction());
        assertEquals(1, document.argumentsByDirection(ArgumentDirection.OUT).size());
    }

    @Test
    void extract_ShouldScopeVariablesToEnclosingContainer() {
        WorkflowDocument document = extractor.extract(XamlFixtures.parse(PROCESS), "Process", "Process.xaml", "Process");

        assertEquals(List.of(new WorkflowVariable("greeting", "x:String", "hi", "Sequence")), document.variables());
    }

    @Test
    void extract_ShouldFallBackWhenNothingIsDeclared() {
        // Arrange
        String xml = XamlFixtures.workflow("<Flowchart/>");

        // Act
        WorkflowDocument document = extractor.extract(XamlFixtures.parse(xml), "Empty", "Empty.xaml", "Empty");

        // Assert
        assertEquals("Empty", document.displayName());
        assertEquals(WorkflowMetadataExtractor.VISUAL_BASIC, document.expressionLanguage());
        assertTrue(document.arguments().isEmpty());
        assertTrue(document.variables().isEmpty());
        assertNull(document.rootAnnotation());
        assertTrue(document.namespaces().keySet().containsAll(XamlNamespaces.STANDARD.keySet()));
    }

    @Test
    void expressionLanguage_ShouldDetectSettingsElements() {
        String xml = XamlFixtures.workflow("<mva:VisualBasic.Settings xmlns:mva=\"urn:mva\"/><Sequence/>");

        WorkflowDocument document = new WorkflowMetadataExtractor(WorkflowMetadataExtractor.CSHARP)
                .extract(XamlFixtures.parse(xml), "Vb", "Vb.xaml", "Vb");

        assertEquals(WorkflowMetadataExtractor.VISUAL_BASIC, document.expressionLanguage());
    }
}
