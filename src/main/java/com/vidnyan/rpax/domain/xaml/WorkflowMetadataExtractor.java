package com.vidnyan.rpax.domain.xaml;

import com.vidnyan.rpax.domain.model.ArgumentDirection;
import com.vidnyan.rpax.domain.model.WorkflowArgument;
import com.vidnyan.rpax.domain.model.WorkflowDocument;
import com.vidnyan.rpax.domain.model.WorkflowVariable;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Workflow-level extraction: arguments, variables, imports, namespaces, assembly references,
 * expression language and root annotation. Independent of the activity tree build.
 */
public class WorkflowMetadataExtractor {

    public static final String VISUAL_BASIC = "VisualBasic";
    public static final String CSHARP = "CSharp";

    /** Containers that own variables declared inside them. */
    public static final Set<String> CORE_VISUAL_ACTIVITIES = Set.of(
            "Sequence", "Flowchart", "StateMachine", "TryCatch", "Parallel", "ParallelForEach",
            "ForEach", "While", "DoWhile", "If", "Switch", "InvokeWorkflowFile", "Assign",
            "Delay", "RetryScope", "Pick", "PickBranch", "MultipleAssign", "LogMessage",
            "WriteLine", "InputDialog", "MessageBox", "InvokeMethod", "InvokeCode"
    );

    private static final String EXPRESSION_EDITOR = "ExpressionActivityEditor.ExpressionActivityEditor";
    private static final String NAMESPACES_FOR_IMPLEMENTATION = "TextExpression.NamespacesForImplementation";
    private static final String REFERENCES_FOR_IMPLEMENTATION = "TextExpression.ReferencesForImplementation";

    private final String defaultLanguage;

    public WorkflowMetadataExtractor(String defaultLanguage) {
        this.defaultLanguage = defaultLanguage;
    }

    /**
     * Extract the document for a parsed root element.
     * @param fallbackDisplayName used when no visible activity carries a DisplayName
     */
    public WorkflowDocument extract(Element root, String workflowId, String filePath, String fallbackDisplayName) {
        List<Element> elements = XamlNames.preOrder(root);
        String rootAnnotation = rootAnnotation(root, elements);

        return new WorkflowDocument(
                workflowId,
                filePath,
                displayName(elements, fallbackDisplayName),
                rootAnnotation,
                rootAnnotation,
                expressionLanguage(root, elements),
                namespaces(root),
                assemblyReferences(elements),
                imports(elements),
                arguments(root, elements),
                variables(elements)
        );
    }

    /**
     * Declared namespaces merged over the standard prefix table.
     */
    public Map<String, String> namespaces(Element root) {
        Map<String, String> namespaces = new LinkedHashMap<>(XamlNamespaces.STANDARD);
        namespaces.putAll(XamlNames.namespaceDeclarations(root));
        return namespaces;
    }

    public String expressionLanguage(Element root, List<Element> elements) {
        String editor = XamlNames.attribute(root, EXPRESSION_EDITOR);
        if (editor != null) {
            return editor.contains(CSHARP) || editor.contains("C#") ? CSHARP : VISUAL_BASIC;
        }
        for (Element element : elements) {
            String tag = XamlNames.localName(element);
            if (tag.contains(CSHARP)) {
                return CSHARP;
            }
            if (tag.contains(VISUAL_BASIC)) {
                return VISUAL_BASIC;
            }
        }
        return defaultLanguage;
    }

    public String rootAnnotation(Element root, List<Element> elements) {
        String annotation = ActivityExtractor.annotationOf(root);
        if (annotation != null) {
            return annotation;
        }
        return elements.stream()
                .filter(e -> "Sequence".equals(XamlNames.localName(e)))
                .findFirst()
                .map(ActivityExtractor::annotationOf)
                .orElse(null);
    }

    private String displayName(List<Element> elements, String fallback) {
        return elements.stream()
                .filter(VisibilityClassifier::isVisible)
                .map(e -> XamlNames.attribute(e, "DisplayName"))
                .filter(name -> name != null && !name.isBlank())
                .findFirst()
                .orElse(fallback);
    }

    private List<String> assemblyReferences(List<Element> elements) {
        Set<String> references = new LinkedHashSet<>(textsUnder(elements, REFERENCES_FOR_IMPLEMENTATION));
        for (Element element : elements) {
            if (XamlNames.localName(element).endsWith("AssemblyReference")) {
                String text = XamlNames.directText(element);
                String reference = text != null ? text : XamlNames.attribute(element, "Assembly");
                if (reference != null && !reference.isBlank()) {
                    references.add(reference.trim());
                }
            }
        }
        return new ArrayList<>(references);
    }

    private List<String> imports(List<Element> elements) {
        return new ArrayList<>(textsUnder(elements, NAMESPACES_FOR_IMPLEMENTATION));
    }

    /**
     * Texts of all elements nested under the member elements with the given tag.
     */
    private static Set<String> textsUnder(List<Element> elements, String memberTag) {
        Set<String> texts = new LinkedHashSet<>();
        for (Element element : elements) {
            if (memberTag.equals(XamlNames.localName(element))) {
                for (Element nested : XamlNames.preOrder(element)) {
                    String text = XamlNames.directText(nested);
                    if (nested != element && text != null) {
                        texts.add(text);
                    }
                }
            }
        }
        return texts;
    }

    private List<WorkflowArgument> arguments(Element root, List<Element> elements) {
        Map<String, String> rootAttributes = XamlNames.attributes(root);
        List<WorkflowArgument> arguments = new ArrayList<>();
        for (Element element : elements) {
            if (!"Property".equals(XamlNames.localName(element)) || !isMembersChild(element)) {
                continue;
            }
            String name = XamlNames.attribute(element, "Name");
            if (name == null || name.isBlank()) {
                continue;
            }
            String type = XamlNames.attribute(element, "Type");
            arguments.add(new WorkflowArgument(
                    name,
                    type,
                    ArgumentDirection.fromTypeSignature(type),
                    defaultValue(element, name, rootAttributes),
                    ActivityExtractor.annotationOf(element)));
        }
        return arguments;
    }

    private static boolean isMembersChild(Element property) {
        Node parent = property.getParentNode();
        return parent instanceof Element p && "Members".equals(XamlNames.localName(p));
    }

    /**
     * Default from the property itself, else from a {@code this:Class.name} attribute on the root.
     */
    private static String defaultValue(Element property, String name, Map<String, String> rootAttributes) {
        String value = XamlNames.attribute(property, "default");
        if (value == null) {
            value = XamlNames.attribute(property, "Default");
        }
        if (value == null) {
            value = XamlNames.directText(property);
        }
        if (value == null) {
            for (Map.Entry<String, String> attribute : rootAttributes.entrySet()) {
                if (XamlNames.strip(attribute.getKey()).endsWith("." + name)) {
                    return attribute.getValue();
                }
            }
        }
        return value;
    }

    private List<WorkflowVariable> variables(List<Element> elements) {
        List<WorkflowVariable> variables = new ArrayList<>();
        for (Element element : elements) {
            String tag = XamlNames.localName(element);
            if (!tag.endsWith("Variable") || XamlNames.isPropertyElement(tag)) {
                continue;
            }
            String name = XamlNames.attribute(element, "Name");
            if (name == null || name.isBlank()) {
                continue;
            }
            String type = XamlNames.attribute(element, "TypeArguments");
            String defaultValue = XamlNames.attribute(element, "Default");
            if (defaultValue == null) {
                defaultValue = XamlNames.directText(element);
            }
            variables.add(new WorkflowVariable(
                    name,
                    type != null ? type : "Object",
                    defaultValue,
                    scopeOf(element)));
        }
        return variables;
    }

    /**
     * Nearest enclosing core container tag, or the workflow scope.
     */
    private static String scopeOf(Element variable) {
        Node current = variable.getParentNode();
        while (current instanceof Element element) {
            String tag = XamlNames.localName(element);
            if (CORE_VISUAL_ACTIVITIES.contains(tag)) {
                return tag;
            }
            current = element.getParentNode();
        }
        return WorkflowVariable.WORKFLOW_SCOPE;
    }
}
