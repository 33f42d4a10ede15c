package com.vidnyan.rpax.domain.xaml;

import org.w3c.dom.Element;

import java.util.Map;
import java.util.Set;

/**
 * Decides whether a XAML element is an activity shown in the workflow designer
 * or structural/technical markup. Stateless.
 */
public final class VisibilityClassifier {

    /** Tags that never represent a visible activity. Matched on the full tag and on the member part. */
    public static final Set<String> BLACKLIST = Set.of(
            "Members", "HintSize", "Property", "TypeArguments", "WorkflowFileInfo",
            "Annotation", "ViewState", "Collection", "Dictionary", "ActivityAction",
            "Then", "Else", "Catches", "Variables", "Arguments",
            "VisualBasic.Settings",
            "TextExpression.NamespacesForImplementation",
            "TextExpression.ReferencesForImplementation",
            "AssemblyReference",
            "WorkflowViewStateService.ViewState",
            "VirtualizedContainerService.HintSize",
            "WorkflowViewState.IdRef",
            "Annotation.AnnotationText",
            "ViewStateData"
    );

    /** Containers that are visible even without a DisplayName. */
    public static final Set<String> VISUAL_CONTAINERS = Set.of(
            "Sequence", "TryCatch", "Flowchart", "Parallel", "StateMachine"
    );

    private VisibilityClassifier() {
    }

    public static boolean isBlacklisted(String localTag) {
        return BLACKLIST.contains(localTag) || BLACKLIST.contains(XamlNames.memberName(localTag));
    }

    /**
     * Classify an element from its namespace-free tag, attributes and namespace URI.
     */
    public static boolean isVisible(String localTag, Map<String, String> attributes, String namespaceUri) {
        if (isBlacklisted(localTag)) {
            return false;
        }
        if (VISUAL_CONTAINERS.contains(localTag)) {
            return true;
        }
        if (attributes.keySet().stream().anyMatch(name -> "DisplayName".equals(XamlNames.strip(name)))) {
            return true;
        }
        // member syntax such as ui:InvokeWorkflowFile.Arguments shares the activity namespace
        if (XamlNames.isPropertyElement(localTag)) {
            return false;
        }
        return XamlNamespaces.UIPATH_ACTIVITIES.equals(namespaceUri);
    }

    public static boolean isVisible(Element element) {
        return isVisible(XamlNames.localName(element), XamlNames.attributes(element), element.getNamespaceURI());
    }
}
