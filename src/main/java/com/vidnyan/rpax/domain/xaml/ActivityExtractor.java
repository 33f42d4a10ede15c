package com.vidnyan.rpax.domain.xaml;

import com.vidnyan.rpax.domain.model.Activity;
import com.vidnyan.rpax.domain.model.AttributeValue;
import com.vidnyan.rpax.domain.model.Expression;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Extracts the business data of one visible activity element: arguments, properties,
 * technical metadata, nested configuration, expressions, selectors and identity.
 */
public class ActivityExtractor {

    /** Attribute names surfaced as business properties. */
    public static final Set<String> BUSINESS_PROPERTIES = Set.of(
            "DisplayName", "Value", "Text", "Message", "Level", "Result",
            "Condition", "Expression", "AssetName", "QueueName", "FilePath",
            "WorkbookPath", "SheetName", "Range", "ActivateBefore", "ClickType",
            "DelayAfter", "DelayBefore", "TimeoutMS", "WaitForReady", "ContinueOnError"
    );

    /** Fragments of attribute names that denote designer metadata. */
    public static final List<String> METADATA_MARKERS = List.of(
            "ViewState", "HintSize", "IdRef", "VirtualizedContainerService"
    );

    /** Configuration keys that hold UI selectors. */
    public static final Set<String> SELECTOR_FIELDS = Set.of(
            "FullSelector", "FuzzySelector", "Selector", "TargetSelector",
            "FullSelectorArgument", "FuzzySelectorArgument", "TargetAnchorable"
    );

    public static final String ANNOTATION_ATTRIBUTE = "Annotation.AnnotationText";
    private static final String WORKFLOW_FILE_NAME = "WorkflowFileName";

    private final ExpressionExtractor expressionExtractor;
    private final int maxConfigurationDepth;

    public ActivityExtractor(ExpressionExtractor expressionExtractor, int maxConfigurationDepth) {
        this.expressionExtractor = expressionExtractor;
        this.maxConfigurationDepth = maxConfigurationDepth;
    }

    /**
     * Position of an activity in its tree, decided by the tree builder.
     */
    public record Position(
        String projectId,
        String workflowId,
        String nodeId,
        int depth,
        String parentActivityId
    ) {}

    /**
     * Extract one activity.
     * @throws RuntimeException when the element cannot be interpreted; the caller records it
     */
    public Activity extract(Element element, Position position) {
        String activityType = XamlNames.localName(element);
        Map<String, String> rawAttributes = XamlNames.attributes(element);

        Map<String, String> arguments = extractArguments(rawAttributes);
        Map<String, AttributeValue> properties = extractProperties(rawAttributes);
        Map<String, String> metadata = extractMetadata(rawAttributes);
        Map<String, AttributeValue> configuration = extractConfiguration(element);

        List<Expression> expressions = expressionExtractor.extract(arguments, XamlNames.directText(element));
        List<String> variables = referencedVariables(expressions, arguments);
        Map<String, String> selectors = extractSelectors(arguments, configuration);

        String canonical = ActivityIdGenerator.canonicalContent(
                activityType, arguments, properties, configuration.keySet());
        String activityId = ActivityIdGenerator.activityId(
                position.projectId(), position.workflowId(), position.nodeId(), canonical);

        Node parent = element.getParentNode();
        String containerType = parent instanceof Element parentElement ? XamlNames.localName(parentElement) : null;

        return Activity.builder()
                .activityId(activityId)
                .workflowId(position.workflowId())
                .activityType(activityType)
                .displayName(arguments.get("DisplayName"))
                .nodeId(position.nodeId())
                .depth(position.depth())
                .parentActivityId(position.parentActivityId())
                .arguments(arguments)
                .configuration(configuration)
                .properties(properties)
                .metadata(metadata)
                .expressions(expressions)
                .variablesReferenced(variables)
                .selectors(selectors)
                .annotation(annotationOf(element))
                .visible(true)
                .containerType(containerType)
                .invocationTarget(invocationTarget(element, activityType, arguments))
                .invocationArguments(Activity.INVOKE_WORKFLOW_FILE.equals(activityType)
                        ? invocationArguments(element, arguments) : Map.of())
                .build();
    }

    /**
     * Annotation text attached to an element, entity-unescaped; null when absent.
     */
    public static String annotationOf(Element element) {
        String raw = XamlNames.attribute(element, ANNOTATION_ATTRIBUTE);
        return raw == null ? null : unescape(raw);
    }

    public static boolean isMetadataName(String attributeName) {
        return METADATA_MARKERS.stream().anyMatch(attributeName::contains);
    }

    private Map<String, String> extractArguments(Map<String, String> rawAttributes) {
        Map<String, String> arguments = new LinkedHashMap<>();
        rawAttributes.forEach((name, value) -> {
            if (!isMetadataName(name)) {
                arguments.put(XamlNames.strip(name), value);
            }
        });
        return arguments;
    }

    private Map<String, AttributeValue> extractProperties(Map<String, String> rawAttributes) {
        Map<String, AttributeValue> properties = new LinkedHashMap<>();
        rawAttributes.forEach((name, value) -> {
            String clean = XamlNames.strip(name);
            if (BUSINESS_PROPERTIES.contains(clean)) {
                properties.put(clean, AttributeValue.parse(value));
            }
        });
        return properties;
    }

    private Map<String, String> extractMetadata(Map<String, String> rawAttributes) {
        Map<String, String> metadata = new LinkedHashMap<>();
        rawAttributes.forEach((name, value) -> {
            if (isMetadataName(name)) {
                metadata.put(name, value);
            }
        });
        return metadata;
    }

    /**
     * Nested configuration from child markup. Child activities, variable declarations and
     * designer metadata are left out; repeated tags collapse into a list.
     */
    private Map<String, AttributeValue> extractConfiguration(Element element) {
        Map<String, AttributeValue> configuration = new LinkedHashMap<>();
        for (Element child : configurationChildren(element)) {
            put(configuration, XamlNames.localName(child), serialize(child, 1));
        }
        return configuration;
    }

    private List<Element> configurationChildren(Element element) {
        List<Element> children = new ArrayList<>();
        for (Element child : XamlNames.childElements(element)) {
            String tag = XamlNames.localName(child);
            if (tag.endsWith("Variable") || isMetadataName(tag) || VisibilityClassifier.isVisible(child)) {
                continue;
            }
            children.add(child);
        }
        return children;
    }

    private AttributeValue serialize(Element element, int depth) {
        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        XamlNames.attributes(element).forEach((name, value) -> {
            if (!isMetadataName(name)) {
                attributes.put(XamlNames.strip(name), AttributeValue.text(value));
            }
        });
        String text = XamlNames.directText(element);
        List<Element> children = depth < maxConfigurationDepth ? configurationChildren(element) : List.of();

        if (children.isEmpty()) {
            if (!attributes.isEmpty() && text != null) {
                Map<String, AttributeValue> leaf = new LinkedHashMap<>();
                leaf.put("attributes", AttributeValue.map(attributes));
                leaf.put("text", AttributeValue.text(text));
                return AttributeValue.map(leaf);
            }
            if (!attributes.isEmpty()) {
                return AttributeValue.map(attributes);
            }
            return AttributeValue.text(text);
        }

        Map<String, AttributeValue> node = new LinkedHashMap<>();
        if (!attributes.isEmpty()) {
            node.put("attributes", AttributeValue.map(attributes));
        }
        Map<String, AttributeValue> nested = new LinkedHashMap<>();
        for (Element child : children) {
            put(nested, XamlNames.localName(child), serialize(child, depth + 1));
        }
        node.put("children", AttributeValue.map(nested));
        return AttributeValue.map(node);
    }

    private static void put(Map<String, AttributeValue> target, String key, AttributeValue value) {
        AttributeValue existing = target.get(key);
        if (existing == null) {
            target.put(key, value);
        } else if (existing instanceof AttributeValue.ListValue list) {
            List<AttributeValue> items = new ArrayList<>(list.items());
            items.add(value);
            target.put(key, AttributeValue.list(items));
        } else {
            target.put(key, AttributeValue.list(List.of(existing, value)));
        }
    }

    private static List<String> referencedVariables(List<Expression> expressions, Map<String, String> arguments) {
        Set<String> variables = new TreeSet<>();
        expressions.forEach(e -> variables.addAll(e.variables()));
        for (String value : arguments.values()) {
            if (ExpressionExtractor.isExpression(value)) {
                variables.addAll(ExpressionExtractor.referencedVariables(value));
            }
        }
        return new ArrayList<>(variables);
    }

    private static Map<String, String> extractSelectors(Map<String, String> arguments,
                                                        Map<String, AttributeValue> configuration) {
        Map<String, String> selectors = new LinkedHashMap<>();
        arguments.forEach((name, value) -> {
            if (SELECTOR_FIELDS.contains(name)) {
                selectors.put(name, value);
            }
        });
        collectSelectors(AttributeValue.map(configuration), "", selectors);
        return selectors;
    }

    private static void collectSelectors(AttributeValue value, String path, Map<String, String> selectors) {
        if (value instanceof AttributeValue.MapValue map) {
            map.entries().forEach((key, nested) -> {
                String current = path.isEmpty() ? key : path + "." + key;
                if (SELECTOR_FIELDS.contains(key) && nested instanceof AttributeValue.TextValue text && text.value() != null) {
                    selectors.put(current, text.value());
                } else {
                    collectSelectors(nested, current, selectors);
                }
            });
        } else if (value instanceof AttributeValue.ListValue list) {
            for (int i = 0; i < list.items().size(); i++) {
                collectSelectors(list.items().get(i), path + "[" + i + "]", selectors);
            }
        }
    }

    private static String invocationTarget(Element element, String activityType, Map<String, String> arguments) {
        if (!Activity.INVOKE_WORKFLOW_FILE.equals(activityType)) {
            return null;
        }
        String fileName = arguments.get(WORKFLOW_FILE_NAME);
        if (fileName != null) {
            return fileName;
        }
        // property-element form: <ui:InvokeWorkflowFile.WorkflowFileName>...</...>
        for (Element child : XamlNames.childElements(element)) {
            if (WORKFLOW_FILE_NAME.equals(XamlNames.memberName(XamlNames.localName(child)))) {
                return XamlNames.directText(child);
            }
        }
        return null;
    }

    /**
     * Arguments handed to an invoked workflow: keyed children of the {@code *.Arguments}
     * member plus {@code arg_*} and {@code *Argument} attributes.
     */
    private static Map<String, String> invocationArguments(Element element, Map<String, String> arguments) {
        Map<String, String> passed = new LinkedHashMap<>();
        for (Element child : XamlNames.childElements(element)) {
            if (!XamlNames.localName(child).endsWith("Arguments")) {
                continue;
            }
            for (Element argument : XamlNames.childElements(child)) {
                String key = XamlNames.attribute(argument, "Key");
                if (key == null) {
                    continue;
                }
                String value = XamlNames.directText(argument);
                if (value == null) {
                    value = XamlNames.attribute(argument, "Value");
                }
                passed.put(key, value != null ? value : "");
            }
        }
        arguments.forEach((name, value) -> {
            if (name.startsWith("arg_") || (name.endsWith("Argument") && !SELECTOR_FIELDS.contains(name))) {
                passed.put(name, value);
            }
        });
        return passed;
    }

    static String unescape(String text) {
        return text.replace("&#xA;", "\n")
                .replace("&#10;", "\n")
                .replace("&#xD;", "\r")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }
}
