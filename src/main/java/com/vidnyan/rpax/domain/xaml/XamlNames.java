package com.vidnyan.rpax.domain.xaml;

import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Namespace stripping and DOM access helpers for XAML elements.
 */
public final class XamlNames {

    private XamlNames() {
    }

    /**
     * Strip a Clark-notation ({@code {uri}Tag}) or prefixed ({@code ui:Tag}) name.
     */
    public static String strip(String qualifiedName) {
        if (qualifiedName == null) {
            return null;
        }
        String name = qualifiedName;
        int brace = name.lastIndexOf('}');
        if (brace >= 0) {
            name = name.substring(brace + 1);
        }
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    /**
     * Namespace-free tag of an element or attribute.
     */
    public static String localName(Node node) {
        String local = node.getLocalName();
        return local != null ? local : strip(node.getNodeName());
    }

    /**
     * Member part of a property element name: {@code If.Then} → {@code Then}.
     */
    public static String memberName(String localTag) {
        int dot = localTag.lastIndexOf('.');
        return dot >= 0 ? localTag.substring(dot + 1) : localTag;
    }

    /**
     * Property elements ({@code Owner.Member}) describe a member of their parent, not an activity.
     */
    public static boolean isPropertyElement(String localTag) {
        return localTag.indexOf('.') > 0;
    }

    public static boolean isNamespaceDeclaration(Attr attr) {
        return XamlNamespaces.XMLNS.equals(attr.getNamespaceURI())
                || attr.getName().startsWith("xmlns");
    }

    /**
     * Attributes keyed by qualified name in document order, namespace declarations excluded.
     */
    public static Map<String, String> attributes(Element element) {
        Map<String, String> attributes = new LinkedHashMap<>();
        NamedNodeMap map = element.getAttributes();
        for (int i = 0; i < map.getLength(); i++) {
            Attr attr = (Attr) map.item(i);
            if (!isNamespaceDeclaration(attr)) {
                attributes.put(attr.getName(), attr.getValue());
            }
        }
        return attributes;
    }

    /**
     * Namespace declarations of an element, keyed by prefix ("" for the default namespace).
     */
    public static Map<String, String> namespaceDeclarations(Element element) {
        Map<String, String> declarations = new LinkedHashMap<>();
        NamedNodeMap map = element.getAttributes();
        for (int i = 0; i < map.getLength(); i++) {
            Attr attr = (Attr) map.item(i);
            if (isNamespaceDeclaration(attr)) {
                String name = attr.getName();
                declarations.put(name.contains(":") ? name.substring(name.indexOf(':') + 1) : "", attr.getValue());
            }
        }
        return declarations;
    }

    /**
     * Look up an attribute by its namespace-free name.
     */
    public static String attribute(Element element, String localName) {
        NamedNodeMap map = element.getAttributes();
        for (int i = 0; i < map.getLength(); i++) {
            Attr attr = (Attr) map.item(i);
            if (!isNamespaceDeclaration(attr) && localName.equals(localName(attr))) {
                return attr.getValue();
            }
        }
        return null;
    }

    public static List<Element> childElements(Element element) {
        List<Element> children = new ArrayList<>();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element child) {
                children.add(child);
            }
        }
        return children;
    }

    /**
     * Text directly under the element (not descendants), trimmed; null when blank.
     */
    public static String directText(Element element) {
        StringBuilder text = new StringBuilder();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.TEXT_NODE || node.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(node.getNodeValue());
            }
        }
        String trimmed = text.toString().trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * The element and all its descendants in document order, collected without recursion.
     */
    public static List<Element> preOrder(Element root) {
        List<Element> ordered = new ArrayList<>();
        Deque<Element> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Element element = stack.pop();
            ordered.add(element);
            List<Element> children = childElements(element);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return ordered;
    }

    /**
     * Depth of the deepest element below (and including) the given one.
     */
    public static int maxDepth(Element root) {
        int max = 0;
        List<Element> level = List.of(root);
        while (!level.isEmpty()) {
            max++;
            List<Element> next = new ArrayList<>();
            for (Element element : level) {
                next.addAll(childElements(element));
            }
            level = next;
        }
        return max;
    }
}
