package com.etl.migration.kettlegraph.service.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a DOM element into a Jackson tree in explicit-array form.
 *
 * Shape rules:
 *   - an element without attributes or child elements becomes its text
 *   - otherwise an object: attributes under "$", own non-blank text under "_",
 *     and every child element name mapped to the array of its occurrences in document order
 */
@Component
public class XmlTreeConverter {

    public static final String ATTRIBUTES_KEY = "$";
    public static final String TEXT_KEY = "_";

    private final JsonNodeFactory factory = JsonNodeFactory.instance;

    public JsonNode convert(Element element) {
        List<Element> children = childElements(element);
        NamedNodeMap attributes = element.getAttributes();
        String text = ownText(element);

        if (children.isEmpty() && attributes.getLength() == 0) {
            return TextNode.valueOf(text);
        }

        ObjectNode node = factory.objectNode();
        if (attributes.getLength() > 0) {
            ObjectNode attrs = node.putObject(ATTRIBUTES_KEY);
            for (int i = 0; i < attributes.getLength(); i++) {
                Node attribute = attributes.item(i);
                attrs.put(attribute.getNodeName(), attribute.getNodeValue());
            }
        }
        if (!text.isBlank()) {
            node.put(TEXT_KEY, children.isEmpty() ? text : text.trim());
        }

        for (Element child : children) {
            String name = child.getNodeName();
            JsonNode existing = node.get(name);
            ArrayNode values = existing instanceof ArrayNode ? (ArrayNode) existing : node.putArray(name);
            values.add(convert(child));
        }
        return node;
    }

    private List<Element> childElements(Element element) {
        List<Element> elements = new ArrayList<>();
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i) instanceof Element) {
                elements.add((Element) children.item(i));
            }
        }
        return elements;
    }

    private String ownText(Element element) {
        StringBuilder text = new StringBuilder();
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(child.getNodeValue());
            }
        }
        return text.toString();
    }
}
