package com.etl.migration.kettlegraph.service.parser;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read helpers over explicit-array value trees.
 *
 * Paths are dot separated ("GUI.xloc"); every segment takes the first element when the
 * value is an array, so both {@code {"from": ["A"]}} and {@code {"from": "A"}} resolve.
 */
public final class PropertyBag {

    private PropertyBag() {
    }

    /**
     * Value at a dotted path, or null when any segment is missing
     */
    public static JsonNode resolve(JsonNode node, String path) {
        JsonNode current = node;
        for (String segment : path.split("\\.")) {
            current = first(current, segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * Trimmed non-empty text at a dotted path, or null.
     * An element carrying attributes contributes its text content.
     */
    public static String text(JsonNode node, String path) {
        JsonNode value = resolve(node, path);
        if (value == null) {
            return null;
        }
        if (value.isObject()) {
            value = value.get(XmlTreeConverter.TEXT_KEY);
        }
        if (value == null || !value.isValueNode() || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * First non-empty text among the given paths, probed in order
     */
    public static String firstText(JsonNode node, List<String> paths) {
        for (String path : paths) {
            String text = text(node, path);
            if (text != null) {
                return text;
            }
        }
        return null;
    }

    /**
     * All occurrences of the last segment of a dotted path, e.g. "entries.entry"
     */
    public static List<JsonNode> list(JsonNode node, String path) {
        int lastDot = path.lastIndexOf('.');
        JsonNode parent = lastDot < 0 ? node : resolve(node, path.substring(0, lastDot));
        String key = lastDot < 0 ? path : path.substring(lastDot + 1);
        if (parent == null || !parent.isObject()) {
            return Collections.emptyList();
        }
        JsonNode value = parent.get(key);
        if (value == null || value.isNull()) {
            return Collections.emptyList();
        }
        if (!value.isArray()) {
            return List.of(value);
        }
        List<JsonNode> items = new ArrayList<>(value.size());
        value.forEach(items::add);
        return items;
    }

    public static boolean has(JsonNode node, String key) {
        return node != null && node.isObject() && node.has(key);
    }

    private static JsonNode first(JsonNode node, String key) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isArray()) {
            return value.size() > 0 ? value.get(0) : null;
        }
        return value;
    }
}
