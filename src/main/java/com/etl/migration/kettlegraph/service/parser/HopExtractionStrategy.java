package com.etl.migration.kettlegraph.service.parser;

import com.etl.migration.kettlegraph.dto.graph.WorkflowEdge;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural patterns under which authoring tools place the hop list of a document.
 *
 * Only entries carrying both a source and a target count as hops; an entry such as the
 * {@code <order>} wrapper itself therefore never produces an edge under {@link #FLAT_ORDER}.
 */
public enum HopExtractionStrategy {

    /** order[] where each order element is itself a hop */
    FLAT_ORDER {
        @Override
        List<JsonNode> candidates(JsonNode root) {
            return PropertyBag.list(root, "order");
        }
    },

    /** order[0].hop[] */
    ORDER_NESTED_HOP {
        @Override
        List<JsonNode> candidates(JsonNode root) {
            return PropertyBag.list(root, "order.hop");
        }
    },

    /** hops[0].hop[] */
    HOPS_NESTED_HOP {
        @Override
        List<JsonNode> candidates(JsonNode root) {
            return PropertyBag.list(root, "hops.hop");
        }
    },

    /** hops[] where each hops element is itself a hop */
    FLAT_HOPS {
        @Override
        List<JsonNode> candidates(JsonNode root) {
            return PropertyBag.list(root, "hops");
        }
    };

    public static final String DISABLED_MARKER = "N";

    abstract List<JsonNode> candidates(JsonNode root);

    /**
     * Edges found under this pattern, with ids hop_0, hop_1, ...
     */
    public List<WorkflowEdge> extract(JsonNode root) {
        List<WorkflowEdge> edges = new ArrayList<>();
        for (JsonNode candidate : candidates(root)) {
            WorkflowEdge edge = toEdge(candidate, "hop_" + edges.size());
            if (edge != null) {
                edges.add(edge);
            }
        }
        return edges;
    }

    /**
     * Converts one hop element, or returns null when it lacks a source or a target
     */
    static WorkflowEdge toEdge(JsonNode hop, String id) {
        String from = PropertyBag.text(hop, "from");
        String to = PropertyBag.text(hop, "to");
        if (from == null || to == null) {
            return null;
        }
        return WorkflowEdge.builder()
                .id(id)
                .from(from)
                .to(to)
                .enabled(!DISABLED_MARKER.equals(PropertyBag.text(hop, "enabled")))
                .condition(conditionOf(hop))
                .build();
    }

    private static String conditionOf(JsonNode hop) {
        if ("Y".equalsIgnoreCase(PropertyBag.text(hop, "unconditional"))) {
            return "unconditional";
        }
        String evaluation = PropertyBag.text(hop, "evaluation");
        if (evaluation == null) {
            return null;
        }
        return "Y".equalsIgnoreCase(evaluation) ? "success" : "failure";
    }
}
