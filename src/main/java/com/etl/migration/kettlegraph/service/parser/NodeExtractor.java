package com.etl.migration.kettlegraph.service.parser;

import com.etl.migration.kettlegraph.dto.graph.NodePosition;
import com.etl.migration.kettlegraph.dto.graph.WorkflowNode;
import com.etl.migration.kettlegraph.model.DocumentKind;
import com.etl.migration.kettlegraph.model.NodeKind;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces uniform nodes from the steps of a transformation or the entries of a job.
 * Missing fields fall back to defaults; a single bad step never fails the document.
 */
@Component
@Slf4j
public class NodeExtractor {

    static final String UNKNOWN_TYPE = "unknown";

    // Job entry types with a fixed role
    private static final String SPECIAL_ENTRY_TYPE = "SPECIAL";
    private static final String SUCCESS_ENTRY_TYPE = "SUCCESS";

    public List<WorkflowNode> extract(ParsedTree tree) {
        return tree.getKind() == DocumentKind.TRANSFORMATION
                ? extractSteps(tree.getRoot())
                : extractEntries(tree.getRoot());
    }

    private List<WorkflowNode> extractSteps(JsonNode transformation) {
        List<JsonNode> steps = PropertyBag.list(transformation, "step");
        List<WorkflowNode> nodes = new ArrayList<>(steps.size());
        for (int index = 0; index < steps.size(); index++) {
            JsonNode step = steps.get(index);
            String name = PropertyBag.text(step, "name");
            nodes.add(WorkflowNode.builder()
                    .id(name != null ? name : "step_" + index)
                    .name(name != null ? name : "Step " + (index + 1))
                    .kind(NodeKind.STEP)
                    .stepType(typeOf(step))
                    .description(PropertyBag.text(step, "description"))
                    .position(position(step, "GUI.xloc", "GUI.yloc"))
                    .properties(step.deepCopy())
                    .build());
        }
        return nodes;
    }

    private List<WorkflowNode> extractEntries(JsonNode job) {
        List<JsonNode> entries = PropertyBag.list(job, "entries.entry");
        List<WorkflowNode> nodes = new ArrayList<>(entries.size());
        for (int index = 0; index < entries.size(); index++) {
            JsonNode entry = entries.get(index);
            String name = PropertyBag.text(entry, "name");
            String type = typeOf(entry);
            nodes.add(WorkflowNode.builder()
                    .id(name != null ? name : "entry_" + index)
                    .name(name != null ? name : "Entry " + (index + 1))
                    .kind(entryKind(type, entry))
                    .stepType(type)
                    .description(PropertyBag.text(entry, "description"))
                    .position(position(entry, "xloc", "yloc"))
                    .properties(entry.deepCopy())
                    .build());
        }
        return nodes;
    }

    private String typeOf(JsonNode node) {
        String type = PropertyBag.text(node, "type");
        return type != null ? type : UNKNOWN_TYPE;
    }

    private NodeKind entryKind(String type, JsonNode entry) {
        if (SUCCESS_ENTRY_TYPE.equalsIgnoreCase(type)) {
            return NodeKind.END;
        }
        if (SPECIAL_ENTRY_TYPE.equalsIgnoreCase(type)
                && ("Y".equalsIgnoreCase(PropertyBag.text(entry, "start"))
                    || "START".equalsIgnoreCase(PropertyBag.text(entry, "name")))) {
            return NodeKind.START;
        }
        return NodeKind.JOB_ENTRY;
    }

    private NodePosition position(JsonNode node, String xPath, String yPath) {
        return NodePosition.builder()
                .x(coordinate(PropertyBag.text(node, xPath)))
                .y(coordinate(PropertyBag.text(node, yPath)))
                .build();
    }

    private int coordinate(String value) {
        if (value == null) {
            return NodePosition.DEFAULT_COORDINATE;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.debug("Non-numeric position '{}', using default", value);
            return NodePosition.DEFAULT_COORDINATE;
        }
    }
}
