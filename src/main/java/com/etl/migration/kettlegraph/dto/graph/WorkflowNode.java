package com.etl.migration.kettlegraph.dto.graph;

import com.etl.migration.kettlegraph.model.NodeKind;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A step of a transformation or an entry of a job.
 *
 * The property bag is the complete source subtree of the step/entry in explicit-array form
 * (every child element name maps to an array). The node keeps a private copy; every read of
 * {@link #getProperties()} returns a fresh copy, so changes made by a consumer never reach the node.
 */
@Value
@Builder
@Jacksonized
public class WorkflowNode {

    String id;              // Declared name, or step_<n> / entry_<n> when absent
    String name;            // Display name
    NodeKind kind;
    String stepType;        // Declared sub-type, e.g. TableInput, TRANS, SPECIAL
    String description;
    NodePosition position;
    JsonNode properties;

    public JsonNode getProperties() {
        return properties == null ? null : properties.deepCopy();
    }
}
