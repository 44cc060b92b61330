package com.etl.migration.kettlegraph.dto.graph;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A connected slice of a workflow, small enough to be summarised on its own.
 */
@Value
@Builder
@Jacksonized
public class WorkflowChunk {
    String id;
    List<WorkflowNode> nodes;
    List<WorkflowEdge> edges;   // Only edges with both ends inside the chunk
}
