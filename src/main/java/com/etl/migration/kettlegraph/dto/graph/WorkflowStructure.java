package com.etl.migration.kettlegraph.dto.graph;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Structural statistics of a single document.
 */
@Value
@Builder
@Jacksonized
public class WorkflowStructure {

    int totalNodes;
    int totalEdges;
    Map<String, Integer> nodeCountByType;   // Count of nodes per declared sub-type
    Map<String, Integer> edgeCountByType;   // Count of edges per condition, "hop" when unconditioned
    List<String> entryPoints;               // No incoming edge
    List<String> endPoints;                 // No outgoing edge
    List<String> isolatedNodes;             // No edge at all
}
