package com.etl.migration.kettlegraph.dto.graph;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A hop between two nodes of the same document. Edges between the same pair are not coalesced.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class WorkflowEdge {

    String id;
    String from;        // Source node id
    String to;          // Target node id
    @Builder.Default
    boolean enabled = true;
    String condition;   // Job hops only: unconditional, success or failure
}
