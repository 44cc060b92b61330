package com.etl.migration.kettlegraph.dto.graph;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Canvas position hint of a node, as drawn by the authoring tool.
 */
@Value
@Builder
@Jacksonized
public class NodePosition {

    public static final int DEFAULT_COORDINATE = 100;

    int x;
    int y;
}
