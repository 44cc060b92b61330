package com.etl.migration.kettlegraph.dto.graph;

import com.etl.migration.kettlegraph.model.DependencyCategory;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A reference discovered by heuristics rather than declared structurally.
 * Absence of a dependency does not prove absence of the relationship.
 */
@Value
@Builder
@Jacksonized
public class WorkflowDependency {

    String id;
    String origin;          // Node id
    String originName;      // Node display name
    String stepType;        // Sub-type of the origin node
    String target;          // File path, connection name, variable name or workflow name
    DependencyCategory category;
    String detail;
}
