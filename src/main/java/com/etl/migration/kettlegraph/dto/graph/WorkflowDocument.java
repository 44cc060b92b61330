package com.etl.migration.kettlegraph.dto.graph;

import com.etl.migration.kettlegraph.model.DocumentKind;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * One parsed transformation or job.
 * Every edge references node ids present in {@link #nodes}.
 */
@Value
@Builder
@Jacksonized
public class WorkflowDocument {

    String fileName;
    DocumentKind kind;
    String name;
    String description;
    DocumentMetadata metadata;

    @Singular
    List<WorkflowNode> nodes;
    @Singular
    List<WorkflowEdge> edges;
    @Singular
    List<DatabaseConnectionInfo> databaseConnections;
    @Singular
    Map<String, String> parameters;     // Parameter name -> default value

    DependencySet dependencies;
}
