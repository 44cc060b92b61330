package com.etl.migration.kettlegraph.dto.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.stream.Stream;

/**
 * Dependencies inferred inside one document, grouped the way they were discovered.
 */
@Value
@Builder
@Jacksonized
public class DependencySet {

    @Singular
    List<WorkflowDependency> stepConnections;
    @Singular
    List<WorkflowDependency> fileDependencies;
    @Singular
    List<WorkflowDependency> databaseDependencies;
    @Singular
    List<WorkflowDependency> variableDependencies;
    @Singular
    List<WorkflowDependency> subWorkflowDependencies;

    public Stream<WorkflowDependency> allDependencies() {
        return Stream.of(stepConnections, fileDependencies, databaseDependencies,
                        variableDependencies, subWorkflowDependencies)
                .flatMap(List::stream);
    }

    public int size() {
        return stepConnections.size() + fileDependencies.size() + databaseDependencies.size()
                + variableDependencies.size() + subWorkflowDependencies.size();
    }
}
