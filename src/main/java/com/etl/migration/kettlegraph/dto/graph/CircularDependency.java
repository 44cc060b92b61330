package com.etl.migration.kettlegraph.dto.graph;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A cycle among the file-level dependencies of a folder.
 */
@Value
@Builder
@Jacksonized
public class CircularDependency {

    public enum Severity {
        WARNING,  // A file calling itself, usually an intentional loop
        ERROR     // Cycle spanning several files
    }

    Severity severity;
    String description;
    List<String> cycle;          // e.g., ["a.kjb", "b.kjb", "a.kjb"]
    List<FileDependency> cycleEdges;
}
