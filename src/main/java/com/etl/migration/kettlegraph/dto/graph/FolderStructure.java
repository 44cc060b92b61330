package com.etl.migration.kettlegraph.dto.graph;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * File-level shape of a folder graph.
 */
@Value
@Builder
@Jacksonized
public class FolderStructure {
    List<String> entryFiles;            // Not called by any sibling
    List<String> endFiles;              // Call no sibling
    List<String> intermediateFiles;     // Both called and calling
    List<CircularDependency> circularDependencies;
}
