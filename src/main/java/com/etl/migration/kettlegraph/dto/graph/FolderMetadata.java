package com.etl.migration.kettlegraph.dto.graph;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Aggregate counts of a folder graph.
 */
@Value
@Builder
@Jacksonized
public class FolderMetadata {
    int totalFiles;
    int transformations;
    int jobs;
    int dependencies;
    Map<String, Integer> dependenciesByCategory;
    int failedFiles;
    String parsedAt;
}
