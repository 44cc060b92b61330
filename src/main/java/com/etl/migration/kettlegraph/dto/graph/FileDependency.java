package com.etl.migration.kettlegraph.dto.graph;

import com.etl.migration.kettlegraph.model.DependencyCategory;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A directed dependency between two files of the same folder.
 */
@Value
@Builder
@Jacksonized
public class FileDependency {

    String id;
    String from;            // Calling file name
    String to;              // Called file name
    DependencyCategory category;
    String sourceNode;      // Step/entry holding the reference
    String reference;       // Reference text as found in the source node
}
