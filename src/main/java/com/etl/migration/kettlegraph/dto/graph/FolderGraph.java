package com.etl.migration.kettlegraph.dto.graph;

import com.etl.migration.kettlegraph.dto.ParseFailure;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Result of parsing one folder or upload batch. Only successfully parsed documents are
 * included in {@link #files}; the others are listed in {@link #failures}.
 */
@Value
@Builder
@Jacksonized
public class FolderGraph {

    String folderName;
    @Singular
    List<FolderFile> files;
    @Singular
    List<FileDependency> dependencies;
    @Singular
    List<ParseFailure> failures;
    FolderMetadata metadata;
    FolderStructure structure;
}
