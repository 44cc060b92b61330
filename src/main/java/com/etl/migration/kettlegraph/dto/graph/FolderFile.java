package com.etl.migration.kettlegraph.dto.graph;

import com.etl.migration.kettlegraph.model.DocumentKind;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class FolderFile {
    String fileName;
    DocumentKind kind;
    long size;
    WorkflowDocument document;
}
