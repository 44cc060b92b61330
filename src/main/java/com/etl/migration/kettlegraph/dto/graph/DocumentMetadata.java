package com.etl.migration.kettlegraph.dto.graph;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class DocumentMetadata {
    String created;
    String modified;
    String version;
    String author;
}
