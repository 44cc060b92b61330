package com.etl.migration.kettlegraph.service.parser;

import com.etl.migration.kettlegraph.model.DocumentKind;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * A document whose kind has been identified, with its root element converted to a value tree.
 */
@Value
public class ParsedTree {
    String fileName;
    DocumentKind kind;
    String rootTag;
    JsonNode root;      // Content of the root element, not wrapped in the tag name
}
