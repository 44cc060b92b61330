package com.etl.migration.kettlegraph.dto;

import com.etl.migration.kettlegraph.dto.graph.WorkflowDocument;
import com.etl.migration.kettlegraph.exception.ParseErrorType;
import com.etl.migration.kettlegraph.exception.WorkflowParseException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Outcome of parsing one file: either a document or an error, never both.
 */
@Value
@Builder
@Jacksonized
public class ParseResult {

    boolean success;
    String fileName;
    WorkflowDocument document;
    ParseErrorType errorType;
    String error;

    public static ParseResult success(String fileName, WorkflowDocument document) {
        return ParseResult.builder()
                .success(true)
                .fileName(fileName)
                .document(document)
                .build();
    }

    public static ParseResult failure(WorkflowParseException e) {
        return ParseResult.builder()
                .success(false)
                .fileName(e.getFileName())
                .errorType(e.getErrorType())
                .error(e.getMessage())
                .build();
    }

    public ParseFailure toFailure() {
        return ParseFailure.builder()
                .fileName(fileName)
                .errorType(errorType)
                .message(error)
                .build();
    }
}
