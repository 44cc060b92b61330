package com.etl.migration.kettlegraph.exception;

import lombok.Getter;

/**
 * Raised when a single document cannot be turned into a workflow. Never aborts a folder batch.
 */
@Getter
public class WorkflowParseException extends RuntimeException {

    private final String fileName;
    private final ParseErrorType errorType;

    public WorkflowParseException(String fileName, ParseErrorType errorType, String message) {
        super(message);
        this.fileName = fileName;
        this.errorType = errorType;
    }

    public WorkflowParseException(String fileName, ParseErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.fileName = fileName;
        this.errorType = errorType;
    }

    public static WorkflowParseException malformed(String fileName, Throwable cause) {
        return new WorkflowParseException(fileName, ParseErrorType.MALFORMED,
                "Malformed document " + fileName + ": " + cause.getMessage(), cause);
    }

    public static WorkflowParseException unrecognized(String fileName, String reason) {
        return new WorkflowParseException(fileName, ParseErrorType.UNRECOGNIZED_FORMAT, reason);
    }
}
