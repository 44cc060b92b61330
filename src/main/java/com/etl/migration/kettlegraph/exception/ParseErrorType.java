package com.etl.migration.kettlegraph.exception;

public enum ParseErrorType {
    MALFORMED,              // Markup could not be parsed
    UNRECOGNIZED_FORMAT     // Neither a transformation nor a job
}
