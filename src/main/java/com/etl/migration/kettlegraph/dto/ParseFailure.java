package com.etl.migration.kettlegraph.dto;

import com.etl.migration.kettlegraph.exception.ParseErrorType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ParseFailure {
    String fileName;
    ParseErrorType errorType;
    String message;
}
