package com.etl.migration.kettlegraph.dto;

import lombok.Value;

/**
 * A file as handed over by the upload layer, content already read into memory.
 */
@Value
public class SourceFile {
    String fileName;
    byte[] content;

    public static SourceFile of(String fileName, byte[] content) {
        return new SourceFile(fileName, content);
    }
}
