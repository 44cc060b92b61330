package com.etl.migration.kettlegraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse classification of a workflow node.
 */
public enum NodeKind {
    STEP("step"),
    JOB_ENTRY("job-entry"),
    START("start"),
    END("end");

    private final String value;

    NodeKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
