package com.etl.migration.kettlegraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of an inferred dependency, either inside one document or between files of a folder.
 */
public enum DependencyCategory {
    STEP_HOP("step_hop"),
    FILE_INPUT("file_input"),
    FILE_OUTPUT("file_output"),
    SCRIPT_FILE("script_file"),
    EXCEL_FILE("excel_file"),
    DATABASE_CONNECTION("database_connection"),
    SUB_TRANSFORMATION("sub_transformation"),
    JOB_CALL("job_call"),
    TRANSFORMATION_CALL("transformation_call"),
    VARIABLE_SETTER("variable_setter"),
    VARIABLE_USER("variable_user");

    private final String value;

    DependencyCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Kind of document a workflow call of this category is expected to land on,
     * or null for categories that do not point at another workflow.
     */
    public DocumentKind targetKind() {
        switch (this) {
            case SUB_TRANSFORMATION:
            case TRANSFORMATION_CALL:
                return DocumentKind.TRANSFORMATION;
            case JOB_CALL:
                return DocumentKind.JOB;
            default:
                return null;
        }
    }

    public boolean isWorkflowCall() {
        return targetKind() != null;
    }
}
