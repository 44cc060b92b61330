package com.etl.migration.kettlegraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Logical kind of a Kettle document.
 */
public enum DocumentKind {
    TRANSFORMATION("transformation"),
    JOB("job");

    private final String value;

    DocumentKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Get the kind matching an XML root tag name, case-insensitive.
     */
    public static DocumentKind fromRootTag(String tagName) {
        if (tagName == null) return null;
        for (DocumentKind kind : values()) {
            if (kind.value.equalsIgnoreCase(tagName.trim())) {
                return kind;
            }
        }
        return null;
    }
}
