package com.etl.migration.kettlegraph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One named matching table used by the dependency heuristics.
 * Tables are ordered: where the analyzer probes property keys, earlier values win.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzerConfiguration {

    private String configType; // e.g., "FILE_PROPERTY_KEYS", "DATABASE_STEP_MARKERS"

    private List<String> values;

    private String description;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private long version = 1L;
}
