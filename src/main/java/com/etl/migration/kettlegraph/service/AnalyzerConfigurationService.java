package com.etl.migration.kettlegraph.service;

import com.etl.migration.kettlegraph.model.AnalyzerConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the matching tables used by the dependency heuristics.
 *
 * Every table is an ordered list of strings keyed by a config type. Defaults are seeded on
 * construction; callers may replace any table at runtime to support another authoring tool
 * without touching the analyzers.
 */
@Service
@Slf4j
public class AnalyzerConfigurationService {

    public static final String FILE_INPUT_STEP_MARKERS = "FILE_INPUT_STEP_MARKERS";
    public static final String FILE_OUTPUT_STEP_MARKERS = "FILE_OUTPUT_STEP_MARKERS";
    public static final String EXCEL_STEP_MARKERS = "EXCEL_STEP_MARKERS";
    public static final String SCRIPT_STEP_MARKERS = "SCRIPT_STEP_MARKERS";
    public static final String FILE_PROPERTY_KEYS = "FILE_PROPERTY_KEYS";
    public static final String SCRIPT_PROPERTY_KEYS = "SCRIPT_PROPERTY_KEYS";
    public static final String SCRIPT_FILE_EXTENSIONS = "SCRIPT_FILE_EXTENSIONS";
    public static final String DATABASE_STEP_MARKERS = "DATABASE_STEP_MARKERS";
    public static final String DATABASE_PROPERTY_KEYS = "DATABASE_PROPERTY_KEYS";
    public static final String SUB_TRANSFORMATION_TYPES = "SUB_TRANSFORMATION_TYPES";
    public static final String SUB_TRANSFORMATION_MARKERS = "SUB_TRANSFORMATION_MARKERS";
    public static final String JOB_CALL_TYPES = "JOB_CALL_TYPES";
    public static final String JOB_CALL_MARKERS = "JOB_CALL_MARKERS";
    public static final String TRANSFORMATION_CALL_TYPES = "TRANSFORMATION_CALL_TYPES";
    public static final String WORKFLOW_REFERENCE_KEYS = "WORKFLOW_REFERENCE_KEYS";
    public static final String FILE_NAME_REFERENCE_KEYS = "FILE_NAME_REFERENCE_KEYS";
    public static final String VARIABLE_STEP_MARKERS = "VARIABLE_STEP_MARKERS";
    public static final String VARIABLE_FIELD_CONTAINERS = "VARIABLE_FIELD_CONTAINERS";
    public static final String VARIABLE_NAME_KEYS = "VARIABLE_NAME_KEYS";
    public static final String VARIABLE_VALUE_KEYS = "VARIABLE_VALUE_KEYS";
    public static final String VARIABLE_REFERENCE_PATTERNS = "VARIABLE_REFERENCE_PATTERNS";
    public static final String WORKFLOW_FILE_EXTENSIONS = "WORKFLOW_FILE_EXTENSIONS";

    private final Map<String, AnalyzerConfiguration> configurations = new ConcurrentHashMap<>();

    public AnalyzerConfigurationService() {
        initializeDefaultConfigurations();
    }

    // ========================= FILE DEPENDENCIES =========================

    /**
     * Sub-type fragments (case-insensitive) marking steps that read files
     */
    public List<String> getFileInputStepMarkers() {
        return getValues(FILE_INPUT_STEP_MARKERS);
    }

    public List<String> getFileOutputStepMarkers() {
        return getValues(FILE_OUTPUT_STEP_MARKERS);
    }

    public List<String> getExcelStepMarkers() {
        return getValues(EXCEL_STEP_MARKERS);
    }

    public List<String> getScriptStepMarkers() {
        return getValues(SCRIPT_STEP_MARKERS);
    }

    /**
     * Property keys probed, in order, for a file path
     */
    public List<String> getFilePropertyKeys() {
        return getValues(FILE_PROPERTY_KEYS);
    }

    public List<String> getScriptPropertyKeys() {
        return getValues(SCRIPT_PROPERTY_KEYS);
    }

    public List<String> getScriptFileExtensions() {
        return getValues(SCRIPT_FILE_EXTENSIONS);
    }

    // ========================= DATABASE DEPENDENCIES =========================

    public List<String> getDatabaseStepMarkers() {
        return getValues(DATABASE_STEP_MARKERS);
    }

    public List<String> getDatabasePropertyKeys() {
        return getValues(DATABASE_PROPERTY_KEYS);
    }

    // ========================= WORKFLOW CALLS =========================

    /**
     * Exact sub-types of steps that embed a sub-transformation
     */
    public List<String> getSubTransformationTypes() {
        return getValues(SUB_TRANSFORMATION_TYPES);
    }

    /**
     * Case-sensitive sub-type fragments of steps that embed a sub-transformation
     */
    public List<String> getSubTransformationMarkers() {
        return getValues(SUB_TRANSFORMATION_MARKERS);
    }

    public List<String> getJobCallTypes() {
        return getValues(JOB_CALL_TYPES);
    }

    public List<String> getJobCallMarkers() {
        return getValues(JOB_CALL_MARKERS);
    }

    public List<String> getTransformationCallTypes() {
        return getValues(TRANSFORMATION_CALL_TYPES);
    }

    /**
     * Property keys probed, in priority order, for the name of a called workflow
     */
    public List<String> getWorkflowReferenceKeys() {
        return getValues(WORKFLOW_REFERENCE_KEYS);
    }

    /**
     * Reference keys holding a path, reduced to the base name without extension
     */
    public List<String> getFileNameReferenceKeys() {
        return getValues(FILE_NAME_REFERENCE_KEYS);
    }

    // ========================= VARIABLES =========================

    public List<String> getVariableStepMarkers() {
        return getValues(VARIABLE_STEP_MARKERS);
    }

    public List<String> getVariableFieldContainers() {
        return getValues(VARIABLE_FIELD_CONTAINERS);
    }

    public List<String> getVariableNameKeys() {
        return getValues(VARIABLE_NAME_KEYS);
    }

    public List<String> getVariableValueKeys() {
        return getValues(VARIABLE_VALUE_KEYS);
    }

    /**
     * Regular expressions whose first group captures a variable name
     */
    public List<String> getVariableReferencePatterns() {
        return getValues(VARIABLE_REFERENCE_PATTERNS);
    }

    // ========================= FOLDER =========================

    public List<String> getWorkflowFileExtensions() {
        return getValues(WORKFLOW_FILE_EXTENSIONS);
    }

    // ========================= MANAGEMENT =========================

    /**
     * Get all active configurations
     */
    public List<AnalyzerConfiguration> getAllActiveConfigurations() {
        List<AnalyzerConfiguration> active = new ArrayList<>();
        for (AnalyzerConfiguration config : configurations.values()) {
            if (config.isActive()) {
                active.add(config.toBuilder().build());
            }
        }
        active.sort(Comparator.comparing(AnalyzerConfiguration::getConfigType));
        return active;
    }

    /**
     * Get configuration by type
     */
    public Optional<AnalyzerConfiguration> getConfigurationByType(String configType) {
        AnalyzerConfiguration config = configurations.get(configType);
        if (config == null || !config.isActive()) {
            return Optional.empty();
        }
        return Optional.of(config.toBuilder().build());
    }

    /**
     * Replace the values of an existing configuration
     */
    public AnalyzerConfiguration updateConfiguration(String configType, List<String> values) {
        AnalyzerConfiguration existing = getConfigurationByType(configType)
                .orElseThrow(() -> new IllegalArgumentException("Configuration not found: " + configType));

        AnalyzerConfiguration updated = AnalyzerConfiguration.builder()
                .configType(configType)
                .values(List.copyOf(values))
                .description(existing.getDescription())
                .active(true)
                .version(existing.getVersion() + 1)
                .build();
        configurations.put(configType, updated);
        log.info("Updated configuration: {} (version: {})", configType, updated.getVersion());
        return updated.toBuilder().build();
    }

    /**
     * Save or replace a configuration
     */
    public AnalyzerConfiguration saveConfiguration(AnalyzerConfiguration config) {
        if (config.getConfigType() == null || config.getConfigType().isBlank()) {
            throw new IllegalArgumentException("Configuration type is required");
        }
        long version = getConfigurationByType(config.getConfigType())
                .map(existing -> existing.getVersion() + 1)
                .orElse(1L);

        AnalyzerConfiguration saved = AnalyzerConfiguration.builder()
                .configType(config.getConfigType())
                .values(config.getValues() == null ? List.of() : List.copyOf(config.getValues()))
                .description(config.getDescription())
                .active(config.isActive())
                .version(version)
                .build();
        configurations.put(saved.getConfigType(), saved);
        log.info("Saved configuration: {} (version: {})", saved.getConfigType(), saved.getVersion());
        return saved.toBuilder().build();
    }

    /**
     * Deactivate a configuration; lookups then fall back to an empty table
     */
    public void deactivateConfiguration(String configType) {
        AnalyzerConfiguration existing = configurations.get(configType);
        if (existing != null && existing.isActive()) {
            configurations.put(configType, existing.toBuilder()
                    .active(false)
                    .version(existing.getVersion() + 1)
                    .build());
            log.warn("Deactivated configuration: {}, lookups now return an empty list", configType);
        }
    }

    /**
     * Seed every table that is not present yet
     */
    public void initializeDefaultConfigurations() {
        initialize(FILE_INPUT_STEP_MARKERS, "Step sub-type fragments of file readers",
                "input", "file");
        initialize(FILE_OUTPUT_STEP_MARKERS, "Step sub-type fragments of file writers",
                "output", "writer");
        initialize(EXCEL_STEP_MARKERS, "Step sub-type fragments of spreadsheet steps",
                "excel");
        initialize(SCRIPT_STEP_MARKERS, "Step sub-type fragments of script steps",
                "script", "javascript", "execute");
        initialize(FILE_PROPERTY_KEYS, "Property keys holding a file path",
                "filename", "file", "filepath", "inputfile", "outputfile",
                "file_name", "input_file", "output_file", "file.name");
        initialize(SCRIPT_PROPERTY_KEYS, "Property keys holding a script path",
                "script", "scriptfile", "script_file", "filename", "file");
        initialize(SCRIPT_FILE_EXTENSIONS, "Fragments identifying a script file",
                ".js", ".py", ".sh", ".bat");
        initialize(DATABASE_STEP_MARKERS, "Step sub-type fragments of database steps",
                "table", "database", "sql");
        initialize(DATABASE_PROPERTY_KEYS, "Property keys holding a connection name",
                "connection", "database", "db_connection", "connection_name");
        initialize(SUB_TRANSFORMATION_TYPES, "Step sub-types embedding a sub-transformation",
                "Mapping", "SubTrans", "MappingInput", "MappingOutput", "SimpleMapping");
        initialize(SUB_TRANSFORMATION_MARKERS, "Case-sensitive sub-type fragments of sub-transformation steps",
                "Sub");
        initialize(JOB_CALL_TYPES, "Step and entry sub-types calling a job",
                "JobExecutor", "JOB", "JOB_EXECUTOR");
        initialize(JOB_CALL_MARKERS, "Case-sensitive sub-type fragments of job callers",
                "Job");
        initialize(TRANSFORMATION_CALL_TYPES, "Step and entry sub-types calling a transformation",
                "TRANS", "TRANSFORMATION", "TransExecutor");
        initialize(WORKFLOW_REFERENCE_KEYS, "Property keys naming a called workflow, by priority",
                "trans_name", "filename", "specification", "trans_object_id",
                "job_object_id", "jobname", "transname");
        initialize(FILE_NAME_REFERENCE_KEYS, "Reference keys holding a path rather than a name",
                "filename");
        initialize(VARIABLE_STEP_MARKERS, "Step sub-type fragments of variable setters",
                "variable", "parameter");
        initialize(VARIABLE_FIELD_CONTAINERS, "Paths of the repeated field structures of variable setters",
                "field", "fields.field");
        initialize(VARIABLE_NAME_KEYS, "Keys naming the variable inside a field structure",
                "name", "variable_name");
        initialize(VARIABLE_VALUE_KEYS, "Keys holding the value inside a field structure",
                "value", "variable_value", "field_name");
        initialize(VARIABLE_REFERENCE_PATTERNS, "Patterns of variable references in free text",
                "\\$\\{([^}]+)\\}");
        initialize(WORKFLOW_FILE_EXTENSIONS, "File extensions picked up from a folder",
                ".ktr", ".kjb", ".xml");
    }

    private void initialize(String configType, String description, String... values) {
        configurations.computeIfAbsent(configType, type -> {
            log.debug("Initialized default {} configuration", type);
            return AnalyzerConfiguration.builder()
                    .configType(type)
                    .values(List.of(values))
                    .description(description)
                    .active(true)
                    .version(1L)
                    .build();
        });
    }

    /**
     * Get the ordered values of a configuration, empty when missing or inactive
     */
    private List<String> getValues(String configType) {
        AnalyzerConfiguration config = configurations.get(configType);
        if (config != null && config.isActive() && config.getValues() != null) {
            return config.getValues();
        }

        log.debug("Configuration {} not found or inactive, using empty list", configType);
        return Collections.emptyList();
    }
}
