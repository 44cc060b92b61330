package com.etl.migration.kettlegraph.service.parser;

import com.etl.migration.kettlegraph.dto.graph.DependencySet;
import com.etl.migration.kettlegraph.dto.graph.WorkflowDependency;
import com.etl.migration.kettlegraph.dto.graph.WorkflowEdge;
import com.etl.migration.kettlegraph.dto.graph.WorkflowNode;
import com.etl.migration.kettlegraph.model.DependencyCategory;
import com.etl.migration.kettlegraph.service.AnalyzerConfigurationService;
import com.etl.migration.kettlegraph.service.graph.CanonicalIdGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Infers the dependencies of one document from the property bags of its nodes.
 *
 * All categories are best-effort substring matches against free text: they miss references
 * and occasionally match incidental ones. Matching tables come from
 * {@link AnalyzerConfigurationService}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WorkflowDependencyAnalyzer {

    private final AnalyzerConfigurationService configService;
    private final VariableReferenceScanner variableReferenceScanner;
    private final CanonicalIdGenerator idGenerator;

    // ========================= STEP CONNECTIONS =========================

    /**
     * Re-derive hops over a wider set of layouts than {@link ConnectionExtractor}:
     * every order element (nested hop list or direct hop), a root-level hop list and
     * every hops element.
     */
    public List<WorkflowEdge> deriveStepConnections(ParsedTree tree) {
        JsonNode root = tree.getRoot();
        List<WorkflowEdge> edges = new ArrayList<>();

        List<JsonNode> orders = PropertyBag.list(root, "order");
        for (int i = 0; i < orders.size(); i++) {
            JsonNode order = orders.get(i);
            if (PropertyBag.has(order, "hop")) {
                List<JsonNode> hops = PropertyBag.list(order, "hop");
                for (int j = 0; j < hops.size(); j++) {
                    addIfHop(edges, hops.get(j), "hop_" + i + "_" + j);
                }
            } else {
                addIfHop(edges, order, "hop_" + i);
            }
        }

        List<JsonNode> directHops = PropertyBag.list(root, "hop");
        for (int i = 0; i < directHops.size(); i++) {
            addIfHop(edges, directHops.get(i), "direct_hop_" + i);
        }

        List<JsonNode> hopsContainers = PropertyBag.list(root, "hops");
        for (int i = 0; i < hopsContainers.size(); i++) {
            List<JsonNode> hops = PropertyBag.list(hopsContainers.get(i), "hop");
            for (int j = 0; j < hops.size(); j++) {
                addIfHop(edges, hops.get(j), "hops_hop_" + i + "_" + j);
            }
        }
        return edges;
    }

    /**
     * Keep the extracted hop list unless the wider derivation found strictly more edges.
     * Counts are compared, not contents: on a tie or less the extracted list stays.
     */
    public List<WorkflowEdge> reconcile(List<WorkflowEdge> extracted, List<WorkflowEdge> derived) {
        if (derived.size() > extracted.size()) {
            log.debug("Using derived connections (found {} vs {})", derived.size(), extracted.size());
            return derived;
        }
        return extracted;
    }

    private void addIfHop(List<WorkflowEdge> edges, JsonNode candidate, String id) {
        WorkflowEdge edge = HopExtractionStrategy.toEdge(candidate, id);
        if (edge != null) {
            edges.add(edge);
        }
    }

    // ========================= DEPENDENCY SET =========================

    public DependencySet analyze(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        DependencySet.DependencySetBuilder dependencies = DependencySet.builder();

        Map<String, WorkflowNode> nodesById = new HashMap<>();
        for (WorkflowNode node : nodes) {
            nodesById.putIfAbsent(node.getId(), node);
        }
        for (WorkflowEdge edge : edges) {
            WorkflowNode source = nodesById.get(edge.getFrom());
            dependencies.stepConnection(WorkflowDependency.builder()
                    .id(idGenerator.generateDependencyId(DependencyCategory.STEP_HOP, edge.getFrom(), edge.getTo()))
                    .origin(edge.getFrom())
                    .originName(source != null ? source.getName() : edge.getFrom())
                    .stepType(source != null ? source.getStepType() : null)
                    .target(edge.getTo())
                    .category(DependencyCategory.STEP_HOP)
                    .detail(hopDetail(edge))
                    .build());
        }

        for (WorkflowNode node : nodes) {
            JsonNode properties = node.getProperties();
            String stepType = node.getStepType() != null ? node.getStepType() : NodeExtractor.UNKNOWN_TYPE;
            String lowerType = stepType.toLowerCase(Locale.ROOT);

            analyzeFiles(node, properties, lowerType).forEach(dependencies::fileDependency);
            analyzeDatabase(node, properties, lowerType).ifPresent(dependencies::databaseDependency);
            analyzeWorkflowCalls(node, properties, stepType).forEach(dependencies::subWorkflowDependency);
            analyzeVariables(node, properties, lowerType).forEach(dependencies::variableDependency);
        }

        return dependencies.build();
    }

    private String hopDetail(WorkflowEdge edge) {
        String state = edge.isEnabled() ? "enabled" : "disabled";
        return edge.getCondition() != null ? state + ", " + edge.getCondition() : state;
    }

    // ========================= FILES =========================

    private List<WorkflowDependency> analyzeFiles(WorkflowNode node, JsonNode properties, String lowerType) {
        List<WorkflowDependency> found = new ArrayList<>();
        List<String> fileKeys = configService.getFilePropertyKeys();

        if (containsAnyIgnoreCase(lowerType, configService.getFileInputStepMarkers())) {
            probe(properties, fileKeys).ifPresent(hit ->
                    found.add(dependency(node, DependencyCategory.FILE_INPUT, hit.value(), hit.key())));
        }
        if (containsAnyIgnoreCase(lowerType, configService.getFileOutputStepMarkers())) {
            probe(properties, fileKeys).ifPresent(hit ->
                    found.add(dependency(node, DependencyCategory.FILE_OUTPUT, hit.value(), hit.key())));
        }
        if (containsAnyIgnoreCase(lowerType, configService.getExcelStepMarkers())) {
            probe(properties, fileKeys).ifPresent(hit ->
                    found.add(dependency(node, DependencyCategory.EXCEL_FILE, hit.value(), hit.key())));
        }
        if (containsAnyIgnoreCase(lowerType, configService.getScriptStepMarkers())) {
            probeScript(properties).ifPresent(hit ->
                    found.add(dependency(node, DependencyCategory.SCRIPT_FILE, hit.value(), hit.key())));
        }
        return found;
    }

    private Optional<KeyHit> probeScript(JsonNode properties) {
        List<String> extensions = configService.getScriptFileExtensions();
        for (String key : configService.getScriptPropertyKeys()) {
            String value = PropertyBag.text(properties, key);
            if (value != null && containsAnyIgnoreCase(value.toLowerCase(Locale.ROOT), extensions)) {
                return Optional.of(new KeyHit(key, value));
            }
        }
        return Optional.empty();
    }

    // ========================= DATABASE =========================

    private Optional<WorkflowDependency> analyzeDatabase(WorkflowNode node, JsonNode properties, String lowerType) {
        if (!containsAnyIgnoreCase(lowerType, configService.getDatabaseStepMarkers())) {
            return Optional.empty();
        }
        return probe(properties, configService.getDatabasePropertyKeys())
                .map(hit -> dependency(node, DependencyCategory.DATABASE_CONNECTION, hit.value(), hit.key()));
    }

    // ========================= WORKFLOW CALLS =========================

    private List<WorkflowDependency> analyzeWorkflowCalls(WorkflowNode node, JsonNode properties, String stepType) {
        List<WorkflowDependency> found = new ArrayList<>();
        if (matchesType(stepType, configService.getSubTransformationTypes(), configService.getSubTransformationMarkers())) {
            referenceName(properties).ifPresent(hit ->
                    found.add(dependency(node, DependencyCategory.SUB_TRANSFORMATION, hit.value(), hit.key())));
        }
        if (matchesType(stepType, configService.getJobCallTypes(), configService.getJobCallMarkers())) {
            referenceName(properties).ifPresent(hit ->
                    found.add(dependency(node, DependencyCategory.JOB_CALL, hit.value(), hit.key())));
        }
        if (matchesType(stepType, configService.getTransformationCallTypes(), List.of())) {
            referenceName(properties).ifPresent(hit ->
                    found.add(dependency(node, DependencyCategory.TRANSFORMATION_CALL, hit.value(), hit.key())));
        }
        return found;
    }

    /**
     * Name of the called workflow: first hit among the reference keys, path-valued keys
     * reduced to the base name without extension
     */
    private Optional<KeyHit> referenceName(JsonNode properties) {
        List<String> fileNameKeys = configService.getFileNameReferenceKeys();
        for (String key : configService.getWorkflowReferenceKeys()) {
            String value = PropertyBag.text(properties, key);
            if (value == null) {
                continue;
            }
            if (fileNameKeys.contains(key)) {
                value = workflowBaseName(value);
            }
            if (!value.isEmpty()) {
                return Optional.of(new KeyHit(key, value));
            }
        }
        return Optional.empty();
    }

    /**
     * "${Internal.Job.Filename.Directory}/load/orders.ktr" -> "orders"
     */
    public static String workflowBaseName(String path) {
        String name = path.replaceAll("^.*[/\\\\]", "");
        return name.replaceAll("(?i)\\.(ktr|kjb)$", "").trim();
    }

    private boolean matchesType(String stepType, List<String> exactTypes, List<String> markers) {
        if (exactTypes.contains(stepType)) {
            return true;
        }
        for (String marker : markers) {
            if (stepType.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    // ========================= VARIABLES =========================

    private List<WorkflowDependency> analyzeVariables(WorkflowNode node, JsonNode properties, String lowerType) {
        List<WorkflowDependency> found = new ArrayList<>();

        if (containsAnyIgnoreCase(lowerType, configService.getVariableStepMarkers())) {
            List<String> nameKeys = configService.getVariableNameKeys();
            List<String> valueKeys = configService.getVariableValueKeys();
            for (String container : configService.getVariableFieldContainers()) {
                for (JsonNode field : PropertyBag.list(properties, container)) {
                    String name = PropertyBag.firstText(field, nameKeys);
                    String value = PropertyBag.firstText(field, valueKeys);
                    if (name != null && value != null) {
                        found.add(dependency(node, DependencyCategory.VARIABLE_SETTER, name, value));
                    }
                }
            }
        }

        for (String variable : variableReferenceScanner.findReferences(properties)) {
            found.add(dependency(node, DependencyCategory.VARIABLE_USER, variable, null));
        }
        return found;
    }

    // ========================= HELPERS =========================

    private Optional<KeyHit> probe(JsonNode properties, List<String> keys) {
        for (String key : keys) {
            String value = PropertyBag.text(properties, key);
            if (value != null) {
                return Optional.of(new KeyHit(key, value));
            }
        }
        return Optional.empty();
    }

    private boolean containsAnyIgnoreCase(String lowerText, List<String> fragments) {
        for (String fragment : fragments) {
            if (lowerText.contains(fragment.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private WorkflowDependency dependency(WorkflowNode node, DependencyCategory category, String target, String detail) {
        return WorkflowDependency.builder()
                .id(idGenerator.generateDependencyId(category, node.getId(), target))
                .origin(node.getId())
                .originName(node.getName())
                .stepType(node.getStepType())
                .target(target)
                .category(category)
                .detail(detail)
                .build();
    }

    private record KeyHit(String key, String value) {}
}
