package com.etl.migration.kettlegraph.service.parser;

import com.etl.migration.kettlegraph.dto.ParseResult;
import com.etl.migration.kettlegraph.dto.graph.*;
import com.etl.migration.kettlegraph.exception.WorkflowParseException;
import com.etl.migration.kettlegraph.model.DocumentKind;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Turns the bytes of one .ktr, .kjb or .xml file into a {@link WorkflowDocument}.
 *
 * Pipeline: read and identify, extract nodes, extract hops, re-derive hops, drop edges with
 * unknown endpoints, reconcile both hop lists, then infer dependencies.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WorkflowParserService {

    private final KettleDocumentReader documentReader;
    private final NodeExtractor nodeExtractor;
    private final ConnectionExtractor connectionExtractor;
    private final WorkflowDependencyAnalyzer dependencyAnalyzer;

    /**
     * Parse one file, reporting document-level errors in the result instead of throwing
     */
    public ParseResult parse(String fileName, byte[] content) {
        try {
            return ParseResult.success(fileName, parseDocument(fileName, content));
        } catch (WorkflowParseException e) {
            log.warn("Failed to parse {}: [{}] {}", fileName, e.getErrorType(), e.getMessage());
            return ParseResult.failure(e);
        }
    }

    public WorkflowDocument parseDocument(String fileName, byte[] content) {
        ParsedTree tree = documentReader.read(fileName, content);
        JsonNode root = tree.getRoot();

        List<WorkflowNode> nodes = nodeExtractor.extract(tree);
        Set<String> nodeIds = nodes.stream().map(WorkflowNode::getId).collect(Collectors.toSet());

        List<WorkflowEdge> extracted = withKnownEndpoints(connectionExtractor.extract(tree), nodeIds, fileName);
        List<WorkflowEdge> derived = withKnownEndpoints(dependencyAnalyzer.deriveStepConnections(tree), nodeIds, fileName);
        List<WorkflowEdge> edges = dependencyAnalyzer.reconcile(extracted, derived);

        DependencySet dependencies = dependencyAnalyzer.analyze(nodes, edges);

        boolean transformation = tree.getKind() == DocumentKind.TRANSFORMATION;
        JsonNode header = transformation ? PropertyBag.resolve(root, "info") : root;

        WorkflowDocument document = WorkflowDocument.builder()
                .fileName(fileName)
                .kind(tree.getKind())
                .name(textOr(header, "name", fileName))
                .description(textOr(header, "description", ""))
                .metadata(metadata(header, transformation ? "trans_version" : "job_version"))
                .nodes(nodes)
                .edges(edges)
                .databaseConnections(declaredConnections(root))
                .parameters(parameters(header))
                .dependencies(dependencies)
                .build();

        log.info("Parsed {} {}: {} node(s), {} edge(s), {} dependencies",
                tree.getKind().getValue(), fileName, nodes.size(), edges.size(), dependencies.size());
        return document;
    }

    private List<WorkflowEdge> withKnownEndpoints(List<WorkflowEdge> edges, Set<String> nodeIds, String fileName) {
        List<WorkflowEdge> kept = new ArrayList<>(edges.size());
        for (WorkflowEdge edge : edges) {
            if (nodeIds.contains(edge.getFrom()) && nodeIds.contains(edge.getTo())) {
                kept.add(edge);
            } else {
                log.debug("{}: dropping hop {} -> {} with unknown endpoint", fileName, edge.getFrom(), edge.getTo());
            }
        }
        return kept;
    }

    private DocumentMetadata metadata(JsonNode header, String versionKey) {
        return DocumentMetadata.builder()
                .created(PropertyBag.text(header, "created_date"))
                .modified(PropertyBag.text(header, "modified_date"))
                .version(PropertyBag.text(header, versionKey))
                .author(PropertyBag.text(header, "created_user"))
                .build();
    }

    private List<DatabaseConnectionInfo> declaredConnections(JsonNode root) {
        List<DatabaseConnectionInfo> connections = new ArrayList<>();
        for (JsonNode connection : PropertyBag.list(root, "connection")) {
            String name = PropertyBag.text(connection, "name");
            if (!connection.isObject() || name == null) {
                continue;
            }
            connections.add(DatabaseConnectionInfo.builder()
                    .name(name)
                    .type(PropertyBag.text(connection, "type"))
                    .server(PropertyBag.text(connection, "server"))
                    .database(PropertyBag.text(connection, "database"))
                    .port(PropertyBag.text(connection, "port"))
                    .username(PropertyBag.text(connection, "username"))
                    .build());
        }
        return connections;
    }

    private Map<String, String> parameters(JsonNode header) {
        Map<String, String> parameters = new LinkedHashMap<>();
        for (JsonNode parameter : PropertyBag.list(header, "parameters.parameter")) {
            String name = PropertyBag.text(parameter, "name");
            if (name != null) {
                String defaultValue = PropertyBag.text(parameter, "default_value");
                parameters.put(name, defaultValue != null ? defaultValue : "");
            }
        }
        return parameters;
    }

    private String textOr(JsonNode node, String path, String fallback) {
        String text = node == null ? null : PropertyBag.text(node, path);
        return text != null ? text : fallback;
    }
}
