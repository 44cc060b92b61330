package com.etl.migration.kettlegraph.service.graph;

import com.etl.migration.kettlegraph.dto.graph.*;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Pure structural statistics over already-built graphs. Never mutates its input.
 */
@Service
@RequiredArgsConstructor
public class WorkflowStructureAnalyzer {

    private static final String DEFAULT_EDGE_TYPE = "hop";

    private final CircularDependencyDetector circularDependencyDetector;

    public WorkflowStructure analyze(WorkflowDocument document) {
        Set<String> nodeIds = new LinkedHashSet<>();
        document.getNodes().forEach(node -> nodeIds.add(node.getId()));

        Set<String> incoming = new HashSet<>();
        Set<String> outgoing = new HashSet<>();
        for (WorkflowEdge edge : document.getEdges()) {
            incoming.add(edge.getTo());
            outgoing.add(edge.getFrom());
        }

        Map<String, Integer> nodeCountByType = document.getNodes().stream()
                .collect(Collectors.groupingBy(WorkflowNode::getStepType, TreeMap::new, Collectors.summingInt(n -> 1)));
        Map<String, Integer> edgeCountByType = document.getEdges().stream()
                .collect(Collectors.groupingBy(
                        edge -> edge.getCondition() != null ? edge.getCondition() : DEFAULT_EDGE_TYPE,
                        TreeMap::new, Collectors.summingInt(e -> 1)));

        return WorkflowStructure.builder()
                .totalNodes(document.getNodes().size())
                .totalEdges(document.getEdges().size())
                .nodeCountByType(nodeCountByType)
                .edgeCountByType(edgeCountByType)
                .entryPoints(filter(nodeIds, id -> !incoming.contains(id)))
                .endPoints(filter(nodeIds, id -> !outgoing.contains(id)))
                .isolatedNodes(filter(nodeIds, id -> !incoming.contains(id) && !outgoing.contains(id)))
                .build();
    }

    public FolderStructure analyzeFolder(List<FolderFile> files, List<FileDependency> dependencies) {
        Set<String> fileNames = new LinkedHashSet<>();
        files.forEach(file -> fileNames.add(file.getFileName()));

        Set<String> called = new HashSet<>();
        Set<String> calling = new HashSet<>();
        for (FileDependency dependency : dependencies) {
            called.add(dependency.getTo());
            calling.add(dependency.getFrom());
        }

        return FolderStructure.builder()
                .entryFiles(filter(fileNames, name -> !called.contains(name)))
                .endFiles(filter(fileNames, name -> !calling.contains(name)))
                .intermediateFiles(filter(fileNames, name -> called.contains(name) && calling.contains(name)))
                .circularDependencies(circularDependencyDetector.detectCircularDependencies(dependencies))
                .build();
    }

    private List<String> filter(Set<String> ids, Predicate<String> predicate) {
        return ids.stream().filter(predicate).collect(Collectors.toUnmodifiableList());
    }
}
