package com.etl.migration.kettlegraph.service.graph;

import com.etl.migration.kettlegraph.dto.graph.WorkflowChunk;
import com.etl.migration.kettlegraph.dto.graph.WorkflowDocument;
import com.etl.migration.kettlegraph.dto.graph.WorkflowEdge;
import com.etl.migration.kettlegraph.dto.graph.WorkflowNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Splits a workflow into connected chunks small enough to be summarised one at a time.
 *
 * Nodes are grouped by weakly connected component, in order of first appearance; a component
 * larger than the limit is cut into consecutive slices. Every chunk keeps only the edges whose
 * both ends fall inside it.
 */
@Service
@Slf4j
public class WorkflowChunker {

    private final int maxNodesPerChunk;
    private final CanonicalIdGenerator idGenerator;

    public WorkflowChunker(@Value("${kettle-graph.chunking.max-nodes-per-chunk:10}") int maxNodesPerChunk,
                           CanonicalIdGenerator idGenerator) {
        if (maxNodesPerChunk < 1) {
            throw new IllegalArgumentException("max-nodes-per-chunk must be positive, got " + maxNodesPerChunk);
        }
        this.maxNodesPerChunk = maxNodesPerChunk;
        this.idGenerator = idGenerator;
    }

    public List<WorkflowChunk> chunk(WorkflowDocument document) {
        List<WorkflowChunk> chunks = new ArrayList<>();
        for (List<WorkflowNode> group : groupConnectedNodes(document)) {
            for (int start = 0; start < group.size(); start += maxNodesPerChunk) {
                List<WorkflowNode> slice = group.subList(start, Math.min(start + maxNodesPerChunk, group.size()));
                chunks.add(toChunk(chunks.size() + 1, slice, document.getEdges()));
            }
        }
        log.debug("Created {} chunk(s) for {}", chunks.size(), document.getName());
        return chunks;
    }

    /**
     * Group nodes by connectivity, ignoring edge direction
     */
    List<List<WorkflowNode>> groupConnectedNodes(WorkflowDocument document) {
        Map<String, List<String>> adjacency = new HashMap<>();
        for (WorkflowEdge edge : document.getEdges()) {
            adjacency.computeIfAbsent(edge.getFrom(), k -> new ArrayList<>()).add(edge.getTo());
            adjacency.computeIfAbsent(edge.getTo(), k -> new ArrayList<>()).add(edge.getFrom());
        }
        Map<String, List<WorkflowNode>> nodesById = new LinkedHashMap<>();
        for (WorkflowNode node : document.getNodes()) {
            nodesById.computeIfAbsent(node.getId(), k -> new ArrayList<>()).add(node);
        }

        Set<String> visited = new HashSet<>();
        List<List<WorkflowNode>> groups = new ArrayList<>();
        for (String nodeId : nodesById.keySet()) {
            if (visited.contains(nodeId)) {
                continue;
            }
            List<WorkflowNode> group = new ArrayList<>();
            Deque<String> pending = new ArrayDeque<>();
            pending.push(nodeId);
            visited.add(nodeId);
            while (!pending.isEmpty()) {
                String current = pending.pop();
                group.addAll(nodesById.getOrDefault(current, List.of()));
                for (String neighbor : adjacency.getOrDefault(current, List.of())) {
                    if (visited.add(neighbor)) {
                        pending.push(neighbor);
                    }
                }
            }
            groups.add(group);
        }
        return groups;
    }

    private WorkflowChunk toChunk(int ordinal, List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        Set<String> ids = new HashSet<>();
        nodes.forEach(node -> ids.add(node.getId()));
        List<WorkflowEdge> internal = new ArrayList<>();
        for (WorkflowEdge edge : edges) {
            if (ids.contains(edge.getFrom()) && ids.contains(edge.getTo())) {
                internal.add(edge);
            }
        }
        return WorkflowChunk.builder()
                .id(idGenerator.generateChunkId(ordinal))
                .nodes(List.copyOf(nodes))
                .edges(List.copyOf(internal))
                .build();
    }
}
