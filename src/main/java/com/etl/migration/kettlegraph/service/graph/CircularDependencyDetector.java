package com.etl.migration.kettlegraph.service.graph;

import com.etl.migration.kettlegraph.dto.graph.CircularDependency;
import com.etl.migration.kettlegraph.dto.graph.FileDependency;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Detects cycles among the file-level dependencies of a folder using DFS cycle detection.
 *
 * A job calling itself is reported as a WARNING (Kettle loops are built this way);
 * a cycle through several files is reported as an ERROR.
 */
@Service
@Slf4j
public class CircularDependencyDetector {

    public List<CircularDependency> detectCircularDependencies(List<FileDependency> dependencies) {
        // Adjacency list: file -> called files, sorted so reported cycles are reproducible
        Map<String, Set<String>> adjacency = new TreeMap<>();
        // Track detailed edges for cycle reporting
        Map<String, FileDependency> edgeDetails = new HashMap<>();

        for (FileDependency dependency : dependencies) {
            adjacency.computeIfAbsent(dependency.getFrom(), k -> new TreeSet<>()).add(dependency.getTo());
            adjacency.computeIfAbsent(dependency.getTo(), k -> new TreeSet<>());
            edgeDetails.putIfAbsent(dependency.getFrom() + "->" + dependency.getTo(), dependency);
        }

        List<List<String>> cycles = findCyclesDFS(adjacency);

        List<CircularDependency> results = cycles.stream()
                .map(cycle -> {
                    List<FileDependency> edges = new ArrayList<>();
                    for (int i = 0; i < cycle.size() - 1; i++) {
                        FileDependency edge = edgeDetails.get(cycle.get(i) + "->" + cycle.get(i + 1));
                        if (edge != null) {
                            edges.add(edge);
                        }
                    }
                    boolean selfCall = cycle.size() == 2;

                    return CircularDependency.builder()
                            .severity(selfCall ? CircularDependency.Severity.WARNING : CircularDependency.Severity.ERROR)
                            .description((selfCall ? "File calls itself: " : "Circular dependency between files: ")
                                    + String.join(" -> ", cycle))
                            .cycle(List.copyOf(cycle))
                            .cycleEdges(List.copyOf(edges))
                            .build();
                })
                .collect(Collectors.toList());

        if (!results.isEmpty()) {
            log.info("Found {} circular dependencies between files", results.size());
        }
        return results;
    }

    // ========================= DFS CYCLE DETECTION =========================

    /**
     * Find all unique cycles in a directed graph using DFS.
     * Returns list of cycles, where each cycle is a list of node keys
     * with the first and last element being the same (to show the cycle).
     */
    private List<List<String>> findCyclesDFS(Map<String, Set<String>> adjacency) {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> inStack = new HashSet<>();
        Map<String, String> parent = new HashMap<>();
        Set<String> reportedCycles = new HashSet<>();

        for (String node : adjacency.keySet()) {
            if (!visited.contains(node)) {
                dfs(node, adjacency, visited, inStack, parent, cycles, reportedCycles);
            }
        }

        return cycles;
    }

    private void dfs(String node, Map<String, Set<String>> adjacency,
                     Set<String> visited, Set<String> inStack,
                     Map<String, String> parent,
                     List<List<String>> cycles, Set<String> reportedCycles) {
        visited.add(node);
        inStack.add(node);

        for (String neighbor : adjacency.getOrDefault(node, Collections.emptySet())) {
            if (!visited.contains(neighbor)) {
                parent.put(neighbor, node);
                dfs(neighbor, adjacency, visited, inStack, parent, cycles, reportedCycles);
            } else if (inStack.contains(neighbor)) {
                List<String> cycle = reconstructCycle(neighbor, node, parent);
                if (reportedCycles.add(normalizeCycleKey(cycle))) {
                    cycles.add(cycle);
                }
            }
        }

        inStack.remove(node);
    }

    private List<String> reconstructCycle(String start, String end, Map<String, String> parent) {
        List<String> cycle = new ArrayList<>();
        cycle.add(end);

        String current = end;
        int maxDepth = parent.size() + 1; // safety limit
        while (!current.equals(start) && maxDepth-- > 0) {
            current = parent.getOrDefault(current, start);
            cycle.add(current);
        }

        Collections.reverse(cycle);
        cycle.add(start); // close the cycle
        return cycle;
    }

    /**
     * Normalize a cycle key so that the same cycle starting from different nodes
     * produces the same signature.
     */
    private String normalizeCycleKey(List<String> cycle) {
        if (cycle.size() <= 1) return cycle.toString();
        List<String> core = cycle.subList(0, cycle.size() - 1);
        String min = Collections.min(core);
        int minIdx = core.indexOf(min);
        List<String> normalized = new ArrayList<>();
        for (int i = 0; i < core.size(); i++) {
            normalized.add(core.get((minIdx + i) % core.size()));
        }
        return normalized.toString();
    }
}
