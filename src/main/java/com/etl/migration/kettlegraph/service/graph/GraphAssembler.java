package com.etl.migration.kettlegraph.service.graph;

import com.etl.migration.kettlegraph.dto.ParseFailure;
import com.etl.migration.kettlegraph.dto.graph.*;
import com.etl.migration.kettlegraph.model.DocumentKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Composes parsed documents and file-level dependencies into the final folder graph.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GraphAssembler {

    private final WorkflowStructureAnalyzer structureAnalyzer;
    private final Clock clock;

    public FolderGraph assemble(String folderName, List<FolderFile> files,
                                List<FileDependency> dependencies, List<ParseFailure> failures) {
        FolderGraph graph = FolderGraph.builder()
                .folderName(folderName)
                .files(files)
                .dependencies(dependencies)
                .failures(failures)
                .metadata(buildMetadata(files, dependencies, failures))
                .structure(structureAnalyzer.analyzeFolder(files, dependencies))
                .build();

        log.info("Assembled folder graph {}: {} file(s), {} dependencies, {} failure(s)",
                folderName, files.size(), dependencies.size(), failures.size());
        return graph;
    }

    /**
     * Structural statistics of one document: entry, end and isolated nodes plus type counts
     */
    public WorkflowStructure analyzeWorkflow(WorkflowDocument document) {
        return structureAnalyzer.analyze(document);
    }

    private FolderMetadata buildMetadata(List<FolderFile> files, List<FileDependency> dependencies,
                                         List<ParseFailure> failures) {
        Map<String, Integer> dependenciesByCategory = dependencies.stream()
                .collect(Collectors.groupingBy(dependency -> dependency.getCategory().getValue(),
                        TreeMap::new, Collectors.summingInt(d -> 1)));

        return FolderMetadata.builder()
                .totalFiles(files.size())
                .transformations(countKind(files, DocumentKind.TRANSFORMATION))
                .jobs(countKind(files, DocumentKind.JOB))
                .dependencies(dependencies.size())
                .dependenciesByCategory(dependenciesByCategory)
                .failedFiles(failures.size())
                .parsedAt(Instant.now(clock).toString())
                .build();
    }

    private int countKind(List<FolderFile> files, DocumentKind kind) {
        return (int) files.stream().filter(file -> file.getKind() == kind).count();
    }
}
