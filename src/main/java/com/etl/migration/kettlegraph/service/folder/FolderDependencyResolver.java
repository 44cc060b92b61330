package com.etl.migration.kettlegraph.service.folder;

import com.etl.migration.kettlegraph.dto.graph.FileDependency;
import com.etl.migration.kettlegraph.dto.graph.FolderFile;
import com.etl.migration.kettlegraph.dto.graph.WorkflowDependency;
import com.etl.migration.kettlegraph.model.DependencyCategory;
import com.etl.migration.kettlegraph.model.DocumentKind;
import com.etl.migration.kettlegraph.service.graph.CanonicalIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Links the workflow calls found inside each document to other files of the same folder.
 *
 * A reference resolves by exact base name first (case-insensitive, extension stripped),
 * then by substring containment in either direction. When several files qualify, files of the
 * kind the call expects win, then the shortest base name, then the file name alphabetically.
 * References that match nothing are dropped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FolderDependencyResolver {

    private final CanonicalIdGenerator idGenerator;

    public List<FileDependency> resolve(List<FolderFile> files) {
        List<FileDependency> dependencies = new ArrayList<>();

        for (FolderFile source : files) {
            if (source.getDocument() == null || source.getDocument().getDependencies() == null) {
                continue;
            }
            List<WorkflowDependency> calls = source.getDocument().getDependencies().allDependencies()
                    .filter(dependency -> dependency.getCategory().isWorkflowCall())
                    .collect(Collectors.toList());
            for (WorkflowDependency call : calls) {
                Optional<FolderFile> target = findTarget(call, source, files);
                if (target.isEmpty()) {
                    log.debug("{}: unresolved {} reference '{}' from {}",
                            source.getFileName(), call.getCategory().getValue(), call.getTarget(), call.getOriginName());
                    continue;
                }
                String targetName = target.get().getFileName();
                dependencies.add(FileDependency.builder()
                        .id(idGenerator.generateFileDependencyId(source.getFileName(), targetName))
                        .from(source.getFileName())
                        .to(targetName)
                        .category(call.getCategory())
                        .sourceNode(call.getOriginName())
                        .reference(call.getTarget())
                        .build());
            }
        }

        log.info("Found {} dependencies between {} file(s)", dependencies.size(), files.size());
        return dependencies;
    }

    private Optional<FolderFile> findTarget(WorkflowDependency call, FolderFile source, List<FolderFile> files) {
        String reference = normalize(call.getTarget());
        if (reference.isEmpty()) {
            return Optional.empty();
        }
        Comparator<FolderFile> preference = preference(call.getCategory());

        Optional<FolderFile> exact = files.stream()
                .filter(file -> reference.equals(baseName(file.getFileName())))
                .min(preference);
        if (exact.isPresent()) {
            return exact;
        }

        return files.stream()
                .filter(file -> file != source)
                .filter(file -> {
                    String base = baseName(file.getFileName());
                    return !base.isEmpty() && (base.contains(reference) || reference.contains(base));
                })
                .min(preference);
    }

    private Comparator<FolderFile> preference(DependencyCategory category) {
        DocumentKind expected = category.targetKind();
        return Comparator.<FolderFile>comparingInt(file -> file.getKind() == expected ? 0 : 1)
                .thenComparingInt(file -> baseName(file.getFileName()).length())
                .thenComparing(FolderFile::getFileName);
    }

    /**
     * "Load_Orders.ktr" -> "load_orders"
     */
    static String baseName(String fileName) {
        String name = fileName.replaceAll("^.*[/\\\\]", "");
        return normalize(name.replaceAll("(?i)\\.(ktr|kjb|xml)$", ""));
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
