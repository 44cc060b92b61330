package com.etl.migration.kettlegraph.service.graph;

import com.etl.migration.kettlegraph.model.DependencyCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Deterministic ids for inferred dependencies and graph slices.
 *
 * Format Rules:
 * - Dependency: {category}:{origin}->{target}
 * - File dependency: {fromFile}_to_{toFile}
 * - Chunk: chunk_{ordinal}, 1-based
 */
@Service
@Slf4j
public class CanonicalIdGenerator {

    /**
     * Generate id for a dependency found inside one document.
     * Format: {category}:{origin}->{target}
     */
    public String generateDependencyId(DependencyCategory category, String origin, String target) {
        if (category == null || origin == null || target == null) {
            log.warn("Cannot generate dependency id with null category, origin or target");
            return "dependency:unknown";
        }
        return String.format("%s:%s->%s", category.getValue(), origin, target);
    }

    /**
     * Generate id for a dependency between two files of a folder.
     * Format: {fromFile}_to_{toFile}
     */
    public String generateFileDependencyId(String fromFile, String toFile) {
        return fromFile + "_to_" + toFile;
    }

    public String generateChunkId(int ordinal) {
        return "chunk_" + ordinal;
    }
}
