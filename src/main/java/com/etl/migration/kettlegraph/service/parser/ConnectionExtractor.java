package com.etl.migration.kettlegraph.service.parser;

import com.etl.migration.kettlegraph.dto.graph.WorkflowEdge;
import com.etl.migration.kettlegraph.model.DocumentKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Extracts the hop list of a document by trying hop patterns in a fixed priority order.
 * The first pattern yielding at least one edge wins; results of different patterns are never merged.
 */
@Component
@Slf4j
public class ConnectionExtractor {

    private static final Map<DocumentKind, List<HopExtractionStrategy>> PRIORITIES = Map.of(
            DocumentKind.TRANSFORMATION, List.of(
                    HopExtractionStrategy.FLAT_ORDER,
                    HopExtractionStrategy.ORDER_NESTED_HOP,
                    HopExtractionStrategy.HOPS_NESTED_HOP),
            DocumentKind.JOB, List.of(
                    HopExtractionStrategy.HOPS_NESTED_HOP,
                    HopExtractionStrategy.FLAT_HOPS,
                    HopExtractionStrategy.FLAT_ORDER)
    );

    public List<WorkflowEdge> extract(ParsedTree tree) {
        for (HopExtractionStrategy strategy : strategiesFor(tree.getKind())) {
            List<WorkflowEdge> edges = strategy.extract(tree.getRoot());
            if (!edges.isEmpty()) {
                log.debug("{}: {} hop(s) found with {}", tree.getFileName(), edges.size(), strategy);
                return edges;
            }
        }
        log.debug("{}: no hop pattern matched", tree.getFileName());
        return Collections.emptyList();
    }

    public static List<HopExtractionStrategy> strategiesFor(DocumentKind kind) {
        return PRIORITIES.get(kind);
    }
}
