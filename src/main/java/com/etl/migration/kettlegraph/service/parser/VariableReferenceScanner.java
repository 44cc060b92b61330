package com.etl.migration.kettlegraph.service.parser;

import com.etl.migration.kettlegraph.service.AnalyzerConfigurationService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Finds variable references such as {@code ${target_schema}} anywhere inside a value tree.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VariableReferenceScanner {

    private final AnalyzerConfigurationService configService;

    private final Map<String, Optional<Pattern>> compiledPatterns = new ConcurrentHashMap<>();

    /**
     * Distinct variable names referenced in every string of the tree, in first-seen order
     */
    public Set<String> findReferences(JsonNode tree) {
        Set<String> names = new LinkedHashSet<>();
        if (tree == null) {
            return names;
        }
        List<Pattern> patterns = patterns();
        collect(tree, patterns, names);
        return names;
    }

    /**
     * Distinct variable names referenced in one string
     * Example: "${base.dir}/in/${file}.csv" -> [base.dir, file]
     */
    Set<String> extractAllVariableNames(String text) {
        Set<String> names = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return names;
        }
        scan(text, patterns(), names);
        return names;
    }

    /**
     * Check if a string contains variable references
     */
    boolean hasReferences(String text) {
        return !extractAllVariableNames(text).isEmpty();
    }

    private void collect(JsonNode node, List<Pattern> patterns, Set<String> names) {
        if (node.isTextual()) {
            scan(node.asText(), patterns, names);
        } else if (node.isContainerNode()) {
            // Object values and array elements alike; field names are never references
            for (JsonNode child : node) {
                collect(child, patterns, names);
            }
        }
    }

    private void scan(String text, List<Pattern> patterns, Set<String> names) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String name = matcher.group(1).trim();
                if (!name.isEmpty()) {
                    names.add(name);
                }
            }
        }
    }

    private List<Pattern> patterns() {
        List<Pattern> patterns = new ArrayList<>();
        for (String regex : configService.getVariableReferencePatterns()) {
            compiledPatterns.computeIfAbsent(regex, this::compile).ifPresent(patterns::add);
        }
        return patterns;
    }

    private Optional<Pattern> compile(String regex) {
        try {
            Pattern pattern = Pattern.compile(regex);
            if (pattern.matcher("").groupCount() < 1) {
                log.warn("Variable pattern '{}' has no capturing group, ignoring it", regex);
                return Optional.empty();
            }
            return Optional.of(pattern);
        } catch (PatternSyntaxException e) {
            log.warn("Invalid variable pattern '{}': {}", regex, e.getMessage());
            return Optional.empty();
        }
    }
}
