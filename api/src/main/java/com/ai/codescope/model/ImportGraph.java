package com.ai.codescope.model;

import java.util.List;
import java.util.Map;

/**
 * Bidirectional import graph of a snapshot. {@code importedBy} only holds resolved edges.
 */
public record ImportGraph(
        Map<String, List<ImportEdge>> imports,
        Map<String, List<String>> importedBy) {

    public static ImportGraph empty() {
        return new ImportGraph(Map.of(), Map.of());
    }

    public List<ImportEdge> importsOf(String path) {
        return imports.getOrDefault(path, List.of());
    }

    public List<String> importersOf(String path) {
        return importedBy.getOrDefault(path, List.of());
    }
}
