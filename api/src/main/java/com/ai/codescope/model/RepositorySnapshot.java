package com.ai.codescope.model;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable point-in-time index of one repository. Rebuilding produces a new instance;
 * an existing snapshot is never modified.
 */
public final class RepositorySnapshot {

    private final Path root;
    private final List<IndexedFile> files;
    private final Map<String, IndexedFile> byPath;
    private final ContentSource content;
    private final SortedMap<String, String> dependencies;
    private final ImportGraph importGraph;
    private final OffsetDateTime builtAt;

    public RepositorySnapshot(Path root,
                              List<IndexedFile> files,
                              ContentSource content,
                              Map<String, String> dependencies,
                              ImportGraph importGraph,
                              OffsetDateTime builtAt) {
        this.root = root;
        this.files = files.stream()
                .sorted(Comparator.comparing(IndexedFile::path))
                .toList();
        Map<String, IndexedFile> index = new LinkedHashMap<>();
        for (IndexedFile file : this.files) {
            if (index.putIfAbsent(file.path(), file) != null) {
                throw new IllegalArgumentException("Duplicate path in snapshot: " + file.path());
            }
        }
        this.byPath = Collections.unmodifiableMap(index);
        this.content = content;
        this.dependencies = Collections.unmodifiableSortedMap(new TreeMap<>(dependencies));
        this.importGraph = importGraph;
        this.builtAt = builtAt;
    }

    /**
     * Snapshot without dependency or import data, used where only files and content matter.
     */
    public static RepositorySnapshot of(List<IndexedFile> files, ContentSource content) {
        return new RepositorySnapshot(Path.of("."), files, content, Map.of(), ImportGraph.empty(),
                OffsetDateTime.now());
    }

    public Path root() {
        return root;
    }

    /**
     * All files in index order (ascending path).
     */
    public List<IndexedFile> files() {
        return files;
    }

    public Optional<IndexedFile> find(String path) {
        return Optional.ofNullable(byPath.get(path));
    }

    public boolean contains(String path) {
        return byPath.containsKey(path);
    }

    public Optional<String> read(String path) {
        if (!byPath.containsKey(path)) {
            return Optional.empty();
        }
        return content.read(path);
    }

    public SortedMap<String, String> dependencies() {
        return dependencies;
    }

    public ImportGraph importGraph() {
        return importGraph;
    }

    public OffsetDateTime builtAt() {
        return builtAt;
    }

    public int fileCount() {
        return files.size();
    }
}
