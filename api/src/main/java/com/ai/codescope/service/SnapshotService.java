package com.ai.codescope.service;

import com.ai.codescope.config.CodescopeProperties;
import com.ai.codescope.model.ContentSource;
import com.ai.codescope.model.ImportGraph;
import com.ai.codescope.model.IndexedFile;
import com.ai.codescope.model.RepositorySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;

/**
 * Builds a {@link RepositorySnapshot} by walking a repository directory.
 */
@Service
public class SnapshotService {

    private static final Logger log = LoggerFactory.getLogger(SnapshotService.class);

    private final CodescopeProperties properties;
    private final FileContentService fileContentService;
    private final DependencyService dependencyService;
    private final ImportGraphService importGraphService;

    public SnapshotService(CodescopeProperties properties,
                           FileContentService fileContentService,
                           DependencyService dependencyService,
                           ImportGraphService importGraphService) {
        this.properties = properties;
        this.fileContentService = fileContentService;
        this.dependencyService = dependencyService;
        this.importGraphService = importGraphService;
    }

    /**
     * Walk {@code root} and build a complete snapshot of it.
     *
     * @throws IllegalArgumentException if {@code root} is not a directory
     * @throws UncheckedIOException     if the directory walk fails
     */
    public RepositorySnapshot build(Path root) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(normalizedRoot)) {
            throw new IllegalArgumentException("Repository root is not a directory: " + normalizedRoot);
        }

        long started = System.currentTimeMillis();
        log.info("╔══════════════════════════════════════════════════════════════════════════════");
        log.info("║ [SNAPSHOT START] Root: {}", normalizedRoot);
        log.info("║   Skipped directories: {}", properties.getSkipDirs());
        log.info("║   Max file size: {} bytes", properties.getMaxFileBytes());
        log.info("╚══════════════════════════════════════════════════════════════════════════════");

        List<IndexedFile> files = walk(normalizedRoot);
        ContentSource content = fileContentService.contentSource(normalizedRoot);
        SortedMap<String, String> dependencies = dependencyService.collect(files, content);
        ImportGraph importGraph = importGraphService.build(files, content);

        RepositorySnapshot snapshot = new RepositorySnapshot(normalizedRoot, files, content, dependencies,
                importGraph, OffsetDateTime.now());

        long elapsed = System.currentTimeMillis() - started;
        log.info("╔══════════════════════════════════════════════════════════════════════════════");
        log.info("║ [SNAPSHOT COMPLETE] Root: {}", normalizedRoot);
        log.info("║   Indexed files: {}", snapshot.fileCount());
        log.info("║   Dependencies: {}", dependencies.size());
        log.info("║   Files with imports: {}", importGraph.imports().size());
        log.info("║   Took: {} ms", elapsed);
        log.info("╚══════════════════════════════════════════════════════════════════════════════");
        return snapshot;
    }

    List<IndexedFile> walk(Path root) {
        Set<String> skipDirs = new HashSet<>(properties.getSkipDirs());
        long maxBytes = properties.getMaxFileBytes();
        List<IndexedFile> files = new ArrayList<>();
        int[] skipped = new int[1];

        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && dir.getFileName() != null
                            && skipDirs.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile() || attrs.size() > maxBytes || !fileContentService.isTextEligible(file)) {
                        skipped[0]++;
                        return FileVisitResult.CONTINUE;
                    }
                    files.add(IndexedFile.of(relativize(root, file), attrs.size()));
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("[SnapshotService] Cannot visit {}: {}", file, e.getMessage());
                    skipped[0]++;
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk repository " + root, e);
        }

        log.info("[SnapshotService] Walk found {} files, skipped {}", files.size(), skipped[0]);
        return files;
    }

    static String relativize(Path root, Path file) {
        Path relative = root.relativize(file);
        List<String> segments = new ArrayList<>(relative.getNameCount());
        for (Path segment : relative) {
            segments.add(segment.toString());
        }
        return String.join("/", segments);
    }
}
