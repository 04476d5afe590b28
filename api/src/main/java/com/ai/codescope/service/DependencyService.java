package com.ai.codescope.service;

import com.ai.codescope.model.ContentSource;
import com.ai.codescope.model.IndexedFile;
import com.ai.codescope.service.deps.DependencyScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Merges the dependencies declared by every package manifest in the repository.
 * Manifests are visited in path order and the first declaration of a name wins.
 */
@Service
public class DependencyService {

    private static final Logger log = LoggerFactory.getLogger(DependencyService.class);

    private final List<DependencyScanner> scanners;

    public DependencyService(List<DependencyScanner> scanners) {
        this.scanners = scanners;
    }

    public SortedMap<String, String> collect(List<IndexedFile> files, ContentSource content) {
        SortedMap<String, String> merged = new TreeMap<>();
        List<IndexedFile> ordered = files.stream()
                .sorted(Comparator.comparing(IndexedFile::path))
                .toList();

        for (IndexedFile file : ordered) {
            Optional<DependencyScanner> scanner = scannerFor(file.filename());
            if (scanner.isEmpty()) {
                continue;
            }
            Optional<String> text = content.read(file.path());
            if (text.isEmpty()) {
                log.debug("[DependencyService] Manifest unreadable: {}", file.path());
                continue;
            }
            Map<String, String> declared = scanner.get().scan(text.get());
            declared.forEach(merged::putIfAbsent);
            log.debug("[DependencyService] {} declares {} dependencies", file.path(), declared.size());
        }

        log.info("[DependencyService] Collected {} dependencies", merged.size());
        return merged;
    }

    private Optional<DependencyScanner> scannerFor(String filename) {
        return scanners.stream().filter(s -> s.supports(filename)).findFirst();
    }
}
