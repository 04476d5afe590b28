package com.ai.codescope.controller;

import com.ai.codescope.dto.FileNode;
import com.ai.codescope.dto.ImportsResponse;
import com.ai.codescope.dto.ManifestEntry;
import com.ai.codescope.model.ImportGraph;
import com.ai.codescope.model.RepositorySnapshot;
import com.ai.codescope.service.ManifestService;
import com.ai.codescope.service.WorkspaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;

/**
 * Structural views of the current snapshot and snapshot lifecycle.
 */
@RestController
@RequestMapping("/api")
public class RepositoryController {

    private static final Logger log = LoggerFactory.getLogger(RepositoryController.class);

    private final WorkspaceStore workspaceStore;
    private final ManifestService manifestService;
    private final String version;
    private final Instant startedAt = Instant.now();

    public RepositoryController(WorkspaceStore workspaceStore,
                                ManifestService manifestService,
                                @Value("${app.version:0.1.0}") String version) {
        this.workspaceStore = workspaceStore;
        this.manifestService = manifestService;
        this.version = version;
    }

    @GetMapping("/tree")
    public List<FileNode> tree() {
        return manifestService.tree(workspaceStore.current());
    }

    @GetMapping("/manifest")
    public SortedMap<String, List<ManifestEntry>> manifest() {
        return manifestService.manifest(workspaceStore.current());
    }

    @GetMapping("/deps")
    public SortedMap<String, String> dependencies() {
        return workspaceStore.current().dependencies();
    }

    /**
     * GET /api/imports?path=&direction=imports|importedBy|both
     * The direction not asked for comes back as an empty list.
     */
    @GetMapping("/imports")
    public ImportsResponse imports(
            @RequestParam String path,
            @RequestParam(defaultValue = "both") String direction) {
        RepositorySnapshot snapshot = workspaceStore.current();
        if (!snapshot.contains(path)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "FILE_NOT_FOUND: " + path);
        }

        String normalized = direction.trim().toLowerCase(Locale.ROOT);
        boolean forward = normalized.equals("imports") || normalized.equals("both");
        boolean reverse = normalized.equals("importedby") || normalized.equals("both");
        if (!forward && !reverse) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "INVALID_DIRECTION: expected imports, importedBy or both, got " + direction);
        }

        ImportGraph graph = snapshot.importGraph();
        return new ImportsResponse(path,
                forward ? graph.importsOf(path) : List.of(),
                reverse ? graph.importersOf(path) : List.of());
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        RepositorySnapshot snapshot = workspaceStore.current();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("version", version);
        body.put("files", snapshot.fileCount());
        body.put("snapshotBuiltAt", snapshot.builtAt());
        body.put("uptimeSeconds", Duration.between(startedAt, Instant.now()).toSeconds());
        return body;
    }

    /**
     * Rebuild the snapshot from disk and swap it in.
     * POST /api/snapshot/rebuild
     */
    @PostMapping("/snapshot/rebuild")
    public Map<String, Object> rebuild() {
        log.info("[Snapshot] Rebuild requested");
        RepositorySnapshot snapshot = workspaceStore.rebuild();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("files", snapshot.fileCount());
        body.put("builtAt", snapshot.builtAt());
        return body;
    }
}
