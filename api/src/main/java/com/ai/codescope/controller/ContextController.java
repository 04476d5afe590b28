package com.ai.codescope.controller;

import com.ai.codescope.config.CodescopeProperties;
import com.ai.codescope.dto.BatchFileEntry;
import com.ai.codescope.dto.BatchFilesRequest;
import com.ai.codescope.dto.BatchFilesResponse;
import com.ai.codescope.dto.ContextRequest;
import com.ai.codescope.dto.ContextResponse;
import com.ai.codescope.dto.FileContentResponse;
import com.ai.codescope.model.IndexedFile;
import com.ai.codescope.model.RepositorySnapshot;
import com.ai.codescope.service.ContextAssemblyService;
import com.ai.codescope.service.FileContentService;
import com.ai.codescope.service.TokenEstimator;
import com.ai.codescope.service.WorkspaceStore;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * File content endpoints: single file view, batch fetch and budgeted context assembly.
 */
@RestController
@RequestMapping("/api")
public class ContextController {

    private static final Logger log = LoggerFactory.getLogger(ContextController.class);

    static final long FILE_VIEW_MAX_BYTES = 512 * 1024;

    private final ContextAssemblyService contextAssemblyService;
    private final FileContentService fileContentService;
    private final WorkspaceStore workspaceStore;
    private final CodescopeProperties properties;

    public ContextController(ContextAssemblyService contextAssemblyService,
                             FileContentService fileContentService,
                             WorkspaceStore workspaceStore,
                             CodescopeProperties properties) {
        this.contextAssemblyService = contextAssemblyService;
        this.fileContentService = fileContentService;
        this.workspaceStore = workspaceStore;
        this.properties = properties;
    }

    /**
     * Assemble a budget-bounded context bundle.
     * POST /api/context
     */
    @PostMapping("/context")
    public ContextResponse context(@RequestBody @Valid ContextRequest request) {
        long budget = request.budget() != null ? request.budget() : properties.getContext().getDefaultBudget();
        log.info("[Context] START paths={} unit={} budget={}", request.paths().size(), request.unit().value(), budget);
        return contextAssemblyService.assemble(workspaceStore.current(), request.paths(), request.unit(), budget);
    }

    /**
     * Full content or stubs for several files at once. Duplicate paths collapse into one key.
     * POST /api/files
     */
    @PostMapping("/files")
    public BatchFilesResponse files(@RequestBody @Valid BatchFilesRequest request) {
        RepositorySnapshot snapshot = workspaceStore.current();
        Map<String, BatchFileEntry> files = new LinkedHashMap<>();

        for (String path : request.paths()) {
            if (path == null || files.containsKey(path)) {
                continue;
            }
            Optional<IndexedFile> indexed = snapshot.find(path);
            if (indexed.isEmpty()) {
                files.put(path, BatchFileEntry.failed("File not indexed"));
                continue;
            }
            Optional<String> content = snapshot.read(path);
            if (content.isEmpty()) {
                files.put(path, BatchFileEntry.failed("Content unavailable"));
                continue;
            }
            String text = request.stubs()
                    ? contextAssemblyService.stubFor(indexed.get(), content.get())
                    : content.get();
            files.put(path, BatchFileEntry.ok(text, TokenEstimator.utf8Length(text)));
        }

        log.info("[Files] mode={} requested={} returned={}", request.stubs() ? "stubs" : "full",
                request.paths().size(), files.size());
        return new BatchFilesResponse(files);
    }

    /**
     * Content of one indexed file.
     * GET /api/file?path=
     */
    @GetMapping("/file")
    public FileContentResponse file(@RequestParam String path) {
        RepositorySnapshot snapshot = workspaceStore.current();
        if (fileContentService.resolveInside(snapshot.root(), path).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_PATH: " + path);
        }
        if (!snapshot.contains(path)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "FILE_NOT_FOUND: " + path);
        }
        String content = snapshot.read(path)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY,
                        "CONTENT_UNAVAILABLE: " + path));

        long size = TokenEstimator.utf8Length(content);
        boolean truncated = size > FILE_VIEW_MAX_BYTES;
        String body = truncated ? TokenEstimator.truncateToBytes(content, FILE_VIEW_MAX_BYTES) : content;
        return new FileContentResponse(path, body, countLines(body), size, truncated);
    }

    static int countLines(String content) {
        if (content.isEmpty()) {
            return 0;
        }
        int lines = 1;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n' && i < content.length() - 1) {
                lines++;
            }
        }
        return lines;
    }
}
