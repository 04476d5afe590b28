package com.ai.codescope.controller;

import com.ai.codescope.config.CodescopeProperties;
import com.ai.codescope.dto.GrepResponse;
import com.ai.codescope.model.Deadline;
import com.ai.codescope.model.RepositorySnapshot;
import com.ai.codescope.service.ContentGrepService;
import com.ai.codescope.service.PathFilter;
import com.ai.codescope.service.WorkspaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class GrepController {

    private static final Logger log = LoggerFactory.getLogger(GrepController.class);

    private final ContentGrepService grepService;
    private final WorkspaceStore workspaceStore;
    private final CodescopeProperties properties;

    public GrepController(ContentGrepService grepService, WorkspaceStore workspaceStore,
                          CodescopeProperties properties) {
        this.grepService = grepService;
        this.workspaceStore = workspaceStore;
        this.properties = properties;
    }

    /**
     * GET /api/grep?q=&ext=&cat=&limit=&maxPerFile=
     * limit is clamped to the configured maximum, maxPerFile to at least 1.
     * ext is a comma-separated extension list, cat a manifest category prefix.
     */
    @GetMapping("/grep")
    public GrepResponse grep(
            @RequestParam(name = "q", required = false) String query,
            @RequestParam(required = false) String ext,
            @RequestParam(required = false) String cat,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer maxPerFile) {
        CodescopeProperties.Grep cfg = properties.getGrep();
        int effectiveLimit = Math.max(0, Math.min(limit != null ? limit : cfg.getDefaultLimit(), cfg.getMaxLimit()));
        int effectivePerFile = Math.max(1, maxPerFile != null ? maxPerFile : cfg.getDefaultMaxPerFile());
        PathFilter filter = PathFilter.of(ext, cat);

        log.debug("[Grep] q='{}' limit={} maxPerFile={} filter={}", query, effectiveLimit, effectivePerFile, filter);
        RepositorySnapshot snapshot = workspaceStore.current();
        return grepService.grep(snapshot, filter.apply(snapshot.files()), query, effectiveLimit, effectivePerFile,
                Deadline.after(properties.getRequestTimeout()));
    }
}
