package com.ai.codescope.controller;

import com.ai.codescope.config.CodescopeProperties;
import com.ai.codescope.dto.FindResponse;
import com.ai.codescope.dto.SearchResponse;
import com.ai.codescope.model.Deadline;
import com.ai.codescope.service.FindService;
import com.ai.codescope.service.PathFilter;
import com.ai.codescope.service.SearchRankingService;
import com.ai.codescope.service.WorkspaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Filename search and combined filename/content ranking.
 */
@RestController
@RequestMapping("/api")
public class SearchController {

    private static final Logger log = LoggerFactory.getLogger(SearchController.class);

    private final SearchRankingService searchRankingService;
    private final FindService findService;
    private final WorkspaceStore workspaceStore;
    private final CodescopeProperties properties;

    public SearchController(SearchRankingService searchRankingService,
                            FindService findService,
                            WorkspaceStore workspaceStore,
                            CodescopeProperties properties) {
        this.searchRankingService = searchRankingService;
        this.findService = findService;
        this.workspaceStore = workspaceStore;
        this.properties = properties;
    }

    /**
     * GET /api/search?q=&fileLimit=&moduleLimit=
     */
    @GetMapping("/search")
    public SearchResponse search(
            @RequestParam(name = "q", required = false) String query,
            @RequestParam(required = false) Integer fileLimit,
            @RequestParam(required = false) Integer moduleLimit) {
        CodescopeProperties.Search cfg = properties.getSearch();
        int files = Math.max(0, fileLimit != null ? fileLimit : cfg.getDefaultFileLimit());
        int modules = Math.max(0, moduleLimit != null ? moduleLimit : cfg.getDefaultModuleLimit());

        log.debug("[Search] q='{}' fileLimit={} moduleLimit={}", query, files, modules);
        return searchRankingService.search(workspaceStore.current(), query, files, modules);
    }

    /**
     * GET /api/find?q=&ext=&cat=&limit=
     */
    @GetMapping("/find")
    public FindResponse find(
            @RequestParam(name = "q", required = false) String query,
            @RequestParam(required = false) String ext,
            @RequestParam(required = false) String cat,
            @RequestParam(required = false) Integer limit) {
        CodescopeProperties.Search cfg = properties.getSearch();
        int effective = clamp(limit != null ? limit : cfg.getDefaultFindLimit(), cfg.getMaxFindLimit());
        PathFilter filter = PathFilter.of(ext, cat);

        log.debug("[Find] q='{}' limit={} filter={}", query, effective, filter);
        return findService.find(workspaceStore.current(), query, effective, filter,
                Deadline.after(properties.getRequestTimeout()));
    }

    static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }
}
