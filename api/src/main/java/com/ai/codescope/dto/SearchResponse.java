package com.ai.codescope.dto;

import java.util.List;

public record SearchResponse(
        List<FileMatch> files,
        List<ModuleMatch> modules,
        int totalFiles,
        int totalModules,
        long queryTimeMs) {

    public static SearchResponse empty(int totalFiles, int totalModules) {
        return new SearchResponse(List.of(), List.of(), totalFiles, totalModules, 0);
    }
}
