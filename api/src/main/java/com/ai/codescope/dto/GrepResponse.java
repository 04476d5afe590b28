package com.ai.codescope.dto;

import java.util.List;

public record GrepResponse(
        List<GrepMatch> matches,
        int totalMatches,
        int searchedFiles,
        long queryTimeMs) {

    public static GrepResponse empty() {
        return new GrepResponse(List.of(), 0, 0, 0);
    }
}
