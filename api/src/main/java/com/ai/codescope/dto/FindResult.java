package com.ai.codescope.dto;

public record FindResult(
        String path,
        double filenameScore,
        double contentScore,
        double combinedScore) {
}
