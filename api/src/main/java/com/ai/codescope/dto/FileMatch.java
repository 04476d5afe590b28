package com.ai.codescope.dto;

/**
 * Filename-ranked search hit.
 */
public record FileMatch(
        String path,
        String filename,
        double score) {
}
