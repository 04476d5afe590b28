package com.ai.codescope.dto;

/**
 * Directory-level search hit, scored by its best-matching member file.
 */
public record ModuleMatch(
        String id,
        String name,
        int fileCount,
        double score) {
}
