package com.ai.codescope.dto;

public record ManifestEntry(
        String path,
        String desc,
        long size) {
}
