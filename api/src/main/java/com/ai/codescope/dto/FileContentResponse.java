package com.ai.codescope.dto;

public record FileContentResponse(
        String path,
        String content,
        int lines,
        long size,
        boolean truncated) {
}
