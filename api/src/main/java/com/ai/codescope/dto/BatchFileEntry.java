package com.ai.codescope.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchFileEntry(
        String content,
        Long size,
        String error) {

    public static BatchFileEntry ok(String content, long size) {
        return new BatchFileEntry(content, size, null);
    }

    public static BatchFileEntry failed(String error) {
        return new BatchFileEntry(null, null, error);
    }
}
