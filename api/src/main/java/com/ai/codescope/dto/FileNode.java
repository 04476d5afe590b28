package com.ai.codescope.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileNode(
        String id,
        String name,
        String type,     // "folder" | "file"
        String path,
        Long size,       // files only
        String language, // files only
        List<FileNode> children
) {}
