package com.ai.codescope.dto;

import com.ai.codescope.model.ImportEdge;

import java.util.List;

public record ImportsResponse(
        String path,
        List<ImportEdge> imports,
        List<String> importedBy) {
}
