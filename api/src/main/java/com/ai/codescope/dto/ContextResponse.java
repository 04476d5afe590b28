package com.ai.codescope.dto;

import java.util.List;

public record ContextResponse(
        List<ContextEntry> entries,
        ContextSummary summary) {
}
