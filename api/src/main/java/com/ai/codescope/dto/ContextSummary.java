package com.ai.codescope.dto;

import com.ai.codescope.model.BudgetUnit;

public record ContextSummary(
        int totalFiles,
        long totalTokens,
        int truncatedFiles,
        long budget,
        BudgetUnit unit) {
}
