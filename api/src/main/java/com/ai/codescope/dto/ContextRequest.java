package com.ai.codescope.dto;

import com.ai.codescope.model.BudgetUnit;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * Request DTO for budget-bounded context assembly.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContextRequest(
        @NotNull List<String> paths,
        BudgetUnit unit, // "tokens" | "bytes"
        @PositiveOrZero Long budget) {
    public ContextRequest {
        if (unit == null) {
            unit = BudgetUnit.TOKENS;
        }
    }
}
