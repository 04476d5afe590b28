package com.ai.codescope.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Unit in which a context budget is expressed.
 */
public enum BudgetUnit {
    TOKENS,
    BYTES;

    @JsonCreator
    public static BudgetUnit fromValue(String value) {
        if (value == null || value.isBlank()) {
            return TOKENS;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "tokens" -> TOKENS;
            case "bytes", "chars" -> BYTES;
            default -> throw new IllegalArgumentException("Unknown budget unit: " + value);
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
