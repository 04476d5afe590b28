package com.ai.codescope.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotNull;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BatchFilesRequest(
        @NotNull List<String> paths,
        String mode) { // "full" | "stubs"
    public BatchFilesRequest {
        if (mode == null) {
            mode = "full";
        }
    }

    public boolean stubs() {
        return "stubs".equalsIgnoreCase(mode);
    }
}
