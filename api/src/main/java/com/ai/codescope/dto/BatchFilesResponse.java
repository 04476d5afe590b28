package com.ai.codescope.dto;

import java.util.Map;

public record BatchFilesResponse(Map<String, BatchFileEntry> files) {
}
