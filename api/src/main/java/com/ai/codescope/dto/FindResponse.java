package com.ai.codescope.dto;

import java.util.List;

public record FindResponse(
        List<FindResult> results,
        long queryTimeMs) {

    public static FindResponse empty() {
        return new FindResponse(List.of(), 0);
    }
}
