package com.ai.codescope.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Error body returned by every endpoint of the API.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        OffsetDateTime timestamp,
        int status,
        String error,
        String code,
        String message,
        String path,
        Map<String, Object> details) {

    public static ApiError of(HttpStatus status, String code, String message, String path) {
        return of(status, code, message, path, null);
    }

    public static ApiError of(HttpStatus status, String code, String message, String path,
            Map<String, Object> details) {
        return new ApiError(OffsetDateTime.now(), status.value(), status.getReasonPhrase(), code, message, path,
                details);
    }
}
