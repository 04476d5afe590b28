package com.ai.codescope.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DeadlineExceededException.class)
    public ResponseEntity<ApiError> handleDeadlineExceeded(DeadlineExceededException e, WebRequest request) {
        log.error("[ExceptionHandler] Deadline exceeded: {}", e.getMessage());

        ApiError error = ApiError.of(
                HttpStatus.GATEWAY_TIMEOUT,
                "DEADLINE_EXCEEDED",
                "The request did not complete before its deadline; no partial results are returned",
                getRequestPath(request),
                Map.of("originalError", String.valueOf(e.getMessage())));

        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(error);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleResponseStatus(ResponseStatusException e, WebRequest request) {
        log.error("[ExceptionHandler] ResponseStatusException: status={}, reason={}", e.getStatusCode(), e.getReason());

        String code = e.getReason();
        if (code != null && code.contains(":")) {
            code = code.split(":")[0].trim();
        }

        ApiError error = ApiError.of(
                HttpStatus.valueOf(e.getStatusCode().value()),
                (code != null && !code.isBlank()) ? code : "API_ERROR",
                e.getReason() != null ? e.getReason() : e.getMessage(),
                getRequestPath(request));

        return ResponseEntity.status(e.getStatusCode()).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidArgument(MethodArgumentNotValidException e, WebRequest request) {
        log.warn("[ExceptionHandler] Validation failed: {} field error(s)", e.getBindingResult().getErrorCount());

        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            fields.put(fieldError.getField(), fieldError.getDefaultMessage());
        }

        ApiError error = ApiError.of(
                HttpStatus.BAD_REQUEST,
                "INVALID_REQUEST",
                "Request validation failed",
                getRequestPath(request),
                fields);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e, WebRequest request) {
        log.warn("[ExceptionHandler] Bad parameter '{}': {}", e.getName(), e.getValue());

        ApiError error = ApiError.of(
                HttpStatus.BAD_REQUEST,
                "INVALID_PARAMETER",
                "Invalid value for parameter '" + e.getName() + "'",
                getRequestPath(request));

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e,
            WebRequest request) {
        log.warn("[ExceptionHandler] Missing parameter '{}'", e.getParameterName());

        ApiError error = ApiError.of(
                HttpStatus.BAD_REQUEST,
                "MISSING_PARAMETER",
                "Required parameter '" + e.getParameterName() + "' is missing",
                getRequestPath(request));

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleNotReadable(HttpMessageNotReadableException e, WebRequest request) {
        log.error("[ExceptionHandler] HttpMessageNotReadableException: {}", e.getMessage());

        ApiError error = ApiError.of(
                HttpStatus.BAD_REQUEST,
                "INVALID_PAYLOAD",
                "Invalid request payload.",
                getRequestPath(request),
                Map.of("details", String.valueOf(e.getMostSpecificCause().getMessage())));

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception e, WebRequest request) {
        log.error("[ExceptionHandler] Unexpected error: ", e);

        ApiError error = ApiError.of(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "INTERNAL_SERVER_ERROR",
                "An unexpected error occurred: " + e.getMessage(),
                getRequestPath(request));

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private String getRequestPath(WebRequest request) {
        if (request instanceof ServletWebRequest) {
            return ((ServletWebRequest) request).getRequest().getRequestURI();
        }
        return null;
    }
}
