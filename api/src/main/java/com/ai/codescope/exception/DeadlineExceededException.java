package com.ai.codescope.exception;

/**
 * Thrown when a request's scan does not finish before its deadline.
 * Partial results are discarded; nothing ranked is returned to the caller.
 */
public class DeadlineExceededException extends RuntimeException {
    public DeadlineExceededException(String message) {
        super(message);
    }

    public DeadlineExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
