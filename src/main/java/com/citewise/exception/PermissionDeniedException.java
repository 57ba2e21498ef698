package com.citewise.exception;

/**
 * Raised when an upstream service explicitly refuses access (HTTP 401/403).
 * Never retried.
 */
public class PermissionDeniedException extends RuntimeException {

    private final int statusCode;

    public PermissionDeniedException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public PermissionDeniedException(String message) {
        this(message, 403, null);
    }

    public int getStatusCode() {
        return statusCode;
    }
}
