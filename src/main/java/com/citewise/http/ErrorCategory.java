package com.citewise.http;

import com.citewise.exception.PermissionDeniedException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Classification of outbound HTTP failures.
 *
 * - TRANSIENT_NETWORK: connect/read failures and timeouts
 * - SERVER: 5xx responses
 * - RATE_LIMITED: 429 responses
 * - CLIENT: any other 4xx response
 * - PERMISSION_DENIED: 401/403 responses
 * - UNEXPECTED: everything else (parse errors, bugs)
 */
public enum ErrorCategory {
    TRANSIENT_NETWORK,
    SERVER,
    RATE_LIMITED,
    CLIENT,
    PERMISSION_DENIED,
    UNEXPECTED;

    /**
     * Classify a failure, walking the cause chain for wrapped network errors.
     */
    public static ErrorCategory of(Throwable error) {
        if (error instanceof PermissionDeniedException) {
            return PERMISSION_DENIED;
        }
        if (error instanceof WebClientResponseException responseException) {
            return ofStatus(responseException.getStatusCode().value());
        }
        if (error instanceof WebClientRequestException) {
            return TRANSIENT_NETWORK;
        }

        Throwable current = error;
        while (current != null) {
            if (current instanceof IOException
                    || current instanceof TimeoutException
                    || current instanceof io.netty.handler.timeout.TimeoutException) {
                return TRANSIENT_NETWORK;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return UNEXPECTED;
    }

    /**
     * Classify an HTTP status code. Only meaningful for error statuses.
     */
    public static ErrorCategory ofStatus(int status) {
        if (status == 401 || status == 403) {
            return PERMISSION_DENIED;
        }
        if (status == 429) {
            return RATE_LIMITED;
        }
        if (status >= 500) {
            return SERVER;
        }
        if (status >= 400) {
            return CLIENT;
        }
        return UNEXPECTED;
    }
}
