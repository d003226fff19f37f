package com.example.fok.service.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    UNREGISTERED(HttpStatus.FORBIDDEN, false),
    BLOCKED(HttpStatus.FORBIDDEN, false),
    INVALID_TRANSITION(HttpStatus.UNPROCESSABLE_ENTITY, false),
    FORBIDDEN(HttpStatus.FORBIDDEN, false),
    CONFLICT(HttpStatus.CONFLICT, true),
    THROTTLED(HttpStatus.TOO_MANY_REQUESTS, true),
    STORAGE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true),
    NOT_FOUND(HttpStatus.NOT_FOUND, false),
    BAD_REQUEST(HttpStatus.BAD_REQUEST, false);

    private final HttpStatus status;
    private final boolean retryable;

    ErrorCode(HttpStatus status, boolean retryable) {
        this.status = status;
        this.retryable = retryable;
    }

    public HttpStatus getStatus() {
        return status;
    }

    /**
     * Whether the caller may retry the same request after re-reading current state.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
