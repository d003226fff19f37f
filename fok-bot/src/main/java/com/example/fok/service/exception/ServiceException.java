package com.example.fok.service.exception;

import org.springframework.http.HttpStatus;

public class ServiceException extends RuntimeException {

    private final ErrorCode code;

    public ServiceException(ErrorCode code, String message) {
        this(code, message, null);
    }

    public ServiceException(ErrorCode code, String message, Throwable cause) {
        super(message, cause, false, code.getStatus().is5xxServerError());
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return code.getStatus();
    }

    public String getErrorCode() {
        return code.name();
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }
}
