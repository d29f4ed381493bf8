package com.example.reelfetch_backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Client-visible failure categories with their stable HTTP status.
 */
public enum ErrorKind {
    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    UPSTREAM_REJECTED(HttpStatus.NOT_FOUND),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS),
    UPSTREAM_UNAVAILABLE(HttpStatus.BAD_GATEWAY),
    TRANSCODE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    UNEXPECTED(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
