package com.example.reelfetch_backend.engine;

import com.example.reelfetch_backend.util.FetchErrorKind;

import java.util.Objects;

/**
 * Failure reported by a fetch provider, with the upstream HTTP status when one was observed.
 */
public class PostFetchException extends Exception {
    private final FetchErrorKind kind;
    private final Integer httpStatus;

    public PostFetchException(FetchErrorKind kind, Integer httpStatus, String message) {
        this(kind, httpStatus, message, null);
    }

    public PostFetchException(FetchErrorKind kind, Integer httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.httpStatus = httpStatus;
    }

    public FetchErrorKind getKind() {
        return kind;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
