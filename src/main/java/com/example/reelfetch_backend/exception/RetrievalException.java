package com.example.reelfetch_backend.exception;

import java.util.Objects;

/**
 * Terminal failure of a download request. The message is safe to show to clients.
 */
public class RetrievalException extends RuntimeException {
    private final ErrorKind kind;

    public RetrievalException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public RetrievalException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
