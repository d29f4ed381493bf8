package com.example.reelfetch_backend.service;

import com.example.reelfetch_backend.exception.ErrorKind;

/**
 * Outcome of classifying one failed fetch attempt.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.Abort {

    /** Transient failure; try again with a rotated proxy. */
    record Retry(boolean rateLimitSignal) implements RetryDecision { }

    record Abort(ErrorKind kind) implements RetryDecision { }
}
