package com.example.reelfetch_backend.service;

import com.example.reelfetch_backend.engine.PostFetchException;
import com.example.reelfetch_backend.exception.ErrorKind;
import com.example.reelfetch_backend.util.FetchErrorKind;

import java.util.Set;

/**
 * Decides whether a failed attempt is worth retrying through another proxy.
 * Network trouble and 401/403/429 responses are connection-class; everything else ends the request.
 */
public final class FailureClassifier {
    private static final Set<Integer> RATE_LIMIT_STATUSES = Set.of(401, 403, 429);

    private FailureClassifier() {
    }

    public static RetryDecision classify(Throwable failure) {
        if (!(failure instanceof PostFetchException fetchFailure)) {
            return new RetryDecision.Abort(ErrorKind.UNEXPECTED);
        }
        Integer status = fetchFailure.getHttpStatus();
        if (status != null && RATE_LIMIT_STATUSES.contains(status)) {
            return new RetryDecision.Retry(true);
        }
        FetchErrorKind kind = fetchFailure.getKind();
        if (kind == FetchErrorKind.FORBIDDEN) {
            return new RetryDecision.Retry(true);
        }
        if (kind == FetchErrorKind.CONNECTION) {
            return new RetryDecision.Retry(false);
        }
        return new RetryDecision.Abort(ErrorKind.UPSTREAM_REJECTED);
    }
}
