package com.example.reelfetch_backend.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-proxy request counter for the current rate-limit window.
 * Not thread-safe; the owning pool serializes access.
 */
public class ProxyUsageRecord {
    private Instant lastUsedAt;
    private int requestsInCurrentWindow;

    public Instant getLastUsedAt() {
        return lastUsedAt;
    }

    public int getRequestsInCurrentWindow() {
        return requestsInCurrentWindow;
    }

    /** Count as it would be after a window reset at {@code now}; does not modify the record. */
    public int requestsAt(Instant now, Duration window) {
        return isWindowExpired(now, window) ? 0 : requestsInCurrentWindow;
    }

    private boolean isWindowExpired(Instant now, Duration window) {
        return lastUsedAt != null && Duration.between(lastUsedAt, now).compareTo(window) > 0;
    }

    /**
     * Zeroes the counter when more than {@code window} has passed since the last use.
     */
    public void resetIfWindowExpired(Instant now, Duration window) {
        if (isWindowExpired(now, window)) {
            requestsInCurrentWindow = 0;
        }
    }

    public void recordUse(Instant now) {
        requestsInCurrentWindow++;
        lastUsedAt = now;
    }

    public ProxyUsageRecord copy() {
        ProxyUsageRecord copy = new ProxyUsageRecord();
        copy.lastUsedAt = lastUsedAt;
        copy.requestsInCurrentWindow = requestsInCurrentWindow;
        return copy;
    }
}
