package com.example.reelfetch_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Attempt ceiling and randomized backoff bounds for the retrieval loop.
 */
@ConfigurationProperties(prefix = "retrieval")
public class RetrievalProperties {
    private int maxAttempts = 20;
    private Duration backoffMin = Duration.ofSeconds(1);
    private Duration backoffMax = Duration.ofSeconds(3);

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getBackoffMin() {
        return backoffMin;
    }

    public void setBackoffMin(Duration backoffMin) {
        this.backoffMin = backoffMin;
    }

    public Duration getBackoffMax() {
        return backoffMax;
    }

    public void setBackoffMax(Duration backoffMax) {
        this.backoffMax = backoffMax;
    }
}
