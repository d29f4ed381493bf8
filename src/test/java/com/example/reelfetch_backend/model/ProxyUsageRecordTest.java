package com.example.reelfetch_backend.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ProxyUsageRecordTest {

    private static final Duration WINDOW = Duration.ofSeconds(60);
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void countsUsesInsideWindow() {
        ProxyUsageRecord record = new ProxyUsageRecord();
        record.recordUse(T0);
        record.recordUse(T0.plusSeconds(30));

        assertThat(record.getRequestsInCurrentWindow()).isEqualTo(2);
        assertThat(record.getLastUsedAt()).isEqualTo(T0.plusSeconds(30));
        assertThat(record.requestsAt(T0.plusSeconds(60), WINDOW)).isEqualTo(2);
    }

    @Test
    void resetsOnlyAfterWindowElapsedSinceLastUse() {
        ProxyUsageRecord record = new ProxyUsageRecord();
        record.recordUse(T0);

        record.resetIfWindowExpired(T0.plusSeconds(60), WINDOW);
        assertThat(record.getRequestsInCurrentWindow()).isEqualTo(1);

        record.resetIfWindowExpired(T0.plusSeconds(61), WINDOW);
        assertThat(record.getRequestsInCurrentWindow()).isZero();
    }

    @Test
    void requestsAtDoesNotModify() {
        ProxyUsageRecord record = new ProxyUsageRecord();
        record.recordUse(T0);

        assertThat(record.requestsAt(T0.plusSeconds(120), WINDOW)).isZero();
        assertThat(record.getRequestsInCurrentWindow()).isEqualTo(1);
    }

    @Test
    void copyIsIndependent() {
        ProxyUsageRecord record = new ProxyUsageRecord();
        record.recordUse(T0);
        ProxyUsageRecord copy = record.copy();
        record.recordUse(T0.plusSeconds(1));

        assertThat(copy.getRequestsInCurrentWindow()).isEqualTo(1);
        assertThat(copy.getLastUsedAt()).isEqualTo(T0);
    }
}
