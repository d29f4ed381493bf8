package com.example.reelfetch_backend.service;

import com.example.reelfetch_backend.config.ArtifactProperties;
import com.example.reelfetch_backend.exception.RetrievalException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ReclaimerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private ArtifactLocks locks;
    private FakeTranscoder transcoder;
    private ArtifactStore store;
    private Reclaimer reclaimer;

    @BeforeEach
    void setUp() {
        ArtifactProperties properties = new ArtifactProperties();
        properties.setRoot(tempDir.resolve("downloads").toString());
        clock = new MutableClock(NOW);
        locks = new ArtifactLocks();
        transcoder = new FakeTranscoder();
        store = new ArtifactStore(properties, transcoder, locks, clock);
        reclaimer = new Reclaimer(store, locks, clock);
    }

    @Test
    void deletesOnlyExpiredDirectories() throws IOException {
        Path expired = artifactDir("OLD", NOW.minusSeconds(1).toString());
        Path fresh = artifactDir("NEW", NOW.plusSeconds(600).toString());

        SweepReport report = reclaimer.sweepOnce();

        assertThat(expired).doesNotExist();
        assertThat(fresh).exists();
        assertThat(report).isEqualTo(new SweepReport(2, 1, 1, 0));
    }

    @Test
    void leavesDirectoriesWithoutReadableMarker() throws IOException {
        Path noMarker = Files.createDirectories(root().resolve("NOMARK"));
        Files.writeString(noMarker.resolve("NOMARK.mp4"), "video");
        Path garbage = artifactDir("GARBAGE", "next tuesday");
        Files.writeString(root().resolve("stray.txt"), "not a directory");

        SweepReport report = reclaimer.sweepOnce();

        assertThat(noMarker).exists();
        assertThat(garbage).exists();
        assertThat(report.scanned()).isEqualTo(2);
        assertThat(report.deleted()).isZero();
    }

    @Test
    void acceptsZoneLessTimestampsInClockZone() throws IOException {
        Path legacy = artifactDir("LEGACY", "2026-01-01T11:00:00.123456");

        reclaimer.sweepOnce();

        assertThat(legacy).doesNotExist();
        assertThat(reclaimer.parseTimestamp("2026-01-01T13:00:00+01:00")).isEqualTo(NOW);
    }

    @Test
    void storedArtifactIsReclaimedAfterTtl() {
        store.put("ABC123", "raw".getBytes(StandardCharsets.UTF_8), "caption");

        reclaimer.sweepOnce();
        assertThat(root().resolve("ABC123")).exists();

        clock.advance(Duration.ofHours(1).plusSeconds(1));
        reclaimer.sweepOnce();
        assertThat(root().resolve("ABC123")).doesNotExist();
    }

    @Test
    void failedPutIsNeverReclaimed() {
        transcoder.failNext();
        assertThrows(RetrievalException.class,
                () -> store.put("BROKEN", "raw".getBytes(StandardCharsets.UTF_8), null));

        clock.advance(Duration.ofDays(30));
        SweepReport report = reclaimer.sweepOnce();

        assertThat(root().resolve("BROKEN")).exists();
        assertThat(report.deleted()).isZero();
    }

    @Test
    void busyDirectoryIsLeftForNextSweep() throws Exception {
        Path expired = artifactDir("BUSY", NOW.minusSeconds(5).toString());
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread writer = new Thread(() -> {
            ReentrantLock lock = locks.acquire("BUSY");
            try {
                locked.countDown();
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                lock.unlock();
            }
        });
        writer.start();
        assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

        SweepReport busy = reclaimer.sweepOnce();
        assertThat(expired).exists();
        assertThat(busy.skipped()).isEqualTo(1);

        release.countDown();
        writer.join(5_000);

        reclaimer.sweepOnce();
        assertThat(expired).doesNotExist();
    }

    @Test
    void reclaimedArtifactsDropTheirLockEntries() {
        for (int i = 0; i < 50; i++) {
            store.put("POST" + i, "raw".getBytes(StandardCharsets.UTF_8), null);
        }
        assertThat(locks.size()).isEqualTo(50);

        clock.advance(Duration.ofHours(2));
        SweepReport report = reclaimer.sweepOnce();

        assertThat(report.deleted()).isEqualTo(50);
        assertThat(locks.size()).isZero();
    }

    @Test
    void directoryRemovedDuringSweepCountsAsDeleted() throws IOException {
        Path expired = artifactDir("GONE", NOW.minusSeconds(5).toString());
        AtomicInteger reads = new AtomicInteger();
        Clock vanishing = new Clock() {
            @Override
            public ZoneId getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                throw new UnsupportedOperationException();
            }

            @Override
            public Instant instant() {
                // second read happens under the lock, right before deletion
                if (reads.incrementAndGet() == 2) {
                    deleteTree(expired);
                }
                return NOW;
            }
        };
        Reclaimer racing = new Reclaimer(store, locks, vanishing);

        SweepReport report = racing.sweepOnce();

        assertThat(expired).doesNotExist();
        assertThat(report).isEqualTo(new SweepReport(1, 1, 0, 0));
    }

    @Test
    void scheduledSweepSurvivesMissingRoot() throws IOException {
        Files.delete(root());

        reclaimer.scheduledSweep();

        assertThat(reclaimer.sweepOnce().failed()).isEqualTo(1);
    }

    private Path root() {
        return store.root();
    }

    private Path artifactDir(String id, String marker) throws IOException {
        Path dir = Files.createDirectories(root().resolve(id));
        Files.writeString(dir.resolve(id + ".mp4"), "video");
        Files.writeString(dir.resolve(ArtifactStore.EXPIRY_MARKER), marker);
        return dir;
    }

    private static void deleteTree(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
