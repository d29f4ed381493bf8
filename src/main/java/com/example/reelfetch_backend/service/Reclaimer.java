package com.example.reelfetch_backend.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Deletes artifact directories whose expiry marker lies in the past. Directories without a readable marker are
 * never touched; directories being written right now are left for the next sweep.
 */
@Service
public class Reclaimer {
    private static final Logger LOGGER = LoggerFactory.getLogger(Reclaimer.class);

    private final ArtifactStore store;
    private final ArtifactLocks locks;
    private final Clock clock;

    public Reclaimer(ArtifactStore store, ArtifactLocks locks, Clock clock) {
        this.store = store;
        this.locks = locks;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${artifacts.reclaim-interval-ms:3600000}")
    public void scheduledSweep() {
        LOGGER.info("Running artifact cleanup root={}", store.root());
        try {
            SweepReport report = sweepOnce();
            LOGGER.info("Artifact cleanup done scanned={} deleted={} skipped={} failed={}",
                    report.scanned(), report.deleted(), report.skipped(), report.failed());
        } catch (RuntimeException e) {
            LOGGER.error("Artifact cleanup failed: {}", e.toString(), e);
        }
    }

    public SweepReport sweepOnce() {
        List<Path> dirs;
        try (Stream<Path> entries = Files.list(store.root())) {
            dirs = entries.filter(Files::isDirectory).collect(Collectors.toCollection(ArrayList::new));
        } catch (IOException e) {
            LOGGER.error("Cannot list artifact root={} err={}", store.root(), e.toString());
            return new SweepReport(0, 0, 0, 1);
        }

        int deleted = 0;
        int skipped = 0;
        int failed = 0;
        for (Path dir : dirs) {
            try {
                if (reclaimIfExpired(dir)) {
                    deleted++;
                } else {
                    skipped++;
                }
            } catch (IOException | RuntimeException e) {
                failed++;
                LOGGER.error("Error processing {}: {}", dir, e.toString());
            }
        }
        return new SweepReport(dirs.size(), deleted, skipped, failed);
    }

    private boolean reclaimIfExpired(Path dir) throws IOException {
        Optional<Instant> expiry = readExpiry(dir);
        Instant now = clock.instant();
        if (expiry.isEmpty() || !now.isAfter(expiry.get())) {
            return false;
        }

        String postId = dir.getFileName().toString();
        ReentrantLock lock = locks.tryAcquire(postId);
        if (lock == null) {
            LOGGER.debug("Artifact busy, retrying next sweep dir={}", dir);
            return false;
        }
        try {
            // a writer may have refreshed the marker between the first read and taking the lock
            Optional<Instant> current = readExpiry(dir);
            if (current.isEmpty() || !clock.instant().isAfter(current.get())) {
                return false;
            }
            LOGGER.info("Deleting expired directory: {} expiredAt={}", dir, current.get());
            deleteRecursively(dir);
            locks.release(postId, lock);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private Optional<Instant> readExpiry(Path dir) throws IOException {
        Path marker = dir.resolve(ArtifactStore.EXPIRY_MARKER);
        String content;
        try {
            content = Files.readString(marker, StandardCharsets.UTF_8).strip();
        } catch (NoSuchFileException e) {
            LOGGER.debug("No expiry marker, leaving dir={}", dir);
            return Optional.empty();
        }
        try {
            return Optional.of(parseTimestamp(content));
        } catch (DateTimeParseException e) {
            LOGGER.warn("Unparsable expiry marker dir={} content='{}', leaving it", dir, content);
            return Optional.empty();
        }
    }

    /**
     * Accepts an ISO-8601 instant or offset date-time, or a zone-less local date-time interpreted in the
     * clock's zone.
     */
    Instant parseTimestamp(String content) {
        try {
            return Instant.parse(content);
        } catch (DateTimeParseException ignored) {
            // fall through to the other ISO shapes
        }
        try {
            return OffsetDateTime.parse(content).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        return LocalDateTime.parse(content).atZone(clock.getZone()).toInstant();
    }

    private void deleteRecursively(Path dir) throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
        } catch (NoSuchFileException e) {
            LOGGER.debug("Directory already gone dir={}", dir);
        } catch (UncheckedIOException e) {
            if (Files.exists(dir)) {
                throw e.getCause();
            }
            LOGGER.debug("Directory vanished mid-delete dir={}", dir);
        }
    }
}
