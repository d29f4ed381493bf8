package com.example.reelfetch_backend.service;

import com.example.reelfetch_backend.config.ArtifactProperties;
import com.example.reelfetch_backend.engine.Interfaces.VideoTranscoder;
import com.example.reelfetch_backend.engine.TranscodeException;
import com.example.reelfetch_backend.exception.ErrorKind;
import com.example.reelfetch_backend.exception.RetrievalException;
import com.example.reelfetch_backend.model.ArtifactHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Local artifact directories, one per post: {@code <root>/<id>/<id>.mp4}, an optional {@code <id>.txt} caption
 * and the {@value #EXPIRY_MARKER} file. The marker is written last; its presence means the artifact is complete
 * and its content is the instant after which the {@link Reclaimer} may delete the directory.
 */
@Service
public class ArtifactStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactStore.class);

    public static final String EXPIRY_MARKER = "expiry_timestamp.txt";
    private static final Pattern SAFE_POST_ID = Pattern.compile("[A-Za-z0-9_-]+");

    private final ArtifactProperties properties;
    private final VideoTranscoder transcoder;
    private final ArtifactLocks locks;
    private final Clock clock;
    private final Path root;

    public ArtifactStore(ArtifactProperties properties, VideoTranscoder transcoder, ArtifactLocks locks, Clock clock) {
        this.properties = properties;
        this.transcoder = transcoder;
        this.locks = locks;
        this.clock = clock;
        this.root = Path.of(properties.getRoot()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(root);
            LOGGER.info("ArtifactStore ready. root={}, ttl={}", root, properties.getTtl());
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create artifact root " + root, e);
        }
    }

    /**
     * Stores a freshly fetched video, replacing any previous artifact of the same post.
     *
     * @throws RetrievalException {@link ErrorKind#TRANSCODE_FAILED} when normalization fails; the directory is
     *                            then left without an expiry marker
     */
    public ArtifactHandle put(String postId, byte[] videoBytes, String caption) {
        validatePostId(postId);
        Path dir = root.resolve(postId);
        ReentrantLock lock = locks.acquire(postId);
        try {
            // no longer ready until the new content is complete
            Files.deleteIfExists(dir.resolve(EXPIRY_MARKER));
            Files.createDirectories(dir);

            Path staging = dir.resolve(postId + ".raw.mp4");
            writeRecreatingDir(dir, () -> Files.write(staging, videoBytes));

            Path normalized;
            try {
                normalized = transcoder.normalize(staging);
            } catch (TranscodeException e) {
                LOGGER.error("Transcode failed postId={} err={} output={}", postId, e.getMessage(), e.getProcessOutput());
                Files.deleteIfExists(staging);
                throw new RetrievalException(ErrorKind.TRANSCODE_FAILED, "Transcoding failed.", e);
            }

            Path video = dir.resolve(videoFileName(postId));
            if (!normalized.equals(video)) {
                writeRecreatingDir(dir, () -> Files.move(normalized, video, REPLACE_EXISTING, ATOMIC_MOVE));
            }

            Path captionFile = dir.resolve(postId + ".txt");
            if (caption != null && !caption.isBlank()) {
                writeRecreatingDir(dir, () -> Files.writeString(captionFile, caption, StandardCharsets.UTF_8));
            } else {
                Files.deleteIfExists(captionFile);
            }

            Instant expiresAt = clock.instant().plus(properties.getTtl());
            writeMarker(dir, expiresAt);
            LOGGER.info("Artifact stored postId={} bytes={} expiresAt={}", postId, Files.size(video), expiresAt);
            return new ArtifactHandle(postId, dir, video, expiresAt);
        } catch (IOException e) {
            throw new RetrievalException(ErrorKind.UNEXPECTED, "Failed to store the downloaded video.", e);
        } finally {
            lock.unlock();
        }
    }

    /** Link relative to the server root, or absolute when {@code artifacts.public-base-url} is set. */
    public URI playbackUrl(String postId) {
        if (hasPublicBaseUrl()) {
            return playbackUrl(URI.create(properties.getPublicBaseUrl()), postId);
        }
        return buildUrl(UriComponentsBuilder.newInstance(), postId);
    }

    public URI playbackUrl(URI baseUrl, String postId) {
        return buildUrl(UriComponentsBuilder.fromUri(baseUrl), postId);
    }

    public boolean hasPublicBaseUrl() {
        String base = properties.getPublicBaseUrl();
        return base != null && !base.isBlank();
    }

    public Path root() {
        return root;
    }

    public Path videoPath(String postId) {
        validatePostId(postId);
        return root.resolve(postId).resolve(videoFileName(postId));
    }

    static String videoFileName(String postId) {
        return postId + ".mp4";
    }

    private URI buildUrl(UriComponentsBuilder builder, String postId) {
        validatePostId(postId);
        return builder.path(properties.getUrlPrefix())
                .pathSegment(postId, videoFileName(postId))
                .build()
                .toUri();
    }

    private void writeMarker(Path dir, Instant expiresAt) throws IOException {
        Path tmp = dir.resolve(EXPIRY_MARKER + ".tmp");
        writeRecreatingDir(dir, () -> Files.writeString(tmp, expiresAt.toString(), StandardCharsets.UTF_8));
        Files.move(tmp, dir.resolve(EXPIRY_MARKER), REPLACE_EXISTING, ATOMIC_MOVE);
    }

    private void writeRecreatingDir(Path dir, IoAction action) throws IOException {
        try {
            action.run();
        } catch (NoSuchFileException e) {
            LOGGER.warn("Artifact directory vanished during write, recreating dir={}", dir);
            Files.createDirectories(dir);
            action.run();
        }
    }

    private static void validatePostId(String postId) {
        if (postId == null || !SAFE_POST_ID.matcher(postId).matches()) {
            throw new RetrievalException(ErrorKind.INVALID_INPUT, "Invalid post identifier.");
        }
    }

    @FunctionalInterface
    private interface IoAction {
        void run() throws IOException;
    }
}
