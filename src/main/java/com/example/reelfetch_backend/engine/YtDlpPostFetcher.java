package com.example.reelfetch_backend.engine;

import com.example.reelfetch_backend.config.YtDlpProperties;
import com.example.reelfetch_backend.engine.Interfaces.PostFetcher;
import com.example.reelfetch_backend.model.FetchedPost;
import com.example.reelfetch_backend.model.Proxy;
import com.example.reelfetch_backend.util.FetchErrorKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Fetches Instagram posts by shelling out to yt-dlp, one connection attempt per call.
 */
public class YtDlpPostFetcher implements PostFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(YtDlpPostFetcher.class);
    private static final int LOG_SNIPPET_MAX = 2_000;
    private static final Pattern HTTP_ERROR = Pattern.compile("HTTP Error (\\d{3})");
    private static final Set<String> VIDEO_EXTENSIONS = Set.of("mp4", "mov", "mkv", "webm");
    private static final List<String> CONNECTION_MARKERS = List.of(
            "timed out",
            "unable to connect",
            "connection refused",
            "connection reset",
            "connection aborted",
            "remote end closed",
            "proxyerror",
            "tunnel connection failed",
            "temporary failure in name resolution",
            "network is unreachable",
            "ssl:"
    );
    private static final List<String> NOT_FOUND_MARKERS = List.of(
            "there is no video in this post",
            "no video formats found",
            "post not found",
            "does not exist",
            "private",
            "not available"
    );

    private final YtDlpProperties properties;
    private final ObjectMapper objectMapper;
    private final Path workDir;

    public YtDlpPostFetcher(YtDlpProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.workDir = Path.of(properties.getWorkDir()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.workDir);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to create fetch work directory: " + this.workDir, e);
        }
    }

    @Override
    public FetchedPost fetch(String shortcode, @Nullable Proxy proxy, String userAgent) throws PostFetchException {
        Path attemptDir = workDir.resolve(shortcode + "-" + UUID.randomUUID());
        try {
            Files.createDirectories(attemptDir);
            List<String> cmd = buildCommand(shortcode, proxy, userAgent, attemptDir);
            ProcessResult result = runProcess(cmd, properties.getProcessTimeoutSeconds());

            if (result.timedOut()) {
                throw new PostFetchException(FetchErrorKind.CONNECTION, null,
                        "yt-dlp timeout after " + properties.getProcessTimeoutSeconds() + "s for " + shortcode);
            }
            if (result.code() != 0) {
                throw classify(result.output());
            }

            Path video = findVideo(attemptDir, shortcode)
                    .orElseThrow(() -> new PostFetchException(FetchErrorKind.NOT_FOUND, null,
                            "No video present in post " + shortcode));
            byte[] bytes = Files.readAllBytes(video);
            JsonNode info = readInfo(attemptDir.resolve(shortcode + ".info.json"));
            String caption = text(info, "description");
            String author = firstNonBlank(text(info, "channel"), text(info, "uploader_id"), text(info, "uploader"));
            LOGGER.info("yt-dlp fetch OK shortcode={} bytes={} author={}", shortcode, bytes.length, author);
            return new FetchedPost(shortcode, bytes, caption, author);
        } catch (IOException e) {
            throw new IllegalStateException("yt-dlp fetch I/O failure for " + shortcode + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PostFetchException(FetchErrorKind.CONNECTION, null, "Fetch interrupted for " + shortcode, e);
        } finally {
            deleteRecursively(attemptDir);
        }
    }

    List<String> buildCommand(String shortcode, @Nullable Proxy proxy, String userAgent, Path attemptDir) {
        List<String> cmd = new ArrayList<>(List.of(
                properties.getBin(),
                "--no-progress", "--newline",
                "--no-playlist",
                "--retries", "0",
                "--fragment-retries", "0",
                "--extractor-retries", "0",
                "--socket-timeout", String.valueOf(properties.getSocketTimeoutSeconds()),
                "-f", "b[ext=mp4]/bv*[ext=mp4]+ba[ext=m4a]/b",
                "--merge-output-format", "mp4",
                "--write-info-json"
        ));
        if (userAgent != null && !userAgent.isBlank()) {
            cmd.add("--user-agent");
            cmd.add(userAgent);
        }
        if (proxy != null) {
            cmd.add("--proxy");
            cmd.add(proxy.connectionString());
        }
        maybeAddCookies(cmd);

        cmd.add("-o");
        cmd.add(attemptDir.resolve(shortcode + ".%(ext)s").toString());
        cmd.add("https://www.instagram.com/p/" + shortcode + "/");
        return cmd;
    }

    /**
     * Maps yt-dlp's error output onto a fetch error kind. 401/403 become FORBIDDEN, throttling becomes
     * CONNECTION with a 429 status, network trouble becomes CONNECTION without a status.
     */
    static PostFetchException classify(String output) {
        String snippet = ProcessRunner.tail(output, LOG_SNIPPET_MAX);
        String normalized = output == null ? "" : output.toLowerCase(Locale.ROOT);
        Integer status = lastHttpStatus(output);

        if (status != null && (status == 401 || status == 403)) {
            return new PostFetchException(FetchErrorKind.FORBIDDEN, status, "Upstream refused access: " + snippet);
        }
        if ((status != null && status == 429)
                || normalized.contains("rate-limit reached")
                || normalized.contains("too many requests")) {
            return new PostFetchException(FetchErrorKind.CONNECTION, 429, "Upstream rate limit: " + snippet);
        }
        if (normalized.contains("login required")) {
            return new PostFetchException(FetchErrorKind.FORBIDDEN, 401, "Upstream requires login: " + snippet);
        }
        if (status != null && status == 404) {
            return new PostFetchException(FetchErrorKind.NOT_FOUND, 404, "Post not found: " + snippet);
        }
        for (String marker : CONNECTION_MARKERS) {
            if (normalized.contains(marker)) {
                return new PostFetchException(FetchErrorKind.CONNECTION, status, "Connection failure: " + snippet);
            }
        }
        if (status != null && status >= 500) {
            return new PostFetchException(FetchErrorKind.CONNECTION, status, "Upstream server error: " + snippet);
        }
        for (String marker : NOT_FOUND_MARKERS) {
            if (normalized.contains(marker)) {
                return new PostFetchException(FetchErrorKind.NOT_FOUND, status, "Post unavailable: " + snippet);
            }
        }
        return new PostFetchException(FetchErrorKind.OTHER, status, "yt-dlp failed: " + snippet);
    }

    protected ProcessResult runProcess(List<String> cmd, long timeoutSeconds) throws IOException, InterruptedException {
        return ProcessRunner.run(cmd, Duration.ofSeconds(timeoutSeconds));
    }

    private Optional<Path> findVideo(Path dir, String shortcode) throws IOException {
        Path preferred = dir.resolve(shortcode + ".mp4");
        if (Files.isRegularFile(preferred)) {
            return Optional.of(preferred);
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .filter(f -> VIDEO_EXTENSIONS.contains(extension(f)))
                    .findFirst();
        }
    }

    private JsonNode readInfo(Path infoFile) {
        if (!Files.isRegularFile(infoFile)) {
            return null;
        }
        try {
            return objectMapper.readTree(infoFile.toFile());
        } catch (IOException e) {
            LOGGER.warn("Unreadable yt-dlp info json path={} err={}", infoFile, e.toString());
            return null;
        }
    }

    private void maybeAddCookies(List<String> cmd) {
        String cookiesFile = properties.getCookiesFile();
        if (cookiesFile == null || cookiesFile.isBlank()) {
            return;
        }
        Path cookiesPath = Path.of(cookiesFile).toAbsolutePath();
        if (Files.exists(cookiesPath)) {
            cmd.add("--cookies");
            cmd.add(cookiesPath.toString());
        } else {
            LOGGER.warn("yt-dlp cookies file configured but missing path={}", cookiesPath);
        }
    }

    private void deleteRecursively(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    LOGGER.warn("Failed to delete fetch scratch path={} err={}", p, e.toString());
                }
            });
        } catch (IOException e) {
            LOGGER.warn("Failed to clean fetch scratch dir={} err={}", dir, e.toString());
        }
    }

    private static Integer lastHttpStatus(String output) {
        if (output == null) {
            return null;
        }
        Matcher matcher = HTTP_ERROR.matcher(output);
        Integer status = null;
        while (matcher.find()) {
            status = Integer.parseInt(matcher.group(1));
        }
        return status;
    }

    private static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
