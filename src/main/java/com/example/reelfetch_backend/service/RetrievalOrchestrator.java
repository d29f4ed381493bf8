package com.example.reelfetch_backend.service;

import com.example.reelfetch_backend.config.RetrievalProperties;
import com.example.reelfetch_backend.engine.Interfaces.PostFetcher;
import com.example.reelfetch_backend.exception.ErrorKind;
import com.example.reelfetch_backend.exception.RetrievalException;
import com.example.reelfetch_backend.model.FetchedPost;
import com.example.reelfetch_backend.model.Proxy;
import com.example.reelfetch_backend.util.PostUrlParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.Random;

/**
 * Runs one "fetch post" request as a series of single-shot attempts, each through a freshly selected
 * proxy and user agent. Many fast attempts over different egress identities beat one slow retrying fetch
 * against upstream throttling.
 */
@Service
public class RetrievalOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetrievalOrchestrator.class);

    private final ProxyPool proxyPool;
    private final PostFetcher fetcher;
    private final RetrievalProperties properties;
    private final Sleeper sleeper;
    private final Random random;

    @Autowired
    public RetrievalOrchestrator(ProxyPool proxyPool, PostFetcher fetcher, RetrievalProperties properties) {
        this(proxyPool, fetcher, properties, d -> Thread.sleep(d.toMillis()), new Random());
    }

    RetrievalOrchestrator(ProxyPool proxyPool, PostFetcher fetcher, RetrievalProperties properties,
                          Sleeper sleeper, Random random) {
        this.proxyPool = proxyPool;
        this.fetcher = fetcher;
        this.properties = properties;
        this.sleeper = sleeper;
        this.random = random;
    }

    /**
     * @throws RetrievalException with {@link ErrorKind#INVALID_INPUT} for unrecognized URLs, or the kind
     *                            of the failure that ended the attempt loop
     */
    public FetchedPost retrieve(String postUrl) {
        String shortcode = PostUrlParser.extractShortcode(postUrl);
        LOGGER.info("RETRIEVE start shortcode={} url={}", shortcode, postUrl);
        return fetchWithRotation(shortcode);
    }

    FetchedPost fetchWithRotation(String shortcode) {
        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        boolean lastRateLimited = false;
        Exception lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<Proxy> proxy = proxyPool.select();
            String userAgent = proxyPool.userAgent();
            String egress = proxy.map(Proxy::endpoint).orElse("direct");
            LOGGER.info("RETRIEVE attempt={}/{} shortcode={} proxy={}", attempt, maxAttempts, shortcode, egress);

            try {
                FetchedPost post = fetcher.fetch(shortcode, proxy.orElse(null), userAgent);
                LOGGER.info("RETRIEVE ok shortcode={} attempt={} proxy={}", shortcode, attempt, egress);
                return post;
            } catch (Exception e) {
                RetryDecision decision = FailureClassifier.classify(e);
                if (decision instanceof RetryDecision.Abort abort) {
                    LOGGER.warn("RETRIEVE abort shortcode={} attempt={} kind={} err={}", shortcode, attempt, abort.kind(), e.toString());
                    throw new RetrievalException(abort.kind(), clientMessage(abort.kind(), maxAttempts), e);
                }
                lastRateLimited = ((RetryDecision.Retry) decision).rateLimitSignal();
                lastFailure = e;
                LOGGER.warn("RETRIEVE connection failure shortcode={} attempt={}/{} proxy={} rateLimited={} err={}",
                        shortcode, attempt, maxAttempts, egress, lastRateLimited, e.getMessage());
            }

            if (attempt < maxAttempts) {
                backoff(shortcode);
            }
        }

        ErrorKind kind = lastRateLimited ? ErrorKind.RATE_LIMITED : ErrorKind.UPSTREAM_UNAVAILABLE;
        LOGGER.error("RETRIEVE exhausted shortcode={} attempts={} kind={}", shortcode, maxAttempts, kind);
        throw new RetrievalException(kind, clientMessage(kind, maxAttempts), lastFailure);
    }

    private void backoff(String shortcode) {
        Duration delay = nextBackoff();
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.info("RETRIEVE abandoned shortcode={} (interrupted during backoff)", shortcode);
            throw new RetrievalException(ErrorKind.UPSTREAM_UNAVAILABLE, "Retrieval interrupted", e);
        }
    }

    Duration nextBackoff() {
        long min = properties.getBackoffMin().toMillis();
        long max = Math.max(min, properties.getBackoffMax().toMillis());
        return Duration.ofMillis(min + (long) (random.nextDouble() * (max - min)));
    }

    private static String clientMessage(ErrorKind kind, int maxAttempts) {
        return switch (kind) {
            case RATE_LIMITED -> "Rate limited by Instagram. Please try again later.";
            case UPSTREAM_UNAVAILABLE -> "Connection error after " + maxAttempts + " attempts.";
            case UPSTREAM_REJECTED -> "Post not found, private, or contains no video.";
            default -> "Unexpected error while fetching the post.";
        };
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
