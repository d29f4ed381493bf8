package com.example.reelfetch_backend.service;

import com.example.reelfetch_backend.config.ProxyProperties;
import com.example.reelfetch_backend.model.Proxy;
import com.example.reelfetch_backend.model.ProxyUsageRecord;
import com.example.reelfetch_backend.service.Interfaces.ProxySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Owns the egress proxies and their per-window usage ledger.
 * <p>
 * Selection is advisory rate limiting: a proxy that already served {@code maxRequestsPerWindow} requests in the
 * current window is passed over, but when every proxy is at the ceiling a random one is returned anyway.
 * An empty pool means "connect directly".
 */
@Service
public class ProxyPool {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProxyPool.class);
    private static final String FALLBACK_USER_AGENT = "Mozilla/5.0";

    private final ProxySource source;
    private final ProxyProperties properties;
    private final Clock clock;
    private final Random random;

    private final Object lock = new Object();
    private volatile List<Proxy> proxies = List.of();
    private final Map<Proxy, ProxyUsageRecord> usage = new HashMap<>();

    @Autowired
    public ProxyPool(ProxySource source, ProxyProperties properties, Clock clock) {
        this(source, properties, clock, new Random());
    }

    ProxyPool(ProxySource source, ProxyProperties properties, Clock clock, Random random) {
        this.source = source;
        this.properties = properties;
        this.clock = clock;
        this.random = random;
    }

    /**
     * Replaces the proxy set with a fresh list from the source. On failure the current set is kept.
     *
     * @return number of proxies in the pool afterwards
     */
    public int refresh() {
        if (!properties.hasSource()) {
            LOGGER.warn("PROXY refresh skipped: proxy.source-url not set, attempts connect directly");
            return proxies.size();
        }
        List<Proxy> loaded;
        try {
            loaded = new ArrayList<>(source.fetchProxies());
        } catch (RuntimeException e) {
            LOGGER.error("PROXY refresh failed, keeping {} proxies: {}", proxies.size(), e.toString());
            return proxies.size();
        }
        Collections.shuffle(loaded, random);
        synchronized (lock) {
            proxies = List.copyOf(loaded);
            usage.keySet().retainAll(new HashSet<>(loaded));
        }
        LOGGER.info("PROXY refresh loaded={}", loaded.size());
        return loaded.size();
    }

    /**
     * Picks the proxy for the next attempt and charges it one request.
     *
     * @return the proxy, or empty when the pool is empty (direct connect)
     */
    public Optional<Proxy> select() {
        synchronized (lock) {
            List<Proxy> current = proxies;
            if (current.isEmpty()) {
                return Optional.empty();
            }
            Instant now = clock.instant();
            Duration window = properties.getWindow();
            int ceiling = properties.getMaxRequestsPerWindow();

            Selection selection = choose(current, usage, now, window, ceiling, random);
            if (selection.degraded()) {
                LOGGER.warn("PROXY all {} proxies at ceiling={} per {}s, using {} anyway",
                        current.size(), ceiling, window.toSeconds(), selection.proxy().endpoint());
            }
            ProxyUsageRecord record = usage.computeIfAbsent(selection.proxy(), p -> new ProxyUsageRecord());
            record.resetIfWindowExpired(now, window);
            record.recordUse(now);
            return Optional.of(selection.proxy());
        }
    }

    public String userAgent() {
        List<String> agents = properties.getUserAgents();
        if (agents == null || agents.isEmpty()) {
            return FALLBACK_USER_AGENT;
        }
        return agents.get(random.nextInt(agents.size()));
    }

    public int size() {
        return proxies.size();
    }

    /** Snapshot of a proxy's ledger entry; empty if it was never selected. */
    public Optional<ProxyUsageRecord> usageOf(Proxy proxy) {
        synchronized (lock) {
            ProxyUsageRecord record = usage.get(proxy);
            return record == null ? Optional.empty() : Optional.of(record.copy());
        }
    }

    /**
     * First proxy, in shuffled order, with room left in its window; otherwise a uniformly random one.
     * Reads the ledger without touching it.
     */
    static Selection choose(List<Proxy> candidates,
                            Map<Proxy, ProxyUsageRecord> usage,
                            Instant now,
                            Duration window,
                            int ceiling,
                            Random random) {
        List<Proxy> shuffled = new ArrayList<>(candidates);
        Collections.shuffle(shuffled, random);
        for (Proxy candidate : shuffled) {
            ProxyUsageRecord record = usage.get(candidate);
            if (record == null || record.requestsAt(now, window) < ceiling) {
                return new Selection(candidate, false);
            }
        }
        return new Selection(candidates.get(random.nextInt(candidates.size())), true);
    }

    record Selection(Proxy proxy, boolean degraded) { }
}
