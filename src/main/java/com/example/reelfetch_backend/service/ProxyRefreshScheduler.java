package com.example.reelfetch_backend.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Loads the proxy list once the application is up and reloads it periodically.
 */
@Component
public class ProxyRefreshScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProxyRefreshScheduler.class);

    private final ProxyPool proxyPool;

    public ProxyRefreshScheduler(ProxyPool proxyPool) {
        this.proxyPool = proxyPool;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        int loaded = proxyPool.refresh();
        LOGGER.info("Proxy pool ready size={}", loaded);
    }

    @Scheduled(initialDelayString = "${proxy.refresh-interval-ms:21600000}",
            fixedDelayString = "${proxy.refresh-interval-ms:21600000}")
    public void scheduledRefresh() {
        proxyPool.refresh();
    }
}
