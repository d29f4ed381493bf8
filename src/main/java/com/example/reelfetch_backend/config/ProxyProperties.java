package com.example.reelfetch_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Egress proxy pool settings. Without a {@code sourceUrl} every attempt connects directly.
 * The reload period ({@code proxy.refresh-interval-ms}) is read directly by the refresh schedule.
 */
@ConfigurationProperties(prefix = "proxy")
public class ProxyProperties {
    private String sourceUrl;
    private int maxRequestsPerWindow = 10;
    private Duration window = Duration.ofSeconds(60);
    private Duration sourceTimeout = Duration.ofSeconds(15);
    private List<String> userAgents = new ArrayList<>(List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/14.1.1 Safari/605.1.15",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:89.0) Gecko/20100101 Firefox/89.0",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.114 Safari/537.36",
            "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.101 Safari/537.36"
    ));

    public String getSourceUrl() { return sourceUrl; }
    public void setSourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; }

    public int getMaxRequestsPerWindow() { return maxRequestsPerWindow; }
    public void setMaxRequestsPerWindow(int maxRequestsPerWindow) { this.maxRequestsPerWindow = maxRequestsPerWindow; }

    public Duration getWindow() { return window; }
    public void setWindow(Duration window) { this.window = window; }

    public Duration getSourceTimeout() { return sourceTimeout; }
    public void setSourceTimeout(Duration sourceTimeout) { this.sourceTimeout = sourceTimeout; }

    public List<String> getUserAgents() { return userAgents; }
    public void setUserAgents(List<String> userAgents) { this.userAgents = userAgents; }

    public boolean hasSource() {
        return sourceUrl != null && !sourceUrl.isBlank();
    }
}
