package com.example.reelfetch_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Artifact storage settings. The sweep period ({@code artifacts.reclaim-interval-ms}) is read directly by the
 * reclaimer's schedule.
 */
@ConfigurationProperties(prefix = "artifacts")
public class ArtifactProperties {
    private String root = "downloads";
    private String urlPrefix = "/downloads";
    private String publicBaseUrl;
    private Duration ttl = Duration.ofHours(1);

    public String getRoot() { return root; }
    public void setRoot(String root) { this.root = root; }

    public String getUrlPrefix() { return urlPrefix; }
    public void setUrlPrefix(String urlPrefix) { this.urlPrefix = urlPrefix; }

    /** Absolute base for playback links; when blank the current request's base URL is used. */
    public String getPublicBaseUrl() { return publicBaseUrl; }
    public void setPublicBaseUrl(String publicBaseUrl) { this.publicBaseUrl = publicBaseUrl; }

    public Duration getTtl() { return ttl; }
    public void setTtl(Duration ttl) { this.ttl = ttl; }
}
