package com.example.reelfetch_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({
        ProxyProperties.class,
        RetrievalProperties.class,
        ArtifactProperties.class,
        YtDlpProperties.class
})
public class AppPropertiesConfig {
}
