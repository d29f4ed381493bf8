package com.example.reelfetch_backend.config;

import com.example.reelfetch_backend.service.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Serves the artifact root read-only under {@code artifacts.url-prefix}.
 */
@Configuration
public class StaticDownloadsConfig implements WebMvcConfigurer {
    private static final Logger LOGGER = LoggerFactory.getLogger(StaticDownloadsConfig.class);

    private final ArtifactProperties properties;
    private final ArtifactStore store;

    public StaticDownloadsConfig(ArtifactProperties properties, ArtifactStore store) {
        this.properties = properties;
        this.store = store;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String prefix = properties.getUrlPrefix().replaceAll("/+$", "");
        String location = store.root().toUri().toString();
        if (!location.endsWith("/")) {
            location = location + "/";
        }
        registry.addResourceHandler(prefix + "/**").addResourceLocations(location);
        LOGGER.info("Serving artifacts pattern={}/** location={}", prefix, location);
    }
}
