package com.example.reelfetch_backend.service;

import com.example.reelfetch_backend.config.ProxyProperties;
import com.example.reelfetch_backend.model.Proxy;
import com.example.reelfetch_backend.service.Interfaces.ProxySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Downloads a newline-delimited {@code ip:port:user:password} list from {@code proxy.source-url}.
 */
@Component
public class HttpProxySource implements ProxySource {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpProxySource.class);

    private final WebClient webClient;
    private final ProxyProperties properties;

    public HttpProxySource(@Qualifier("proxySourceWebClient") WebClient webClient, ProxyProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public List<Proxy> fetchProxies() {
        if (!properties.hasSource()) {
            throw new IllegalStateException("proxy.source-url is not configured");
        }
        String body = webClient.get()
                .uri(properties.getSourceUrl())
                .retrieve()
                .bodyToMono(String.class)
                .block(properties.getSourceTimeout().plusSeconds(5));
        return parse(body);
    }

    static List<Proxy> parse(String body) {
        List<Proxy> proxies = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return proxies;
        }
        int skipped = 0;
        for (String line : body.strip().split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            Optional<Proxy> proxy = Proxy.parse(line);
            if (proxy.isPresent()) {
                proxies.add(proxy.get());
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            LOGGER.debug("Proxy list contained {} malformed record(s)", skipped);
        }
        return proxies;
    }
}
