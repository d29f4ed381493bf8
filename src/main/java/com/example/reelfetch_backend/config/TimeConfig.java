package com.example.reelfetch_backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class TimeConfig {

    /**
     * Expiry instants are zone-free; the zone only matters for reading markers written without an offset.
     */
    @Bean
    public Clock clock(@Value("${artifacts.marker-zone:UTC}") String markerZone) {
        return Clock.system(ZoneId.of(markerZone));
    }
}
