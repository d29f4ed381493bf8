package com.example.reelfetch_backend.config;

import com.example.reelfetch_backend.engine.FfmpegVideoTranscoder;
import com.example.reelfetch_backend.engine.Interfaces.PostFetcher;
import com.example.reelfetch_backend.engine.Interfaces.VideoTranscoder;
import com.example.reelfetch_backend.engine.YtDlpPostFetcher;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class EngineConfig {

    @Bean
    public PostFetcher postFetcher(YtDlpProperties properties, ObjectMapper objectMapper) {
        return new YtDlpPostFetcher(properties, objectMapper);
    }

    @Bean
    public VideoTranscoder videoTranscoder(
            @Value("${transcoder.ffmpeg-bin:ffmpeg}") String ffmpegBin,
            @Value("${transcoder.timeout-seconds:600}") long timeoutSeconds
    ) {
        return new FfmpegVideoTranscoder(ffmpegBin, Duration.ofSeconds(Math.max(1, timeoutSeconds)));
    }
}
