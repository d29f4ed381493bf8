package com.example.reelfetch_backend.config;

import com.example.reelfetch_backend.service.ArtifactStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class HealthConfig {
    private static final Duration VERSION_CHECK_TIMEOUT = Duration.ofSeconds(5);

    @Bean
    public HealthIndicator ffmpegHealth(@Value("${transcoder.ffmpeg-bin:ffmpeg}") String ffmpegBin) {
        return () -> binaryHealth("ffmpeg", ffmpegBin, "-version");
    }

    @Bean
    public HealthIndicator ytDlpHealth(YtDlpProperties properties) {
        return () -> binaryHealth("yt-dlp", properties.getBin(), "--version");
    }

    @Bean
    public HealthIndicator artifactRootHealth(ArtifactStore store) {
        return () -> {
            if (Files.isDirectory(store.root()) && Files.isWritable(store.root())) {
                return Health.up().withDetail("root", store.root().toString()).build();
            }
            return Health.down().withDetail("root", store.root().toString()).withDetail("writable", false).build();
        };
    }

    static Health binaryHealth(String name, String bin, String versionFlag) {
        return binaryHealth(name, bin, versionFlag, VERSION_CHECK_TIMEOUT);
    }

    static Health binaryHealth(String name, String bin, String versionFlag, Duration timeout) {
        try {
            Process p = new ProcessBuilder(bin, versionFlag)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                return Health.down().withDetail(name, "timeout").build();
            }
            if (p.exitValue() == 0) {
                return Health.up().withDetail(name, "ok").build();
            }
            return Health.down().withDetail(name, "exit=" + p.exitValue()).build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Health.down(e).withDetail(name, "interrupted").build();
        } catch (IOException e) {
            return Health.down(e).withDetail(name, "missing").build();
        }
    }
}
