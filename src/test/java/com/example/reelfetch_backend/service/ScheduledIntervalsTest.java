package com.example.reelfetch_backend.service;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.config.YamlPropertiesFactoryBean;
import org.springframework.core.io.ClassPathResource;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

/** Sweep and refresh periods come from application.yml through the schedule placeholders. */
class ScheduledIntervalsTest {

    @Test
    void reclaimerSweepPeriodIsConfigured() throws Exception {
        Scheduled scheduled = Reclaimer.class.getMethod("scheduledSweep").getAnnotation(Scheduled.class);

        assertThat(scheduled.fixedDelayString()).isEqualTo("${artifacts.reclaim-interval-ms:3600000}");
        assertThat(String.valueOf(applicationYml().get("artifacts.reclaim-interval-ms"))).isEqualTo("3600000");
    }

    @Test
    void proxyRefreshPeriodIsConfigured() throws Exception {
        Scheduled scheduled = ProxyRefreshScheduler.class.getMethod("scheduledRefresh").getAnnotation(Scheduled.class);

        assertThat(scheduled.fixedDelayString()).isEqualTo("${proxy.refresh-interval-ms:21600000}");
        assertThat(scheduled.initialDelayString()).isEqualTo(scheduled.fixedDelayString());
        assertThat(String.valueOf(applicationYml().get("proxy.refresh-interval-ms"))).isEqualTo("21600000");
    }

    private static Properties applicationYml() {
        YamlPropertiesFactoryBean yaml = new YamlPropertiesFactoryBean();
        yaml.setResources(new ClassPathResource("application.yml"));
        return yaml.getObject();
    }
}
