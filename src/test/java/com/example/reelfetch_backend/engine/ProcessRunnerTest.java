package com.example.reelfetch_backend.engine;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ProcessRunnerTest {

    @Test
    void collectsMergedOutputAndExitCode() throws Exception {
        ProcessResult result = ProcessRunner.run(List.of("sh", "-c", "echo out; echo err 1>&2; exit 3"),
                Duration.ofSeconds(10));

        assertThat(result.timedOut()).isFalse();
        assertThat(result.code()).isEqualTo(3);
        assertThat(result.output()).contains("out", "err");
    }

    @Test
    void killsProcessThatOutlivesTimeout() throws Exception {
        long started = System.nanoTime();

        ProcessResult result = ProcessRunner.run(List.of("sh", "-c", "sleep 30"), Duration.ofMillis(200));

        assertThat(result.timedOut()).isTrue();
        assertThat(result.code()).isEqualTo(-1);
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(15));
    }

    @Test
    void missingBinaryFailsToStart() {
        assertThrows(IOException.class,
                () -> ProcessRunner.run(List.of("definitely-not-installed-tool-xyz"), Duration.ofSeconds(1)));
    }

    @Test
    void tailKeepsTheEndOfLongOutput() {
        assertThat(ProcessRunner.tail("0123456789", 4)).isEqualTo("6789");
        assertThat(ProcessRunner.tail("short", 10)).isEqualTo("short");
        assertThat(ProcessRunner.tail("  ", 10)).isEqualTo("<no output>");
        assertThat(ProcessRunner.tail(null, 10)).isEqualTo("<no output>");
    }
}
