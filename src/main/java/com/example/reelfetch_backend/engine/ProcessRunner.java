package com.example.reelfetch_backend.engine;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;

/**
 * Runs the external tools behind the engine adapters: merged stdout/stderr collected on a reader thread,
 * the process killed when it outlives its timeout.
 */
final class ProcessRunner {

    private ProcessRunner() {
    }

    static ProcessResult run(List<String> cmd, Duration timeout) throws IOException, InterruptedException {
        Process p = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        StringJoiner joiner = new StringJoiner(System.lineSeparator());
        Thread reader = new Thread(() -> {
            try (var buffered = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = buffered.readLine()) != null) {
                    joiner.add(line);
                }
            } catch (IOException ignored) {
                // exit code decides; output read so far is enough for diagnostics
            }
        }, "proc-reader-" + cmd.get(0));
        reader.setDaemon(true);
        reader.start();

        boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            p.destroyForcibly();
            p.waitFor(5, TimeUnit.SECONDS);
        }
        reader.join(TimeUnit.SECONDS.toMillis(5));
        return new ProcessResult(finished ? p.exitValue() : -1, joiner.toString(), !finished);
    }

    /** Last {@code max} characters of a tool's output, for exceptions and logs. */
    static String tail(String output, int max) {
        if (output == null || output.isBlank()) {
            return "<no output>";
        }
        if (output.length() <= max) {
            return output;
        }
        return output.substring(output.length() - max);
    }
}
