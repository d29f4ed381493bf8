package com.example.reelfetch_backend.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FfmpegVideoTranscoderTest {

    @TempDir
    Path tempDir;

    @Test
    void successReplacesInputWithNormalizedFile() throws Exception {
        Path input = Files.writeString(tempDir.resolve("ABC123.raw.mp4"), "raw");
        StubTranscoder transcoder = new StubTranscoder(new StubTranscoder.Outcome(0, "", false, true));

        Path output = transcoder.normalize(input);

        assertThat(output).isEqualTo(tempDir.resolve("ABC123.mp4"));
        assertThat(Files.readString(output)).isEqualTo("transcoded");
        assertThat(input).doesNotExist();
        assertThat(tempDir.resolve("processed_ABC123.mp4")).doesNotExist();
        assertThat(transcoder.lastCmd)
                .contains("libx264", "yuv420p", "+faststart", "aac")
                .containsSequence("-b:v", "4000k")
                .containsSequence("-i", input.toAbsolutePath().toString());
    }

    @Test
    void nonZeroExitFailsAndKeepsInput() throws Exception {
        Path input = Files.writeString(tempDir.resolve("ABC123.raw.mp4"), "raw");
        StubTranscoder transcoder = new StubTranscoder(
                new StubTranscoder.Outcome(1, "Invalid data found when processing input", false, true));

        TranscodeException ex = assertThrows(TranscodeException.class, () -> transcoder.normalize(input));

        assertThat(ex.getProcessOutput()).contains("Invalid data");
        assertThat(input).exists();
        assertThat(tempDir.resolve("processed_ABC123.mp4")).doesNotExist();
        assertThat(tempDir.resolve("ABC123.mp4")).doesNotExist();
    }

    @Test
    void timeoutFails() throws Exception {
        Path input = Files.writeString(tempDir.resolve("ABC123.raw.mp4"), "raw");
        StubTranscoder transcoder = new StubTranscoder(new StubTranscoder.Outcome(-1, "", true, false));

        TranscodeException ex = assertThrows(TranscodeException.class, () -> transcoder.normalize(input));

        assertThat(ex.getMessage()).contains("timeout");
    }

    @Test
    void missingInputFails() {
        StubTranscoder transcoder = new StubTranscoder(new StubTranscoder.Outcome(0, "", false, true));

        assertThrows(TranscodeException.class, () -> transcoder.normalize(tempDir.resolve("nope.mp4")));
        assertThat(transcoder.lastCmd).isNull();
    }

    private static final class StubTranscoder extends FfmpegVideoTranscoder {
        record Outcome(int code, String output, boolean timedOut, boolean writeOutput) { }

        private final Outcome outcome;
        private List<String> lastCmd;

        StubTranscoder(Outcome outcome) {
            super("ffmpeg", Duration.ofSeconds(30));
            this.outcome = outcome;
        }

        @Override
        protected ProcessResult runProcess(List<String> cmd, Duration timeout) throws IOException {
            this.lastCmd = cmd;
            if (outcome.writeOutput()) {
                Files.writeString(Path.of(cmd.get(cmd.size() - 1)), "transcoded");
            }
            return new ProcessResult(outcome.code(), outcome.output(), outcome.timedOut());
        }
    }
}
