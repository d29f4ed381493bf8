package com.example.reelfetch_backend.engine;

import com.example.reelfetch_backend.engine.Interfaces.VideoTranscoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Normalizes downloaded videos to H.264/AAC MP4 with the moov atom up front so browsers can start
 * playback before the whole file arrived.
 */
public class FfmpegVideoTranscoder implements VideoTranscoder {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegVideoTranscoder.class);
    private static final int LOG_SNIPPET_MAX = 4_000;

    private final String ffmpegBin;
    private final Duration timeout;

    public FfmpegVideoTranscoder(String ffmpegBin, Duration timeout) {
        this.ffmpegBin = ffmpegBin;
        this.timeout = timeout != null ? timeout : Duration.ofMinutes(10);
    }

    @Override
    public Path normalize(Path input) throws TranscodeException {
        if (input == null || !Files.isRegularFile(input)) {
            throw new TranscodeException("Input file not found: " + input, (String) null);
        }
        Path tmpOut = input.resolveSibling("processed_" + baseName(input) + ".mp4");
        Path output = input.resolveSibling(baseName(input) + ".mp4");

        long t0 = System.nanoTime();
        try {
            ProcessResult result = runProcess(buildCommand(input, tmpOut), timeout);
            if (result.timedOut()) {
                Files.deleteIfExists(tmpOut);
                throw new TranscodeException("ffmpeg timeout after " + timeout.toSeconds() + "s for " + input, ProcessRunner.tail(result.output(), LOG_SNIPPET_MAX));
            }
            if (result.code() != 0 || !Files.isRegularFile(tmpOut)) {
                Files.deleteIfExists(tmpOut);
                throw new TranscodeException("ffmpeg exit=" + result.code() + " for " + input, ProcessRunner.tail(result.output(), LOG_SNIPPET_MAX));
            }

            Files.move(tmpOut, output, REPLACE_EXISTING, ATOMIC_MOVE);
            if (!input.equals(output)) {
                Files.deleteIfExists(input);
            }
        } catch (IOException e) {
            throw new TranscodeException("ffmpeg I/O failure for " + input + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscodeException("ffmpeg interrupted for " + input, e);
        }
        LOGGER.info("Transcode OK input={} output={} in={}ms", input, output, (System.nanoTime() - t0) / 1_000_000);
        return output;
    }

    List<String> buildCommand(Path input, Path output) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpegBin);
        cmd.add("-y");
        cmd.add("-i"); cmd.add(input.toAbsolutePath().toString());
        cmd.add("-map"); cmd.add("0:v:0");
        cmd.add("-map"); cmd.add("0:a:0?");
        cmd.add("-c:v"); cmd.add("libx264");
        cmd.add("-preset"); cmd.add("ultrafast");
        cmd.add("-pix_fmt"); cmd.add("yuv420p");
        cmd.add("-profile:v"); cmd.add("main");
        cmd.add("-level:v"); cmd.add("4.0");
        cmd.add("-b:v"); cmd.add("4000k");
        cmd.add("-maxrate"); cmd.add("4000k");
        cmd.add("-bufsize"); cmd.add("8000k");
        // keyframe every 2s regardless of the source frame rate
        cmd.add("-force_key_frames"); cmd.add("expr:gte(t,n_forced*2)");
        cmd.add("-c:a"); cmd.add("aac");
        cmd.add("-b:a"); cmd.add("128k");
        cmd.add("-movflags"); cmd.add("+faststart");
        cmd.add("-f"); cmd.add("mp4");
        cmd.add(output.toAbsolutePath().toString());
        return cmd;
    }

    protected ProcessResult runProcess(List<String> cmd, Duration timeout) throws IOException, InterruptedException {
        return ProcessRunner.run(cmd, timeout);
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }
}
