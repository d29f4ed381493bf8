package com.example.reelfetch_backend.engine.Interfaces;

import com.example.reelfetch_backend.engine.TranscodeException;

import java.nio.file.Path;

public interface VideoTranscoder {

    /**
     * Re-encodes {@code input} into a seekable, fast-start MP4 at a bounded bitrate.
     * The input file is gone once this returns normally.
     *
     * @return path of the normalized file
     */
    Path normalize(Path input) throws TranscodeException;
}
