package com.example.reelfetch_backend.model;

import java.nio.file.Path;
import java.time.Instant;

public record ArtifactHandle(String postId, Path directory, Path videoFile, Instant expiresAt) {
}
