package com.example.reelfetch_backend.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Raw result of one successful fetch: the unprocessed video plus caption metadata.
 * Equality compares the video content, not the array reference.
 */
public record FetchedPost(
        String shortcode,
        byte[] videoBytes,
        String caption,
        String authorUsername
) {

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FetchedPost other)) return false;
        return Objects.equals(shortcode, other.shortcode)
                && Arrays.equals(videoBytes, other.videoBytes)
                && Objects.equals(caption, other.caption)
                && Objects.equals(authorUsername, other.authorUsername);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(shortcode, caption, authorUsername);
        return 31 * result + Arrays.hashCode(videoBytes);
    }

    @Override
    public String toString() {
        return "FetchedPost{" +
                "shortcode='" + shortcode + '\'' +
                ", videoBytes=" + (videoBytes == null ? 0 : videoBytes.length) +
                ", captionLength=" + (caption == null ? 0 : caption.length()) +
                ", authorUsername='" + authorUsername + '\'' +
                '}';
    }
}
