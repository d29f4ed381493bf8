package com.example.reelfetch_backend.engine.Interfaces;

import com.example.reelfetch_backend.engine.PostFetchException;
import com.example.reelfetch_backend.model.FetchedPost;
import com.example.reelfetch_backend.model.Proxy;
import org.springframework.lang.Nullable;

public interface PostFetcher {

    /**
     * Fetches one post with exactly one connection attempt; retrying is the caller's job.
     *
     * @param shortcode post identifier
     * @param proxy     egress proxy, or {@code null} to connect directly
     * @param userAgent browser identity presented upstream
     */
    FetchedPost fetch(String shortcode, @Nullable Proxy proxy, String userAgent) throws PostFetchException;
}
