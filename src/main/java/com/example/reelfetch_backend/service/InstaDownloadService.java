package com.example.reelfetch_backend.service;

import com.example.reelfetch_backend.dto.web.InstaDownloadResponse;
import com.example.reelfetch_backend.model.ArtifactHandle;
import com.example.reelfetch_backend.model.FetchedPost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.net.URI;

@Service
public class InstaDownloadService {
    private static final Logger LOGGER = LoggerFactory.getLogger(InstaDownloadService.class);

    private final RetrievalOrchestrator orchestrator;
    private final ArtifactStore artifactStore;

    public InstaDownloadService(RetrievalOrchestrator orchestrator, ArtifactStore artifactStore) {
        this.orchestrator = orchestrator;
        this.artifactStore = artifactStore;
    }

    /**
     * Fetches the post, stores it as a fresh artifact and describes where it can be played.
     *
     * @param requestBaseUrl base of the incoming request, used for the link unless a public base URL is configured
     */
    public InstaDownloadResponse download(String postUrl, @Nullable URI requestBaseUrl) {
        long t0 = System.nanoTime();
        FetchedPost post = orchestrator.retrieve(postUrl);
        ArtifactHandle handle = artifactStore.put(post.shortcode(), post.videoBytes(), post.caption());

        URI play = (artifactStore.hasPublicBaseUrl() || requestBaseUrl == null)
                ? artifactStore.playbackUrl(handle.postId())
                : artifactStore.playbackUrl(requestBaseUrl, handle.postId());
        String title = post.caption() == null ? "" : post.caption();

        LOGGER.info("Successfully processed {} play={} in={}ms", handle.postId(), play, (System.nanoTime() - t0) / 1_000_000);
        return InstaDownloadResponse.of(play.toString(), title, post.authorUsername());
    }
}
