package com.example.reelfetch_backend.controller;

import com.example.reelfetch_backend.dto.web.InstaDownloadResponse;
import com.example.reelfetch_backend.dto.web.InstaRequest;
import com.example.reelfetch_backend.service.InstaDownloadService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;

@RestController
public class InstaController {
    private static final Logger LOGGER = LoggerFactory.getLogger(InstaController.class);

    private final InstaDownloadService downloadService;

    public InstaController(InstaDownloadService downloadService) {
        this.downloadService = downloadService;
    }

    @PostMapping("/insta")
    public InstaDownloadResponse download(@Valid @RequestBody InstaRequest request) {
        LOGGER.info("Received download request for URL: {}", request.url());
        URI base = ServletUriComponentsBuilder.fromCurrentContextPath().build().toUri();
        return downloadService.download(request.url(), base);
    }
}
