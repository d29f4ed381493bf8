package com.example.reelfetch_backend.dto.web;

import com.fasterxml.jackson.annotation.JsonInclude;

public record InstaDownloadResponse(Data data) {

    public static InstaDownloadResponse of(String play, String title, String authorUsername) {
        return new InstaDownloadResponse(new Data(play, title, authorUsername));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Data(
            String play,
            String title,
            String authorUsername
    ) {
    }
}
