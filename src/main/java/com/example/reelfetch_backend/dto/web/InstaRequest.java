package com.example.reelfetch_backend.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.hibernate.validator.constraints.URL;

public record InstaRequest(
        @NotBlank @URL @Size(max = 2048) String url
) {
}
