package com.disassembly.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record VideoRequest(
    @NotBlank(message = "Video URL is required")
    @Size(max = 1000)
    String url,

    @Size(max = 100)
    String title,

    @Size(max = 500)
    String description
) {}
