package com.disassembly.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for registering a file already written to storage.
 */
public record AttachFileRequest(
    @NotBlank(message = "Filename is required")
    @Size(max = 255)
    String filename,

    @NotBlank(message = "Storage path is required")
    @Size(max = 1000)
    String storagePath
) {}
