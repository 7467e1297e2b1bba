package com.disassembly.dto.response;

public record ProductFileDto(
    Long id,
    String filename,
    String storagePath
) {}
