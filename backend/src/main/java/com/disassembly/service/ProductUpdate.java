package com.disassembly.service;

import java.time.LocalDateTime;

/**
 * Scalar changes to one product. Null fields are left untouched; structure never changes.
 */
public record ProductUpdate(
    String name,
    String description,
    String brand,
    String model,
    String dismantlingNotes,
    LocalDateTime dismantlingTimeStart,
    LocalDateTime dismantlingTimeEnd,
    Long productTypeId
) {
}
