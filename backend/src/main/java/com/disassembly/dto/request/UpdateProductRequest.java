package com.disassembly.dto.request;

import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;

/**
 * Request DTO for updating a product.
 * All fields are optional - only provided fields will be updated.
 */
public record UpdateProductRequest(
    @Size(min = 2, max = 50, message = "Name must be between 2 and 50 characters")
    String name,

    @Size(max = 500)
    String description,

    @Size(max = 100)
    String brand,

    @Size(max = 100)
    String model,

    @Size(max = 500)
    String dismantlingNotes,

    LocalDateTime dismantlingTimeStart,
    LocalDateTime dismantlingTimeEnd,
    Long productTypeId
) {}
