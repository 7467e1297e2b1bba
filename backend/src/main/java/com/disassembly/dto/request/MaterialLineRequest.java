package com.disassembly.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * One bill-of-materials line in a request. Unit defaults to "kg".
 */
public record MaterialLineRequest(
    @NotNull(message = "Material ID is required")
    Long materialId,

    @NotNull(message = "Quantity is required")
    @Positive(message = "Quantity must be positive")
    Double quantity,

    String unit
) {}
