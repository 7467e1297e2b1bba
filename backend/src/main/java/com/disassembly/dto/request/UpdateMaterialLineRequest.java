package com.disassembly.dto.request;

import jakarta.validation.constraints.Positive;

/**
 * Request DTO for changing one bill-of-materials line. Omitted fields keep their value.
 */
public record UpdateMaterialLineRequest(
    @Positive(message = "Quantity must be positive")
    Double quantity,

    String unit
) {}
