package com.disassembly.dto.response;

/**
 * One bill-of-materials line of a product.
 */
public record MaterialLineDto(
    Long materialId,
    double quantity,
    String unit
) {}
