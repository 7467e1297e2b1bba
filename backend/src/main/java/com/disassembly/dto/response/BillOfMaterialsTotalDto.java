package com.disassembly.dto.response;

import com.disassembly.composition.MaterialTotal;

import java.util.List;

/**
 * Response DTO for the rolled-up bill of materials of a product tree.
 */
public record BillOfMaterialsTotalDto(
    Long productId,
    List<MaterialTotal> materials
) {}
