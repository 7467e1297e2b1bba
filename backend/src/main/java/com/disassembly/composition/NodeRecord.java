package com.disassembly.composition;

import java.util.List;
import java.util.UUID;

/**
 * Plain copy of one product row and its bill of materials. Refers to its parent by ID only.
 */
public record NodeRecord(
    Long id,
    Long parentId,
    UUID ownerId,
    Long productTypeId,
    String name,
    String description,
    String brand,
    String model,
    Integer amountInParent,
    List<MaterialLine> billOfMaterials
) {

    public NodeRecord {
        billOfMaterials = billOfMaterials == null ? List.of() : List.copyOf(billOfMaterials);
    }

    public boolean isBaseProduct() {
        return parentId == null;
    }
}
