package com.disassembly.composition;

import java.util.List;
import java.util.UUID;

/**
 * Depth-bounded read model of a product and its components.
 * {@code components} is empty beyond the requested depth, whatever the stored tree holds.
 */
public record TreeView(
    Long id,
    String name,
    String description,
    String brand,
    String model,
    Long parentId,
    Integer amountInParent,
    UUID ownerId,
    Long productTypeId,
    List<MaterialLine> billOfMaterials,
    List<TreeView> components
) {

    public static TreeView of(NodeRecord record, List<TreeView> components) {
        return new TreeView(
            record.id(),
            record.name(),
            record.description(),
            record.brand(),
            record.model(),
            record.parentId(),
            record.amountInParent(),
            record.ownerId(),
            record.productTypeId(),
            record.billOfMaterials(),
            components
        );
    }
}
