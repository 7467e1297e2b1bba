package com.disassembly.dto.response;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Full DTO for a single product (components are listed by ID only).
 */
public record ProductDto(
    Long id,
    String name,
    String description,
    String brand,
    String model,
    String dismantlingNotes,
    LocalDateTime dismantlingTimeStart,
    LocalDateTime dismantlingTimeEnd,
    Long parentId,
    Integer amountInParent,
    UUID ownerId,
    Long productTypeId,
    boolean baseProduct,
    boolean leafNode,
    List<MaterialLineDto> billOfMaterials,
    List<Long> componentIds,
    PhysicalPropertiesDto physicalProperties,
    CircularityPropertiesDto circularityProperties,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {

    public record PhysicalPropertiesDto(
        Double weightKg,
        Double heightCm,
        Double widthCm,
        Double depthCm,
        Double volumeCm3
    ) {}

    public record CircularityPropertiesDto(
        String recyclabilityObservation,
        String recyclabilityComment,
        String recyclabilityReference,
        String repairabilityObservation,
        String repairabilityComment,
        String repairabilityReference,
        String remanufacturabilityObservation,
        String remanufacturabilityComment,
        String remanufacturabilityReference
    ) {}
}
