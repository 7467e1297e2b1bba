package com.disassembly.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Request DTO for creating a base product with its whole component tree.
 */
public record CreateProductRequest(
    @NotNull(message = "Owner ID is required")
    UUID ownerId,

    Long productTypeId,

    @NotBlank(message = "Name is required")
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

    // Must stay null for a base product
    Integer amountInParent,

    @Valid
    PhysicalPropertiesRequest physicalProperties,

    @Valid
    CircularityPropertiesRequest circularityProperties,

    @Valid
    List<VideoRequest> videos,

    @Valid
    List<MaterialLineRequest> billOfMaterials,

    @Valid
    List<ComponentRequest> components
) {}
