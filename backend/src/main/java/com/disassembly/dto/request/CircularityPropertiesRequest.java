package com.disassembly.dto.request;

import jakarta.validation.constraints.Size;

/**
 * Free-text notes on how a product can be recycled, repaired or remanufactured.
 */
public record CircularityPropertiesRequest(
    @Size(max = 500) String recyclabilityObservation,
    @Size(max = 100) String recyclabilityComment,
    @Size(max = 250) String recyclabilityReference,
    @Size(max = 500) String repairabilityObservation,
    @Size(max = 100) String repairabilityComment,
    @Size(max = 250) String repairabilityReference,
    @Size(max = 500) String remanufacturabilityObservation,
    @Size(max = 100) String remanufacturabilityComment,
    @Size(max = 250) String remanufacturabilityReference
) {}
