package com.disassembly.dto.request;

import jakarta.validation.constraints.Positive;

public record PhysicalPropertiesRequest(
    @Positive Double weightKg,
    @Positive Double heightCm,
    @Positive Double widthCm,
    @Positive Double depthCm
) {}
