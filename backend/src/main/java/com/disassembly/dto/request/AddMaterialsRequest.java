package com.disassembly.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record AddMaterialsRequest(
    @NotEmpty(message = "At least one material line is required")
    @Valid
    List<MaterialLineRequest> materials
) {}
