package com.mifinca.backend.modules.farm.presentation.dto;

import java.math.BigDecimal;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ProductRequest(
        @NotBlank @Size(max = 150) String name,
        @NotNull UUID farmId,
        UUID productTypeId,
        UUID unitId,
        BigDecimal quantity,
        String description
) {
}
