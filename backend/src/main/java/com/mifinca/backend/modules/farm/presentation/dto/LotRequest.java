package com.mifinca.backend.modules.farm.presentation.dto;

import java.math.BigDecimal;
import java.util.UUID;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record LotRequest(
        @NotBlank @Size(max = 150) String name,
        @NotNull UUID farmId,
        String description,
        @DecimalMin("0.0") BigDecimal areaHectares
) {
}
