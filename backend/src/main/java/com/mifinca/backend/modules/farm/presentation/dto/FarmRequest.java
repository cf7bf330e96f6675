package com.mifinca.backend.modules.farm.presentation.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record FarmRequest(
        @NotBlank @Size(max = 150) String name,
        @Size(max = 255) String location,
        @DecimalMin("0.0") BigDecimal areaHectares
) {
}
