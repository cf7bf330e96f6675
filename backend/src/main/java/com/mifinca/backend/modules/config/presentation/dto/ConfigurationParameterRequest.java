package com.mifinca.backend.modules.config.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ConfigurationParameterRequest(
        @NotBlank @Size(max = 120) String name,
        @NotNull @Size(max = 1000) String value,
        String description,
        @NotNull UUID dataTypeId,
        Boolean active
) {
}
