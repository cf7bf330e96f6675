package com.mifinca.backend.modules.farm.presentation.dto;

import java.util.UUID;

import com.mifinca.backend.modules.farm.domain.FarmAccessLevel;

import jakarta.validation.constraints.NotNull;

public record FarmAccessGrantRequest(
        @NotNull UUID userId,
        @NotNull UUID farmId,
        FarmAccessLevel accessLevel,
        String notes
) {
}
