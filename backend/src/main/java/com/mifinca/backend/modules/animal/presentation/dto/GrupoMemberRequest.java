package com.mifinca.backend.modules.animal.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record GrupoMemberRequest(
        @NotNull UUID animalId,
        String notes
) {
}
