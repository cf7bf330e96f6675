package com.mifinca.backend.modules.event.presentation.dto;

import java.util.Set;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record BatchRequest(
        @NotBlank @Size(max = 150) String name,
        @NotNull UUID batchTypeId,
        @NotNull UUID farmId,
        String description,
        Set<@NotNull UUID> animalIds
) {

    public Set<UUID> animalIdsOrEmpty() {
        return animalIds == null ? Set.of() : animalIds;
    }
}
