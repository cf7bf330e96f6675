package com.mifinca.backend.modules.event.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;

public record OffspringBornRequest(
        @NotNull UUID offspringAnimalId,
        @PastOrPresent LocalDate dateOfBirth,
        String notes
) {
}
