package com.mifinca.backend.modules.event.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ReproductiveEventRequest(
        @NotNull UUID animalId,
        @NotNull UUID eventTypeId,
        @NotNull OffsetDateTime eventDate,
        UUID sireAnimalId,
        @Size(max = 120) String gestationDiagnosisResult,
        OffsetDateTime expectedCalvingDate,
        String notes
) {
}
