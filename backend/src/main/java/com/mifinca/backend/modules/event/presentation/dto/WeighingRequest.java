package com.mifinca.backend.modules.event.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

public record WeighingRequest(
        @NotNull UUID animalId,
        @NotNull OffsetDateTime weighingDate,
        @NotNull @DecimalMin(value = "0.0", inclusive = false) BigDecimal weight,
        UUID unitId,
        String notes
) {
}
