package com.mifinca.backend.modules.event.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

public record FeedingRequest(
        @NotNull UUID feedTypeId,
        @NotNull OffsetDateTime feedingDate,
        @DecimalMin("0.0") BigDecimal quantity,
        UUID unitId,
        String notes,
        @NotEmpty Set<@NotNull UUID> animalIds
) {
}
