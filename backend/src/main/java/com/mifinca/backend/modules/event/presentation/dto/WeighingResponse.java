package com.mifinca.backend.modules.event.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.mifinca.backend.modules.event.domain.Weighing;

public record WeighingResponse(
        UUID weighingId,
        UUID animalId,
        OffsetDateTime weighingDate,
        BigDecimal weight,
        UUID unitId,
        String notes,
        UUID recordedByUserId
) {

    public static WeighingResponse from(Weighing weighing) {
        return new WeighingResponse(
                weighing.getId(),
                weighing.getAnimal().getId(),
                weighing.getWeighingDate(),
                weighing.getWeight(),
                weighing.getUnit() != null ? weighing.getUnit().getId() : null,
                weighing.getNotes(),
                weighing.getRecorderId()
        );
    }
}
