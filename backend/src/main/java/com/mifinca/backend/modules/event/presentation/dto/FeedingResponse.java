package com.mifinca.backend.modules.event.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.event.application.EventAnimals;
import com.mifinca.backend.modules.event.domain.Feeding;

public record FeedingResponse(
        UUID feedingId,
        UUID feedTypeId,
        OffsetDateTime feedingDate,
        BigDecimal quantity,
        UUID unitId,
        String notes,
        UUID recordedByUserId,
        List<UUID> animalIds
) {

    public static FeedingResponse from(Feeding feeding) {
        return new FeedingResponse(
                feeding.getId(),
                feeding.getFeedType().getId(),
                feeding.getFeedingDate(),
                feeding.getQuantity(),
                feeding.getUnit() != null ? feeding.getUnit().getId() : null,
                feeding.getNotes(),
                feeding.getRecorderId(),
                EventAnimals.ids(feeding.getAnimals())
        );
    }
}
