package com.mifinca.backend.modules.event.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.event.application.EventAnimals;
import com.mifinca.backend.modules.event.domain.Batch;

public record BatchResponse(
        UUID batchId,
        String name,
        UUID batchTypeId,
        UUID farmId,
        String description,
        UUID createdByUserId,
        List<UUID> animalIds,
        OffsetDateTime createdAt
) {

    public static BatchResponse from(Batch batch) {
        return new BatchResponse(
                batch.getId(),
                batch.getName(),
                batch.getBatchType().getId(),
                batch.getFarm().getId(),
                batch.getDescription(),
                batch.getRecorderId(),
                EventAnimals.ids(batch.getAnimals()),
                batch.getCreatedAt()
        );
    }
}
