package com.mifinca.backend.modules.event.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.event.application.EventAnimals;
import com.mifinca.backend.modules.event.domain.HealthEvent;

public record HealthEventResponse(
        UUID healthEventId,
        UUID eventTypeId,
        OffsetDateTime eventDate,
        String description,
        UUID productId,
        BigDecimal quantity,
        UUID unitId,
        UUID administeredByUserId,
        List<UUID> animalIds,
        OffsetDateTime createdAt
) {

    public static HealthEventResponse from(HealthEvent event) {
        return new HealthEventResponse(
                event.getId(),
                event.getEventType().getId(),
                event.getEventDate(),
                event.getDescription(),
                event.getProduct() != null ? event.getProduct().getId() : null,
                event.getQuantity(),
                event.getUnit() != null ? event.getUnit().getId() : null,
                event.getRecorderId(),
                EventAnimals.ids(event.getAnimals()),
                event.getCreatedAt()
        );
    }
}
