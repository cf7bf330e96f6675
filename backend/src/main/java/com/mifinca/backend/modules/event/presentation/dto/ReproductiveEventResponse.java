package com.mifinca.backend.modules.event.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.mifinca.backend.modules.event.domain.ReproductiveEvent;

public record ReproductiveEventResponse(
        UUID reproductiveEventId,
        UUID animalId,
        UUID eventTypeId,
        OffsetDateTime eventDate,
        UUID sireAnimalId,
        String gestationDiagnosisResult,
        OffsetDateTime expectedCalvingDate,
        String notes,
        UUID administeredByUserId,
        OffsetDateTime createdAt
) {

    public static ReproductiveEventResponse from(ReproductiveEvent event) {
        return new ReproductiveEventResponse(
                event.getId(),
                event.getAnimal().getId(),
                event.getEventType().getId(),
                event.getEventDate(),
                event.getSire() != null ? event.getSire().getId() : null,
                event.getGestationDiagnosisResult(),
                event.getExpectedCalvingDate(),
                event.getNotes(),
                event.getRecorderId(),
                event.getCreatedAt()
        );
    }
}
