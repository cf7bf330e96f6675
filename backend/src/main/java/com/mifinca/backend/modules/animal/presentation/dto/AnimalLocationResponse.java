package com.mifinca.backend.modules.animal.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.mifinca.backend.modules.animal.domain.AnimalLocationHistory;

public record AnimalLocationResponse(
        UUID historyId,
        UUID animalId,
        UUID lotId,
        OffsetDateTime enteredAt,
        OffsetDateTime leftAt,
        UUID recordedByUserId
) {

    public static AnimalLocationResponse from(AnimalLocationHistory history) {
        return new AnimalLocationResponse(
                history.getId(),
                history.getAnimal().getId(),
                history.getLot() != null ? history.getLot().getId() : null,
                history.getEnteredAt(),
                history.getLeftAt(),
                history.getRecordedBy() != null ? history.getRecordedBy().getId() : null
        );
    }
}
