package com.mifinca.backend.modules.event.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import com.mifinca.backend.modules.event.domain.OffspringBorn;

public record OffspringBornResponse(
        UUID offspringBornId,
        UUID reproductiveEventId,
        UUID offspringAnimalId,
        LocalDate dateOfBirth,
        String notes,
        UUID bornByUserId
) {

    public static OffspringBornResponse from(OffspringBorn record) {
        return new OffspringBornResponse(
                record.getId(),
                record.getReproductiveEvent().getId(),
                record.getOffspring().getId(),
                record.getDateOfBirth(),
                record.getNotes(),
                record.getRecorderId()
        );
    }
}
