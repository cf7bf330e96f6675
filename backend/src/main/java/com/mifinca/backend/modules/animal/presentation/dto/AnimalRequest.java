package com.mifinca.backend.modules.animal.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Size;

public record AnimalRequest(
        @NotBlank @Size(max = 60) String tagId,
        @Size(max = 120) String name,
        UUID speciesId,
        UUID breedId,
        UUID sexId,
        UUID statusId,
        @PastOrPresent LocalDate dateOfBirth,
        UUID currentLotId,
        UUID motherAnimalId,
        UUID fatherAnimalId,
        String notes
) {
}
