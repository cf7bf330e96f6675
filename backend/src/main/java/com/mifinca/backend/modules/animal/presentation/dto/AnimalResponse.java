package com.mifinca.backend.modules.animal.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.mifinca.backend.modules.animal.domain.Animal;
import com.mifinca.backend.modules.masterdata.domain.MasterData;

public record AnimalResponse(
        UUID animalId,
        String tagId,
        String name,
        UUID speciesId,
        UUID breedId,
        UUID sexId,
        UUID statusId,
        LocalDate dateOfBirth,
        UUID ownerUserId,
        UUID currentLotId,
        UUID motherAnimalId,
        UUID fatherAnimalId,
        String notes,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static AnimalResponse from(Animal animal) {
        return new AnimalResponse(
                animal.getId(),
                animal.getTagId(),
                animal.getName(),
                idOf(animal.getSpecies()),
                idOf(animal.getBreed()),
                idOf(animal.getSex()),
                idOf(animal.getStatus()),
                animal.getDateOfBirth(),
                animal.getOwnerId(),
                animal.getCurrentLot() != null ? animal.getCurrentLot().getId() : null,
                animal.getMother() != null ? animal.getMother().getId() : null,
                animal.getFather() != null ? animal.getFather().getId() : null,
                animal.getNotes(),
                animal.getCreatedAt(),
                animal.getUpdatedAt()
        );
    }

    private static UUID idOf(MasterData masterData) {
        return masterData != null ? masterData.getId() : null;
    }
}
