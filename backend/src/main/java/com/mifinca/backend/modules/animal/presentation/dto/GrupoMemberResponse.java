package com.mifinca.backend.modules.animal.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.mifinca.backend.modules.animal.domain.AnimalGroup;

public record GrupoMemberResponse(
        UUID membershipId,
        UUID grupoId,
        UUID animalId,
        OffsetDateTime assignedAt,
        OffsetDateTime removedAt,
        boolean active,
        String notes
) {

    public static GrupoMemberResponse from(AnimalGroup membership) {
        return new GrupoMemberResponse(
                membership.getId(),
                membership.getGrupo().getId(),
                membership.getAnimal().getId(),
                membership.getAssignedAt(),
                membership.getRemovedAt(),
                membership.isActive(),
                membership.getNotes()
        );
    }
}
