package com.mifinca.backend.modules.animal.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.mifinca.backend.modules.animal.domain.Grupo;

public record GrupoResponse(
        UUID grupoId,
        String name,
        String description,
        UUID createdByUserId,
        OffsetDateTime createdAt
) {

    public static GrupoResponse from(Grupo grupo) {
        return new GrupoResponse(
                grupo.getId(),
                grupo.getName(),
                grupo.getDescription(),
                grupo.getCreatedById(),
                grupo.getCreatedAt()
        );
    }
}
