package com.mifinca.backend.modules.farm.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.mifinca.backend.modules.farm.domain.FarmAccessLevel;
import com.mifinca.backend.modules.farm.domain.UserFarmAccess;

public record FarmAccessResponse(
        UUID userId,
        UUID farmId,
        FarmAccessLevel accessLevel,
        UUID assignedByUserId,
        String notes,
        OffsetDateTime assignedAt
) {

    public static FarmAccessResponse from(UserFarmAccess grant) {
        return new FarmAccessResponse(
                grant.getId().getUserId(),
                grant.getId().getFarmId(),
                grant.getAccessLevel(),
                grant.getAssignedBy() != null ? grant.getAssignedBy().getId() : null,
                grant.getNotes(),
                grant.getCreatedAt()
        );
    }
}
