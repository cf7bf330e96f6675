package com.mifinca.backend.modules.rbac.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record UserRoleResponse(
        UUID userId,
        UUID roleId,
        String roleName,
        UUID assignedByUserId,
        OffsetDateTime assignedAt
) {
}
