package com.mifinca.backend.modules.rbac.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record RolePermissionResponse(UUID roleId, UUID permissionId, String permissionName, OffsetDateTime assignedAt) {
}
