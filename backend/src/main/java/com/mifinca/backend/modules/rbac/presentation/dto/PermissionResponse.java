package com.mifinca.backend.modules.rbac.presentation.dto;

import java.util.UUID;

import com.mifinca.backend.modules.rbac.domain.Permission;

public record PermissionResponse(UUID permissionId, String name, String description, UUID moduleId) {

    public static PermissionResponse from(Permission permission) {
        return new PermissionResponse(
                permission.getId(),
                permission.getName(),
                permission.getDescription(),
                permission.getModule() != null ? permission.getModule().getId() : null
        );
    }
}
