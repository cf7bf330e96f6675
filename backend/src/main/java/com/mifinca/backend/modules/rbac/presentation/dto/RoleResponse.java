package com.mifinca.backend.modules.rbac.presentation.dto;

import java.util.UUID;

import com.mifinca.backend.modules.rbac.domain.Role;

public record RoleResponse(UUID roleId, String name, String description) {

    public static RoleResponse from(Role role) {
        return new RoleResponse(role.getId(), role.getName(), role.getDescription());
    }
}
