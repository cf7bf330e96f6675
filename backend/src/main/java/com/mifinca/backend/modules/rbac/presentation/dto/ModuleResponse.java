package com.mifinca.backend.modules.rbac.presentation.dto;

import java.util.UUID;

import com.mifinca.backend.modules.rbac.domain.PermissionModule;

public record ModuleResponse(UUID moduleId, String name, String description) {

    public static ModuleResponse from(PermissionModule module) {
        return new ModuleResponse(module.getId(), module.getName(), module.getDescription());
    }
}
