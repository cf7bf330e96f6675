package com.mifinca.backend.modules.rbac.presentation.dto;

public record PermissionCheckResponse(String permission, boolean granted) {
}
