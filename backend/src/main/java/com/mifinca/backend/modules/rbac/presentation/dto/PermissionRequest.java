package com.mifinca.backend.modules.rbac.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PermissionRequest(
        @NotBlank @Size(max = 100) String name,
        String description,
        UUID moduleId
) {
}
