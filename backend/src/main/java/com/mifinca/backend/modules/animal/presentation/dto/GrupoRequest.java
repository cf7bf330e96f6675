package com.mifinca.backend.modules.animal.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record GrupoRequest(
        @NotBlank @Size(max = 120) String name,
        String description
) {
}
