package com.mifinca.backend.modules.config.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.Size;

/**
 * Partial update; null fields are left untouched.
 */
public record UpdateConfigurationParameterRequest(
        @Size(min = 1, max = 120) String name,
        @Size(max = 1000) String value,
        String description,
        UUID dataTypeId,
        Boolean active
) {
}
