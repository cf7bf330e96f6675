package com.mifinca.backend.modules.farm.presentation.dto;

import java.util.UUID;

import com.mifinca.backend.modules.farm.domain.FarmAccessLevel;

/**
 * {@code userId} and {@code farmId} are accepted only when they match the grant being updated.
 */
public record FarmAccessUpdateRequest(
        UUID userId,
        UUID farmId,
        FarmAccessLevel accessLevel,
        String notes
) {
}
