package com.mifinca.backend.modules.farm.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.mifinca.backend.modules.farm.domain.Farm;

public record FarmResponse(
        UUID farmId,
        String name,
        String location,
        BigDecimal areaHectares,
        UUID ownerUserId,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static FarmResponse from(Farm farm) {
        return new FarmResponse(
                farm.getId(),
                farm.getName(),
                farm.getLocation(),
                farm.getAreaHectares(),
                farm.getOwnerId(),
                farm.getCreatedAt(),
                farm.getUpdatedAt()
        );
    }
}
