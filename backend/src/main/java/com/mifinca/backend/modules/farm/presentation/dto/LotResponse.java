package com.mifinca.backend.modules.farm.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.mifinca.backend.modules.farm.domain.Lot;

public record LotResponse(
        UUID lotId,
        UUID farmId,
        String name,
        String description,
        BigDecimal areaHectares,
        UUID createdByUserId,
        OffsetDateTime createdAt
) {

    public static LotResponse from(Lot lot) {
        return new LotResponse(
                lot.getId(),
                lot.getFarm().getId(),
                lot.getName(),
                lot.getDescription(),
                lot.getAreaHectares(),
                lot.getCreatedBy() != null ? lot.getCreatedBy().getId() : null,
                lot.getCreatedAt()
        );
    }
}
