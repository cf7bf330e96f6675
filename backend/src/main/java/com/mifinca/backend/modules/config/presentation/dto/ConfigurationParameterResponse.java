package com.mifinca.backend.modules.config.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.mifinca.backend.modules.config.domain.ConfigurationParameter;

public record ConfigurationParameterResponse(
        UUID parameterId,
        String name,
        String value,
        String description,
        UUID dataTypeId,
        String dataTypeName,
        boolean active,
        UUID createdByUserId,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static ConfigurationParameterResponse from(ConfigurationParameter parameter) {
        return new ConfigurationParameterResponse(
                parameter.getId(),
                parameter.getName(),
                parameter.getValue(),
                parameter.getDescription(),
                parameter.getDataType().getId(),
                parameter.getDataType().getName(),
                parameter.isActive(),
                parameter.getCreatedById(),
                parameter.getCreatedAt(),
                parameter.getUpdatedAt()
        );
    }
}
