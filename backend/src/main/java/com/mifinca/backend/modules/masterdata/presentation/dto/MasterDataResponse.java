package com.mifinca.backend.modules.masterdata.presentation.dto;

import java.util.UUID;

import com.mifinca.backend.modules.masterdata.domain.MasterData;
import com.mifinca.backend.modules.masterdata.domain.MasterDataCategory;

public record MasterDataResponse(
        UUID masterDataId,
        MasterDataCategory category,
        String name,
        String description,
        boolean active
) {

    public static MasterDataResponse from(MasterData masterData) {
        return new MasterDataResponse(
                masterData.getId(),
                masterData.getCategory(),
                masterData.getName(),
                masterData.getDescription(),
                masterData.isActive()
        );
    }
}
