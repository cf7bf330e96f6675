package com.mifinca.backend.modules.masterdata.presentation.dto;

import com.mifinca.backend.modules.masterdata.domain.MasterDataCategory;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record MasterDataRequest(
        @NotNull MasterDataCategory category,
        @NotBlank @Size(max = 120) String name,
        String description,
        Boolean active
) {
}
