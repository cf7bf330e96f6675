package com.mifinca.backend.modules.masterdata.application;

import java.util.UUID;

import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.masterdata.domain.MasterData;
import com.mifinca.backend.modules.masterdata.domain.MasterDataCategory;
import com.mifinca.backend.modules.masterdata.infrastructure.persistence.MasterDataRepository;

import org.springframework.stereotype.Component;

/**
 * Resolves master data references in request bodies, checking the expected category.
 */
@Component
public class MasterDataLookup {

    private final MasterDataRepository masterDataRepository;

    public MasterDataLookup(MasterDataRepository masterDataRepository) {
        this.masterDataRepository = masterDataRepository;
    }

    public MasterData requireCategory(UUID masterDataId, MasterDataCategory expected) {
        MasterData masterData = masterDataRepository.findById(masterDataId)
                .orElseThrow(() -> ProblemException.notFound("MASTER_DATA_NOT_FOUND"));
        if (masterData.getCategory() != expected) {
            throw ProblemException.invalid("INVALID_MASTER_DATA_CATEGORY",
                    "expected " + expected + " but was " + masterData.getCategory());
        }
        return masterData;
    }

    /**
     * Same as {@link #requireCategory} for optional references; {@code null} stays {@code null}.
     */
    public MasterData optionalCategory(UUID masterDataId, MasterDataCategory expected) {
        return masterDataId == null ? null : requireCategory(masterDataId, expected);
    }
}
