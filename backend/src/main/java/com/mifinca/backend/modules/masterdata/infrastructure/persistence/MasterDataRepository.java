package com.mifinca.backend.modules.masterdata.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.masterdata.domain.MasterData;
import com.mifinca.backend.modules.masterdata.domain.MasterDataCategory;

import org.springframework.data.jpa.repository.JpaRepository;

public interface MasterDataRepository extends JpaRepository<MasterData, UUID> {

    List<MasterData> findByCategoryOrderByNameAsc(MasterDataCategory category);

    List<MasterData> findAllByOrderByCategoryAscNameAsc();

    boolean existsByCategoryAndNameIgnoreCase(MasterDataCategory category, String name);
}
