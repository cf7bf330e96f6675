package com.mifinca.backend.modules.farm.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.farm.domain.Lot;

import org.springframework.data.jpa.repository.JpaRepository;

public interface LotRepository extends JpaRepository<Lot, UUID> {

    List<Lot> findByFarm_IdOrderByNameAsc(UUID farmId);
}
