package com.mifinca.backend.modules.farm.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.farm.domain.Farm;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FarmRepository extends JpaRepository<Farm, UUID> {

    @Query("select f.id from Farm f where f.owner.id = :ownerId")
    List<UUID> findIdsByOwnerId(@Param("ownerId") UUID ownerId);

    List<Farm> findByIdInOrderByNameAsc(Collection<UUID> ids);

    List<Farm> findAllByOrderByNameAsc();
}
