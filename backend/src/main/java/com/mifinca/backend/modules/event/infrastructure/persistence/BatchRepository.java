package com.mifinca.backend.modules.event.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.event.domain.Batch;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BatchRepository extends JpaRepository<Batch, UUID> {

    @Query("""
            select distinct b from Batch b
              left join b.animals a
              left join a.currentLot l
             where b.farm.id in :farmIds
                or b.createdBy.id = :userId
                or a.owner.id = :userId
                or l.farm.id in :farmIds
             order by b.name
            """)
    List<Batch> findVisible(@Param("userId") UUID userId, @Param("farmIds") Collection<UUID> farmIds);
}
