package com.mifinca.backend.modules.event.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.event.domain.HealthEvent;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface HealthEventRepository extends JpaRepository<HealthEvent, UUID> {

    @Query("""
            select distinct h from HealthEvent h
              left join h.animals a
              left join a.currentLot l
             where h.administeredBy.id = :userId
                or a.owner.id = :userId
                or l.farm.id in :farmIds
             order by h.eventDate desc
            """)
    List<HealthEvent> findVisible(@Param("userId") UUID userId, @Param("farmIds") Collection<UUID> farmIds);
}
