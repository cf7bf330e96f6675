package com.mifinca.backend.modules.event.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.event.domain.Feeding;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FeedingRepository extends JpaRepository<Feeding, UUID> {

    @Query("""
            select distinct f from Feeding f
              left join f.animals a
              left join a.currentLot l
             where f.recordedBy.id = :userId
                or a.owner.id = :userId
                or l.farm.id in :farmIds
             order by f.feedingDate desc
            """)
    List<Feeding> findVisible(@Param("userId") UUID userId, @Param("farmIds") Collection<UUID> farmIds);
}
