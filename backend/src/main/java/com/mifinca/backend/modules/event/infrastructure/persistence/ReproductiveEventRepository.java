package com.mifinca.backend.modules.event.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.event.domain.ReproductiveEvent;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ReproductiveEventRepository extends JpaRepository<ReproductiveEvent, UUID> {

    @Query("""
            select distinct r from ReproductiveEvent r
              join r.animal a
              left join a.currentLot l
              left join r.sire s
              left join s.currentLot sl
             where r.administeredBy.id = :userId
                or a.owner.id = :userId
                or l.farm.id in :farmIds
                or s.owner.id = :userId
                or sl.farm.id in :farmIds
             order by r.eventDate desc
            """)
    List<ReproductiveEvent> findVisible(@Param("userId") UUID userId, @Param("farmIds") Collection<UUID> farmIds);
}
