package com.mifinca.backend.modules.event.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.event.domain.Weighing;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WeighingRepository extends JpaRepository<Weighing, UUID> {

    @Query("""
            select w from Weighing w
              join w.animal a
              left join a.currentLot l
             where w.recordedBy.id = :userId
                or a.owner.id = :userId
                or l.farm.id in :farmIds
             order by w.weighingDate desc
            """)
    List<Weighing> findVisible(@Param("userId") UUID userId, @Param("farmIds") Collection<UUID> farmIds);

    List<Weighing> findByAnimal_IdOrderByWeighingDateDesc(UUID animalId);
}
