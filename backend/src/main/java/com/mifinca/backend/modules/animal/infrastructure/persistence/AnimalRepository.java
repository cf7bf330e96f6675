package com.mifinca.backend.modules.animal.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.animal.domain.Animal;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AnimalRepository extends JpaRepository<Animal, UUID> {

    /**
     * Animals owned by the user or sitting in a lot of one of the given farms.
     */
    @Query("""
            select a from Animal a
              left join a.currentLot l
             where a.owner.id = :userId
                or l.farm.id in :farmIds
             order by a.tagId
            """)
    List<Animal> findVisible(@Param("userId") UUID userId, @Param("farmIds") Collection<UUID> farmIds);

    List<Animal> findByCurrentLot_IdOrderByTagIdAsc(UUID lotId);

    List<Animal> findByCurrentLot_Farm_IdOrderByTagIdAsc(UUID farmId);

    @Modifying(flushAutomatically = true)
    @Query("update Animal a set a.currentLot = null where a.currentLot.id = :lotId")
    int detachFromLot(@Param("lotId") UUID lotId);

    @Modifying(flushAutomatically = true)
    @Query("update Animal a set a.currentLot = null where a.currentLot.id in (select l.id from Lot l where l.farm.id = :farmId)")
    int detachFromFarm(@Param("farmId") UUID farmId);
}
