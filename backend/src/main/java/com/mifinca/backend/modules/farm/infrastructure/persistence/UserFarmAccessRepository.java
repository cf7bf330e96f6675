package com.mifinca.backend.modules.farm.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.farm.domain.UserFarmAccess;
import com.mifinca.backend.modules.farm.domain.UserFarmAccessId;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserFarmAccessRepository extends JpaRepository<UserFarmAccess, UserFarmAccessId> {

    @Query("select ufa.id.farmId from UserFarmAccess ufa where ufa.id.userId = :userId")
    List<UUID> findFarmIdsByUserId(@Param("userId") UUID userId);

    @Query("""
            select ufa from UserFarmAccess ufa
              join ufa.farm f
              left join ufa.assignedBy ab
             where ufa.id.userId = :userId
                or ab.id = :userId
                or f.owner.id = :userId
            """)
    List<UserFarmAccess> findVisibleTo(@Param("userId") UUID userId);

    List<UserFarmAccess> findByFarm_Id(UUID farmId);
}
