package com.mifinca.backend.modules.rbac.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.rbac.domain.UserRole;
import com.mifinca.backend.modules.rbac.domain.UserRoleId;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserRoleRepository extends JpaRepository<UserRole, UserRoleId> {

    @Query("""
            select ur from UserRole ur
              join fetch ur.role
             where ur.user.id = :userId
             order by ur.role.name
            """)
    List<UserRole> findByUserIdWithRole(@Param("userId") UUID userId);

    @Query("select ur.role.id from UserRole ur where ur.user.id = :userId")
    List<UUID> findRoleIdsByUserId(@Param("userId") UUID userId);
}
