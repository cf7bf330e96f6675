package com.mifinca.backend.modules.rbac.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.rbac.domain.RolePermission;
import com.mifinca.backend.modules.rbac.domain.RolePermissionId;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RolePermissionRepository extends JpaRepository<RolePermission, RolePermissionId> {

    @Query("""
            select rp from RolePermission rp
              join fetch rp.permission
             where rp.role.id = :roleId
             order by rp.permission.name
            """)
    List<RolePermission> findByRoleIdWithPermission(@Param("roleId") UUID roleId);

    @Query("""
            select distinct rp.permission.name from RolePermission rp
             where rp.role.id in :roleIds
            """)
    List<String> findPermissionNamesByRoleIds(@Param("roleIds") Collection<UUID> roleIds);
}
