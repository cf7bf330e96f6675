package com.mifinca.backend.modules.rbac.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.mifinca.backend.modules.rbac.domain.Permission;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PermissionRepository extends JpaRepository<Permission, UUID> {

    Optional<Permission> findByName(String name);

    boolean existsByNameIgnoreCase(String name);
}
