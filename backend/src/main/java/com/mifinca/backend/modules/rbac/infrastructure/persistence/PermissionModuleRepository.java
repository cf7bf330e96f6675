package com.mifinca.backend.modules.rbac.infrastructure.persistence;

import java.util.UUID;

import com.mifinca.backend.modules.rbac.domain.PermissionModule;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PermissionModuleRepository extends JpaRepository<PermissionModule, UUID> {

    boolean existsByNameIgnoreCase(String name);
}
