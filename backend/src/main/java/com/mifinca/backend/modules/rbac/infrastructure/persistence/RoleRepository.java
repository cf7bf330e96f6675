package com.mifinca.backend.modules.rbac.infrastructure.persistence;

import java.util.UUID;

import com.mifinca.backend.modules.rbac.domain.Role;

import org.springframework.data.jpa.repository.JpaRepository;

public interface RoleRepository extends JpaRepository<Role, UUID> {

    boolean existsByNameIgnoreCase(String name);
}
