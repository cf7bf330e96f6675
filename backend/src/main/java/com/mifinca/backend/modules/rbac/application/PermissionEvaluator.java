package com.mifinca.backend.modules.rbac.application;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.rbac.infrastructure.persistence.RolePermissionRepository;
import com.mifinca.backend.modules.rbac.infrastructure.persistence.UserRoleRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Answers "does this user hold permission X" from the union of the permissions of all assigned roles.
 */
@Service
@Transactional(readOnly = true)
public class PermissionEvaluator {

    private final UserRoleRepository userRoleRepository;
    private final RolePermissionRepository rolePermissionRepository;

    public PermissionEvaluator(UserRoleRepository userRoleRepository, RolePermissionRepository rolePermissionRepository) {
        this.userRoleRepository = userRoleRepository;
        this.rolePermissionRepository = rolePermissionRepository;
    }

    public boolean hasPermission(Actor actor, String permissionName) {
        if (actor.superuser()) {
            return true;
        }
        return effectivePermissions(actor.userId()).contains(permissionName);
    }

    public Set<String> effectivePermissions(UUID userId) {
        List<UUID> roleIds = userRoleRepository.findRoleIdsByUserId(userId);
        if (roleIds.isEmpty()) {
            return Set.of();
        }
        return Set.copyOf(rolePermissionRepository.findPermissionNamesByRoleIds(roleIds));
    }
}
