package com.mifinca.backend.modules.rbac.application;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemCategory;
import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.domain.AccessOperation;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.access.domain.ResourcePolicy;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.mifinca.backend.modules.rbac.domain.Permission;
import com.mifinca.backend.modules.rbac.domain.Role;
import com.mifinca.backend.modules.rbac.domain.RolePermission;
import com.mifinca.backend.modules.rbac.domain.RolePermissionId;
import com.mifinca.backend.modules.rbac.domain.UserRole;
import com.mifinca.backend.modules.rbac.domain.UserRoleId;
import com.mifinca.backend.modules.rbac.infrastructure.persistence.PermissionRepository;
import com.mifinca.backend.modules.rbac.infrastructure.persistence.RolePermissionRepository;
import com.mifinca.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.mifinca.backend.modules.rbac.infrastructure.persistence.UserRoleRepository;
import com.mifinca.backend.modules.rbac.presentation.dto.PermissionCheckResponse;
import com.mifinca.backend.modules.rbac.presentation.dto.RolePermissionResponse;
import com.mifinca.backend.modules.rbac.presentation.dto.UserRoleResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Role-permission and user-role associations. Each association is either present or absent:
 * assigning a present one is a conflict, revoking an absent one is not-found.
 */
@Service
@Transactional
public class RbacAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(RbacAssignmentService.class);

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final UserRoleRepository userRoleRepository;
    private final AppUserRepository appUserRepository;
    private final CurrentActorService currentActorService;
    private final AccessGuard accessGuard;
    private final PermissionEvaluator permissionEvaluator;

    public RbacAssignmentService(
            RoleRepository roleRepository,
            PermissionRepository permissionRepository,
            RolePermissionRepository rolePermissionRepository,
            UserRoleRepository userRoleRepository,
            AppUserRepository appUserRepository,
            CurrentActorService currentActorService,
            AccessGuard accessGuard,
            PermissionEvaluator permissionEvaluator
    ) {
        this.roleRepository = roleRepository;
        this.permissionRepository = permissionRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.userRoleRepository = userRoleRepository;
        this.appUserRepository = appUserRepository;
        this.currentActorService = currentActorService;
        this.accessGuard = accessGuard;
        this.permissionEvaluator = permissionEvaluator;
    }

    public RolePermissionResponse assignPermission(UUID roleId, UUID permissionId) {
        Actor actor = currentActorService.requireActor();
        Role role = loadRole(roleId);
        Permission permission = loadPermission(permissionId);
        accessGuard.requireSuperuser(actor, ResourcePolicy.RBAC_ASSOCIATION, AccessOperation.WRITE);

        if (rolePermissionRepository.existsById(new RolePermissionId(roleId, permissionId))) {
            throw ProblemException.alreadyExists("PERMISSION_ALREADY_ASSIGNED");
        }
        RolePermission saved;
        try {
            saved = rolePermissionRepository.saveAndFlush(new RolePermission(role, permission));
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(ProblemCategory.ALREADY_EXISTS, "PERMISSION_ALREADY_ASSIGNED", null, ex);
        }
        log.info("Permission {} assigned to role {} by {}", permission.getName(), roleId, actor.userId());
        return toResponse(saved);
    }

    public void revokePermission(UUID roleId, UUID permissionId) {
        Actor actor = currentActorService.requireActor();
        loadRole(roleId);
        loadPermission(permissionId);
        accessGuard.requireSuperuser(actor, ResourcePolicy.RBAC_ASSOCIATION, AccessOperation.DELETE);

        RolePermission association = rolePermissionRepository.findById(new RolePermissionId(roleId, permissionId))
                .orElseThrow(() -> ProblemException.notFound("ROLE_PERMISSION_NOT_FOUND"));
        rolePermissionRepository.delete(association);
        log.info("Permission {} revoked from role {} by {}", permissionId, roleId, actor.userId());
    }

    @Transactional(readOnly = true)
    public List<RolePermissionResponse> listRolePermissions(UUID roleId) {
        Actor actor = currentActorService.requireActor();
        loadRole(roleId);
        accessGuard.requireSuperuser(actor, ResourcePolicy.RBAC_ASSOCIATION, AccessOperation.READ);

        return rolePermissionRepository.findByRoleIdWithPermission(roleId).stream()
                .map(this::toResponse)
                .toList();
    }

    public UserRoleResponse assignRole(UUID userId, UUID roleId) {
        Actor actor = currentActorService.requireActor();
        AppUser user = loadUser(userId);
        Role role = loadRole(roleId);
        accessGuard.requireSuperuser(actor, ResourcePolicy.RBAC_ASSOCIATION, AccessOperation.WRITE);

        if (userRoleRepository.existsById(new UserRoleId(userId, roleId))) {
            throw ProblemException.alreadyExists("ROLE_ALREADY_ASSIGNED");
        }
        UserRole saved;
        try {
            saved = userRoleRepository.saveAndFlush(new UserRole(user, role, currentActorService.reference(actor)));
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(ProblemCategory.ALREADY_EXISTS, "ROLE_ALREADY_ASSIGNED", null, ex);
        }
        log.info("Role {} assigned to user {} by {}", role.getName(), userId, actor.userId());
        return toResponse(saved);
    }

    public void revokeRole(UUID userId, UUID roleId) {
        Actor actor = currentActorService.requireActor();
        loadUser(userId);
        loadRole(roleId);
        accessGuard.requireSuperuser(actor, ResourcePolicy.RBAC_ASSOCIATION, AccessOperation.DELETE);

        UserRole association = userRoleRepository.findById(new UserRoleId(userId, roleId))
                .orElseThrow(() -> ProblemException.notFound("USER_ROLE_NOT_FOUND"));
        userRoleRepository.delete(association);
        log.info("Role {} revoked from user {} by {}", roleId, userId, actor.userId());
    }

    /**
     * Users may list their own roles; anyone else's require a superuser.
     */
    @Transactional(readOnly = true)
    public List<UserRoleResponse> listUserRoles(UUID userId) {
        Actor actor = currentActorService.requireActor();
        loadUser(userId);
        if (!actor.is(userId)) {
            accessGuard.requireSuperuser(actor, ResourcePolicy.RBAC_ASSOCIATION, AccessOperation.READ);
        }
        return userRoleRepository.findByUserIdWithRole(userId).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public PermissionCheckResponse checkOwnPermission(String permissionName) {
        Actor actor = currentActorService.requireActor();
        return new PermissionCheckResponse(permissionName, permissionEvaluator.hasPermission(actor, permissionName));
    }

    private RolePermissionResponse toResponse(RolePermission association) {
        return new RolePermissionResponse(
                association.getId().getRoleId(),
                association.getId().getPermissionId(),
                association.getPermission().getName(),
                association.getCreatedAt()
        );
    }

    private UserRoleResponse toResponse(UserRole association) {
        return new UserRoleResponse(
                association.getId().getUserId(),
                association.getId().getRoleId(),
                association.getRole().getName(),
                association.getAssignedBy() != null ? association.getAssignedBy().getId() : null,
                association.getCreatedAt()
        );
    }

    private AppUser loadUser(UUID userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND"));
    }

    private Role loadRole(UUID roleId) {
        return roleRepository.findById(roleId)
                .orElseThrow(() -> ProblemException.notFound("ROLE_NOT_FOUND"));
    }

    private Permission loadPermission(UUID permissionId) {
        return permissionRepository.findById(permissionId)
                .orElseThrow(() -> ProblemException.notFound("PERMISSION_NOT_FOUND"));
    }
}
