package com.mifinca.backend.modules.rbac.application;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

import com.mifinca.backend.global.error.ProblemCategory;
import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.domain.AccessOperation;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.access.domain.ResourcePolicy;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.rbac.domain.Permission;
import com.mifinca.backend.modules.rbac.domain.PermissionModule;
import com.mifinca.backend.modules.rbac.domain.Role;
import com.mifinca.backend.modules.rbac.infrastructure.persistence.PermissionModuleRepository;
import com.mifinca.backend.modules.rbac.infrastructure.persistence.PermissionRepository;
import com.mifinca.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.mifinca.backend.modules.rbac.presentation.dto.ModuleRequest;
import com.mifinca.backend.modules.rbac.presentation.dto.ModuleResponse;
import com.mifinca.backend.modules.rbac.presentation.dto.PermissionRequest;
import com.mifinca.backend.modules.rbac.presentation.dto.PermissionResponse;
import com.mifinca.backend.modules.rbac.presentation.dto.RoleRequest;
import com.mifinca.backend.modules.rbac.presentation.dto.RoleResponse;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Modules, permissions and roles. Superuser only.
 */
@Service
@Transactional
public class RbacCatalogService {

    private static final Sort BY_NAME = Sort.by(Sort.Direction.ASC, "name");

    private final PermissionModuleRepository moduleRepository;
    private final PermissionRepository permissionRepository;
    private final RoleRepository roleRepository;
    private final CurrentActorService currentActorService;
    private final AccessGuard accessGuard;

    public RbacCatalogService(
            PermissionModuleRepository moduleRepository,
            PermissionRepository permissionRepository,
            RoleRepository roleRepository,
            CurrentActorService currentActorService,
            AccessGuard accessGuard
    ) {
        this.moduleRepository = moduleRepository;
        this.permissionRepository = permissionRepository;
        this.roleRepository = roleRepository;
        this.currentActorService = currentActorService;
        this.accessGuard = accessGuard;
    }

    @Transactional(readOnly = true)
    public List<ModuleResponse> listModules() {
        requireSuperuser(AccessOperation.READ);
        return moduleRepository.findAll(BY_NAME).stream().map(ModuleResponse::from).toList();
    }

    public ModuleResponse createModule(ModuleRequest request) {
        requireSuperuser(AccessOperation.WRITE);
        String name = request.name().trim();
        if (moduleRepository.existsByNameIgnoreCase(name)) {
            throw ProblemException.alreadyExists("MODULE_ALREADY_EXISTS");
        }
        PermissionModule module = new PermissionModule();
        module.setName(name);
        module.setDescription(request.description());
        return ModuleResponse.from(saveUnique(() -> moduleRepository.saveAndFlush(module), "MODULE_ALREADY_EXISTS"));
    }

    public ModuleResponse updateModule(UUID moduleId, ModuleRequest request) {
        Actor actor = currentActorService.requireActor();
        PermissionModule module = loadModule(moduleId);
        accessGuard.requireSuperuser(actor, ResourcePolicy.RBAC_ASSOCIATION, AccessOperation.WRITE);

        String name = request.name().trim();
        if (!name.equalsIgnoreCase(module.getName()) && moduleRepository.existsByNameIgnoreCase(name)) {
            throw ProblemException.alreadyExists("MODULE_ALREADY_EXISTS");
        }
        module.setName(name);
        module.setDescription(request.description());
        return ModuleResponse.from(saveUnique(() -> moduleRepository.saveAndFlush(module), "MODULE_ALREADY_EXISTS"));
    }

    public void deleteModule(UUID moduleId) {
        Actor actor = currentActorService.requireActor();
        PermissionModule module = loadModule(moduleId);
        accessGuard.requireSuperuser(actor, ResourcePolicy.RBAC_ASSOCIATION, AccessOperation.DELETE);
        moduleRepository.delete(module);
    }

    @Transactional(readOnly = true)
    public List<PermissionResponse> listPermissions() {
        requireSuperuser(AccessOperation.READ);
        return permissionRepository.findAll(BY_NAME).stream().map(PermissionResponse::from).toList();
    }

    public PermissionResponse createPermission(PermissionRequest request) {
        Actor actor = currentActorService.requireActor();
        PermissionModule module = request.moduleId() != null ? loadModule(request.moduleId()) : null;
        accessGuard.requireSuperuser(actor, ResourcePolicy.RBAC_ASSOCIATION, AccessOperation.WRITE);

        String name = request.name().trim();
        if (permissionRepository.existsByNameIgnoreCase(name)) {
            throw ProblemException.alreadyExists("PERMISSION_ALREADY_EXISTS");
        }
        Permission permission = new Permission();
        permission.setName(name);
        permission.setDescription(request.description());
        permission.setModule(module);
        return PermissionResponse.from(
                saveUnique(() -> permissionRepository.saveAndFlush(permission), "PERMISSION_ALREADY_EXISTS"));
    }

    public PermissionResponse updatePermission(UUID permissionId, PermissionRequest request) {
        Actor actor = currentActorService.requireActor();
        Permission permission = loadPermission(permissionId);
        PermissionModule module = request.moduleId() != null ? loadModule(request.moduleId()) : null;
        accessGuard.requireSuperuser(actor, ResourcePolicy.RBAC_ASSOCIATION, AccessOperation.WRITE);

        String name = request.name().trim();
        if (!name.equalsIgnoreCase(permission.getName()) && permissionRepository.existsByNameIgnoreCase(name)) {
            throw ProblemException.alreadyExists("PERMISSION_ALREADY_EXISTS");
        }
        permission.setName(name);
        permission.setDescription(request.description());
        permission.setModule(module);
        return PermissionResponse.from(
                saveUnique(() -> permissionRepository.saveAndFlush(permission), "PERMISSION_ALREADY_EXISTS"));
    }

    public void deletePermission(UUID permissionId) {
        Actor actor = currentActorService.requireActor();
        Permission permission = loadPermission(permissionId);
        accessGuard.requireSuperuser(actor, ResourcePolicy.RBAC_ASSOCIATION, AccessOperation.DELETE);
        permissionRepository.delete(permission);
    }

    @Transactional(readOnly = true)
    public List<RoleResponse> listRoles() {
        requireSuperuser(AccessOperation.READ);
        return roleRepository.findAll(BY_NAME).stream().map(RoleResponse::from).toList();
    }

    @Transactional(readOnly = true)
    public RoleResponse getRole(UUID roleId) {
        Actor actor = currentActorService.requireActor();
        Role role = loadRole(roleId);
        accessGuard.requireSuperuser(actor, ResourcePolicy.RBAC_ASSOCIATION, AccessOperation.READ);
        return RoleResponse.from(role);
    }

    public RoleResponse createRole(RoleRequest request) {
        requireSuperuser(AccessOperation.WRITE);
        String name = request.name().trim();
        if (roleRepository.existsByNameIgnoreCase(name)) {
            throw ProblemException.alreadyExists("ROLE_ALREADY_EXISTS");
        }
        Role role = new Role();
        role.setName(name);
        role.setDescription(request.description());
        return RoleResponse.from(saveUnique(() -> roleRepository.saveAndFlush(role), "ROLE_ALREADY_EXISTS"));
    }

    public RoleResponse updateRole(UUID roleId, RoleRequest request) {
        Actor actor = currentActorService.requireActor();
        Role role = loadRole(roleId);
        accessGuard.requireSuperuser(actor, ResourcePolicy.RBAC_ASSOCIATION, AccessOperation.WRITE);

        String name = request.name().trim();
        if (!name.equalsIgnoreCase(role.getName()) && roleRepository.existsByNameIgnoreCase(name)) {
            throw ProblemException.alreadyExists("ROLE_ALREADY_EXISTS");
        }
        role.setName(name);
        role.setDescription(request.description());
        return RoleResponse.from(saveUnique(() -> roleRepository.saveAndFlush(role), "ROLE_ALREADY_EXISTS"));
    }

    public void deleteRole(UUID roleId) {
        Actor actor = currentActorService.requireActor();
        Role role = loadRole(roleId);
        accessGuard.requireSuperuser(actor, ResourcePolicy.RBAC_ASSOCIATION, AccessOperation.DELETE);
        roleRepository.delete(role);
    }

    private void requireSuperuser(AccessOperation operation) {
        Actor actor = currentActorService.requireActor();
        accessGuard.requireSuperuser(actor, ResourcePolicy.RBAC_ASSOCIATION, operation);
    }

    private PermissionModule loadModule(UUID moduleId) {
        return moduleRepository.findById(moduleId)
                .orElseThrow(() -> ProblemException.notFound("MODULE_NOT_FOUND"));
    }

    private Permission loadPermission(UUID permissionId) {
        return permissionRepository.findById(permissionId)
                .orElseThrow(() -> ProblemException.notFound("PERMISSION_NOT_FOUND"));
    }

    private Role loadRole(UUID roleId) {
        return roleRepository.findById(roleId)
                .orElseThrow(() -> ProblemException.notFound("ROLE_NOT_FOUND"));
    }

    private <T> T saveUnique(Supplier<T> save, String conflictCode) {
        try {
            return save.get();
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(ProblemCategory.ALREADY_EXISTS, conflictCode, null, ex);
        }
    }
}
