package com.mifinca.backend.modules.rbac.presentation;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.rbac.application.RbacCatalogService;
import com.mifinca.backend.modules.rbac.presentation.dto.ModuleRequest;
import com.mifinca.backend.modules.rbac.presentation.dto.ModuleResponse;
import com.mifinca.backend.modules.rbac.presentation.dto.PermissionRequest;
import com.mifinca.backend.modules.rbac.presentation.dto.PermissionResponse;
import com.mifinca.backend.modules.rbac.presentation.dto.RoleRequest;
import com.mifinca.backend.modules.rbac.presentation.dto.RoleResponse;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/rbac")
public class RbacCatalogController {

    private final RbacCatalogService catalogService;

    public RbacCatalogController(RbacCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @GetMapping("/modules")
    public ResponseEntity<List<ModuleResponse>> listModules() {
        return ResponseEntity.ok(catalogService.listModules());
    }

    @PostMapping("/modules")
    public ResponseEntity<ModuleResponse> createModule(@Valid @RequestBody ModuleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.createModule(request));
    }

    @PutMapping("/modules/{moduleId}")
    public ResponseEntity<ModuleResponse> updateModule(
            @PathVariable("moduleId") UUID moduleId,
            @Valid @RequestBody ModuleRequest request
    ) {
        return ResponseEntity.ok(catalogService.updateModule(moduleId, request));
    }

    @DeleteMapping("/modules/{moduleId}")
    public ResponseEntity<Void> deleteModule(@PathVariable("moduleId") UUID moduleId) {
        catalogService.deleteModule(moduleId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/permissions")
    public ResponseEntity<List<PermissionResponse>> listPermissions() {
        return ResponseEntity.ok(catalogService.listPermissions());
    }

    @PostMapping("/permissions")
    public ResponseEntity<PermissionResponse> createPermission(@Valid @RequestBody PermissionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.createPermission(request));
    }

    @PutMapping("/permissions/{permissionId}")
    public ResponseEntity<PermissionResponse> updatePermission(
            @PathVariable("permissionId") UUID permissionId,
            @Valid @RequestBody PermissionRequest request
    ) {
        return ResponseEntity.ok(catalogService.updatePermission(permissionId, request));
    }

    @DeleteMapping("/permissions/{permissionId}")
    public ResponseEntity<Void> deletePermission(@PathVariable("permissionId") UUID permissionId) {
        catalogService.deletePermission(permissionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/roles")
    public ResponseEntity<List<RoleResponse>> listRoles() {
        return ResponseEntity.ok(catalogService.listRoles());
    }

    @GetMapping("/roles/{roleId}")
    public ResponseEntity<RoleResponse> getRole(@PathVariable("roleId") UUID roleId) {
        return ResponseEntity.ok(catalogService.getRole(roleId));
    }

    @PostMapping("/roles")
    public ResponseEntity<RoleResponse> createRole(@Valid @RequestBody RoleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.createRole(request));
    }

    @PutMapping("/roles/{roleId}")
    public ResponseEntity<RoleResponse> updateRole(
            @PathVariable("roleId") UUID roleId,
            @Valid @RequestBody RoleRequest request
    ) {
        return ResponseEntity.ok(catalogService.updateRole(roleId, request));
    }

    @DeleteMapping("/roles/{roleId}")
    public ResponseEntity<Void> deleteRole(@PathVariable("roleId") UUID roleId) {
        catalogService.deleteRole(roleId);
        return ResponseEntity.noContent().build();
    }
}
