package com.mifinca.backend.modules.rbac.presentation;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.rbac.application.RbacAssignmentService;
import com.mifinca.backend.modules.rbac.presentation.dto.PermissionCheckResponse;
import com.mifinca.backend.modules.rbac.presentation.dto.RolePermissionResponse;
import com.mifinca.backend.modules.rbac.presentation.dto.UserRoleResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/rbac")
public class RbacAssignmentController {

    private final RbacAssignmentService assignmentService;

    public RbacAssignmentController(RbacAssignmentService assignmentService) {
        this.assignmentService = assignmentService;
    }

    @GetMapping("/roles/{roleId}/permissions")
    public ResponseEntity<List<RolePermissionResponse>> listRolePermissions(@PathVariable("roleId") UUID roleId) {
        return ResponseEntity.ok(assignmentService.listRolePermissions(roleId));
    }

    @Operation(summary = "Add a permission to a role")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Assigned"),
            @ApiResponse(responseCode = "404", description = "Role or permission does not exist"),
            @ApiResponse(responseCode = "409", description = "`PERMISSION_ALREADY_ASSIGNED`")
    })
    @PostMapping("/roles/{roleId}/permissions/{permissionId}")
    public ResponseEntity<RolePermissionResponse> assignPermission(
            @PathVariable("roleId") UUID roleId,
            @PathVariable("permissionId") UUID permissionId
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(assignmentService.assignPermission(roleId, permissionId));
    }

    @DeleteMapping("/roles/{roleId}/permissions/{permissionId}")
    public ResponseEntity<Void> revokePermission(
            @PathVariable("roleId") UUID roleId,
            @PathVariable("permissionId") UUID permissionId
    ) {
        assignmentService.revokePermission(roleId, permissionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/users/{userId}/roles")
    public ResponseEntity<List<UserRoleResponse>> listUserRoles(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(assignmentService.listUserRoles(userId));
    }

    @Operation(summary = "Give a role to a user")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Assigned"),
            @ApiResponse(responseCode = "404", description = "User or role does not exist"),
            @ApiResponse(responseCode = "409", description = "`ROLE_ALREADY_ASSIGNED`")
    })
    @PostMapping("/users/{userId}/roles/{roleId}")
    public ResponseEntity<UserRoleResponse> assignRole(
            @PathVariable("userId") UUID userId,
            @PathVariable("roleId") UUID roleId
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(assignmentService.assignRole(userId, roleId));
    }

    @DeleteMapping("/users/{userId}/roles/{roleId}")
    public ResponseEntity<Void> revokeRole(
            @PathVariable("userId") UUID userId,
            @PathVariable("roleId") UUID roleId
    ) {
        assignmentService.revokeRole(userId, roleId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/users/me/permissions/{name}")
    public ResponseEntity<PermissionCheckResponse> checkPermission(@PathVariable("name") String name) {
        return ResponseEntity.ok(assignmentService.checkOwnPermission(name));
    }
}
