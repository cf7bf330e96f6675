package com.mifinca.backend.modules.auth.presentation;

import java.util.UUID;

import com.mifinca.backend.modules.auth.application.UserAdminService;
import com.mifinca.backend.modules.auth.presentation.dto.UpdateUserRequest;
import com.mifinca.backend.modules.auth.presentation.dto.UserListResponse;
import com.mifinca.backend.modules.auth.presentation.dto.UserProfileResponse;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/users")
public class AdminUserController {

    private final UserAdminService userAdminService;

    public AdminUserController(UserAdminService userAdminService) {
        this.userAdminService = userAdminService;
    }

    @GetMapping
    public ResponseEntity<UserListResponse> listUsers(
            @RequestParam(name = "active", required = false) Boolean active,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(userAdminService.listUsers(active, page, size));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<UserProfileResponse> getUser(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(userAdminService.getUser(userId));
    }

    @PatchMapping("/{userId}")
    public ResponseEntity<UserProfileResponse> updateUser(
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody UpdateUserRequest request
    ) {
        return ResponseEntity.ok(userAdminService.updateUser(userId, request));
    }

    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> deleteUser(@PathVariable("userId") UUID userId) {
        userAdminService.deleteUser(userId);
        return ResponseEntity.noContent().build();
    }
}
