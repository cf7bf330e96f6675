package com.mifinca.backend.modules.rbac;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.rbac.application.PermissionEvaluator;
import com.mifinca.backend.modules.rbac.application.PermissionNames;
import com.mifinca.backend.modules.rbac.infrastructure.persistence.RolePermissionRepository;
import com.mifinca.backend.modules.rbac.infrastructure.persistence.UserRoleRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PermissionEvaluatorTest {

    @Mock
    private UserRoleRepository userRoleRepository;

    @Mock
    private RolePermissionRepository rolePermissionRepository;

    private PermissionEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new PermissionEvaluator(userRoleRepository, rolePermissionRepository);
    }

    @Test
    @DisplayName("effective permissions are the union over all assigned roles")
    void unionOfRoles() {
        UUID userId = UUID.randomUUID();
        UUID vet = UUID.randomUUID();
        UUID manager = UUID.randomUUID();
        when(userRoleRepository.findRoleIdsByUserId(userId)).thenReturn(List.of(vet, manager));
        when(rolePermissionRepository.findPermissionNamesByRoleIds(List.of(vet, manager)))
                .thenReturn(List.of(PermissionNames.FARM_READ_ALL, PermissionNames.MASTER_DATA_MANAGE, PermissionNames.FARM_READ_ALL));

        assertThat(evaluator.effectivePermissions(userId))
                .containsExactlyInAnyOrder(PermissionNames.FARM_READ_ALL, PermissionNames.MASTER_DATA_MANAGE);
        assertThat(evaluator.hasPermission(new Actor(userId, true, false), PermissionNames.MASTER_DATA_MANAGE)).isTrue();
        assertThat(evaluator.hasPermission(new Actor(userId, true, false), "animals:delete")).isFalse();
    }

    @Test
    @DisplayName("a user without roles holds no permission")
    void noRoles() {
        UUID userId = UUID.randomUUID();
        when(userRoleRepository.findRoleIdsByUserId(userId)).thenReturn(List.of());

        assertThat(evaluator.hasPermission(new Actor(userId, true, false), PermissionNames.FARM_READ_ALL)).isFalse();
        verify(rolePermissionRepository, never()).findPermissionNamesByRoleIds(any());
    }

    @Test
    @DisplayName("superuser holds every permission without a lookup")
    void superuser() {
        Actor admin = new Actor(UUID.randomUUID(), true, true);

        assertThat(evaluator.hasPermission(admin, "anything:at_all")).isTrue();
        verify(userRoleRepository, never()).findRoleIdsByUserId(any());
    }
}
