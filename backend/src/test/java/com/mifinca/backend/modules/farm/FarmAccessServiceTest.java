package com.mifinca.backend.modules.farm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import com.mifinca.backend.global.error.ProblemCategory;
import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessDecisionEngine;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.application.OwnershipResolver;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.mifinca.backend.modules.farm.application.FarmAccessService;
import com.mifinca.backend.modules.farm.domain.Farm;
import com.mifinca.backend.modules.farm.domain.FarmAccessLevel;
import com.mifinca.backend.modules.farm.domain.UserFarmAccess;
import com.mifinca.backend.modules.farm.domain.UserFarmAccessId;
import com.mifinca.backend.modules.farm.infrastructure.persistence.FarmRepository;
import com.mifinca.backend.modules.farm.infrastructure.persistence.UserFarmAccessRepository;
import com.mifinca.backend.modules.farm.presentation.dto.FarmAccessGrantRequest;
import com.mifinca.backend.modules.farm.presentation.dto.FarmAccessResponse;
import com.mifinca.backend.modules.farm.presentation.dto.FarmAccessUpdateRequest;
import com.mifinca.backend.support.Fixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class FarmAccessServiceTest {

    @Mock
    private UserFarmAccessRepository userFarmAccessRepository;

    @Mock
    private FarmRepository farmRepository;

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private CurrentActorService currentActorService;

    private FarmAccessService service;

    private AppUser owner;
    private AppUser worker;
    private Farm farm;

    @BeforeEach
    void setUp() {
        AccessGuard guard = new AccessGuard(
                new OwnershipResolver(farmRepository, userFarmAccessRepository),
                new AccessDecisionEngine()
        );
        service = new FarmAccessService(userFarmAccessRepository, farmRepository, appUserRepository, currentActorService, guard);
        owner = Fixtures.user("owner@finca.test");
        worker = Fixtures.user("worker@finca.test");
        farm = Fixtures.farm("San Isidro", owner);
    }

    private void actingAs(AppUser user) {
        when(currentActorService.requireActor()).thenReturn(Fixtures.actor(user));
    }

    @Test
    @DisplayName("farm owner shares the farm, default level is VIEW")
    void ownerGrantsAccess() {
        actingAs(owner);
        when(appUserRepository.findById(worker.getId())).thenReturn(Optional.of(worker));
        when(farmRepository.findById(farm.getId())).thenReturn(Optional.of(farm));
        when(currentActorService.reference(any(Actor.class))).thenReturn(owner);
        when(userFarmAccessRepository.saveAndFlush(any(UserFarmAccess.class))).thenAnswer(inv -> inv.getArgument(0));

        FarmAccessResponse response = service.grantAccess(new FarmAccessGrantRequest(worker.getId(), farm.getId(), null, "ordeño"));

        assertThat(response.userId()).isEqualTo(worker.getId());
        assertThat(response.farmId()).isEqualTo(farm.getId());
        assertThat(response.accessLevel()).isEqualTo(FarmAccessLevel.VIEW);
        assertThat(response.assignedByUserId()).isEqualTo(owner.getId());
    }

    @Test
    @DisplayName("a second grant for the same pair is a conflict")
    void duplicateGrant() {
        actingAs(owner);
        when(appUserRepository.findById(worker.getId())).thenReturn(Optional.of(worker));
        when(farmRepository.findById(farm.getId())).thenReturn(Optional.of(farm));
        when(userFarmAccessRepository.existsById(new UserFarmAccessId(worker.getId(), farm.getId()))).thenReturn(true);

        assertThatThrownBy(() -> service.grantAccess(new FarmAccessGrantRequest(worker.getId(), farm.getId(), FarmAccessLevel.EDIT, null)))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("FARM_ACCESS_ALREADY_GRANTED");
        verify(userFarmAccessRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("a concurrent duplicate grant surfaces as a conflict")
    void concurrentDuplicateGrant() {
        actingAs(owner);
        when(appUserRepository.findById(worker.getId())).thenReturn(Optional.of(worker));
        when(farmRepository.findById(farm.getId())).thenReturn(Optional.of(farm));
        when(currentActorService.reference(any(Actor.class))).thenReturn(owner);
        when(userFarmAccessRepository.saveAndFlush(any(UserFarmAccess.class)))
                .thenThrow(new DataIntegrityViolationException("uq"));

        assertThatThrownBy(() -> service.grantAccess(new FarmAccessGrantRequest(worker.getId(), farm.getId(), null, null)))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCategory())
                .isEqualTo(ProblemCategory.ALREADY_EXISTS);
    }

    @Test
    @DisplayName("a grantee cannot share the farm further")
    void granteeCannotGrant() {
        AppUser third = Fixtures.user("third@finca.test");
        actingAs(worker);
        when(appUserRepository.findById(third.getId())).thenReturn(Optional.of(third));
        when(farmRepository.findById(farm.getId())).thenReturn(Optional.of(farm));

        assertThatThrownBy(() -> service.grantAccess(new FarmAccessGrantRequest(third.getId(), farm.getId(), null, null)))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCategory())
                .isEqualTo(ProblemCategory.FORBIDDEN);
    }

    @Test
    @DisplayName("the identifying pair of a grant cannot be changed")
    void immutablePair() {
        actingAs(owner);
        UserFarmAccess grant = new UserFarmAccess(worker, farm, FarmAccessLevel.VIEW, owner);
        when(userFarmAccessRepository.findById(grant.getId())).thenReturn(Optional.of(grant));

        FarmAccessUpdateRequest request = new FarmAccessUpdateRequest(owner.getId(), farm.getId(), FarmAccessLevel.EDIT, null);

        assertThatThrownBy(() -> service.updateGrant(worker.getId(), farm.getId(), request))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("IMMUTABLE_FIELD");
        assertThat(grant.getAccessLevel()).isEqualTo(FarmAccessLevel.VIEW);
    }

    @Test
    @DisplayName("farm owner changes the access level")
    void updateLevel() {
        actingAs(owner);
        UserFarmAccess grant = new UserFarmAccess(worker, farm, FarmAccessLevel.VIEW, owner);
        when(userFarmAccessRepository.findById(grant.getId())).thenReturn(Optional.of(grant));
        when(userFarmAccessRepository.save(grant)).thenReturn(grant);

        FarmAccessResponse response = service.updateGrant(worker.getId(), farm.getId(),
                new FarmAccessUpdateRequest(worker.getId(), null, FarmAccessLevel.MANAGE, "capataz"));

        assertThat(response.accessLevel()).isEqualTo(FarmAccessLevel.MANAGE);
        assertThat(response.notes()).isEqualTo("capataz");
    }

    @Test
    @DisplayName("only a superuser revokes a grant")
    void revokeNeedsSuperuser() {
        UserFarmAccess grant = new UserFarmAccess(worker, farm, FarmAccessLevel.VIEW, owner);
        when(userFarmAccessRepository.findById(grant.getId())).thenReturn(Optional.of(grant));

        actingAs(owner);
        assertThatThrownBy(() -> service.revokeAccess(worker.getId(), farm.getId()))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCategory())
                .isEqualTo(ProblemCategory.FORBIDDEN);

        actingAs(Fixtures.superuser("admin@finca.test"));
        service.revokeAccess(worker.getId(), farm.getId());
        verify(userFarmAccessRepository).delete(grant);
    }

    @Test
    @DisplayName("unknown grant is not-found even for strangers")
    void unknownGrant() {
        actingAs(Fixtures.user("stranger@finca.test"));
        when(userFarmAccessRepository.findById(new UserFarmAccessId(worker.getId(), farm.getId()))).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getGrant(worker.getId(), farm.getId()))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCategory())
                .isEqualTo(ProblemCategory.NOT_FOUND);
    }
}
