package com.mifinca.backend.modules.animal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemCategory;
import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessDecisionEngine;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.application.OwnershipResolver;
import com.mifinca.backend.modules.animal.application.GrupoService;
import com.mifinca.backend.modules.animal.domain.Animal;
import com.mifinca.backend.modules.animal.domain.AnimalGroup;
import com.mifinca.backend.modules.animal.domain.Grupo;
import com.mifinca.backend.modules.animal.infrastructure.persistence.AnimalGroupRepository;
import com.mifinca.backend.modules.animal.infrastructure.persistence.AnimalRepository;
import com.mifinca.backend.modules.animal.infrastructure.persistence.GrupoRepository;
import com.mifinca.backend.modules.animal.presentation.dto.GrupoMemberRequest;
import com.mifinca.backend.modules.animal.presentation.dto.GrupoMemberResponse;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.farm.domain.Farm;
import com.mifinca.backend.modules.farm.domain.Lot;
import com.mifinca.backend.modules.farm.infrastructure.persistence.FarmRepository;
import com.mifinca.backend.modules.farm.infrastructure.persistence.UserFarmAccessRepository;
import com.mifinca.backend.support.Fixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GrupoServiceTest {

    @Mock
    private GrupoRepository grupoRepository;

    @Mock
    private AnimalGroupRepository animalGroupRepository;

    @Mock
    private AnimalRepository animalRepository;

    @Mock
    private FarmRepository farmRepository;

    @Mock
    private UserFarmAccessRepository userFarmAccessRepository;

    @Mock
    private CurrentActorService currentActorService;

    private GrupoService service;
    private Clock clock;

    private AppUser ownerA;
    private AppUser workerB;
    private Grupo grupo;
    private Animal cow;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2025-07-01T12:00:00Z").toInstant(), ZoneOffset.UTC);
        AccessGuard guard = new AccessGuard(
                new OwnershipResolver(farmRepository, userFarmAccessRepository),
                new AccessDecisionEngine()
        );
        service = new GrupoService(grupoRepository, animalGroupRepository, animalRepository, currentActorService, guard, clock);
        ownerA = Fixtures.user("a@finca.test");
        workerB = Fixtures.user("b@finca.test");
        Farm farm = Fixtures.farm("Los Pinos", ownerA);
        Lot lot = Fixtures.lot("Lote 1", farm);
        cow = Fixtures.animal("COW-30", ownerA, lot);
        grupo = Fixtures.grupo("Secado", ownerA);
    }

    private void actingAs(AppUser user) {
        when(currentActorService.requireActor()).thenReturn(Fixtures.actor(user));
    }

    @Test
    @DisplayName("creator adds an animal to the grupo")
    void addAnimal() {
        actingAs(ownerA);
        when(grupoRepository.findById(grupo.getId())).thenReturn(Optional.of(grupo));
        when(animalRepository.findById(cow.getId())).thenReturn(Optional.of(cow));
        when(animalGroupRepository.saveAndFlush(any(AnimalGroup.class)))
                .thenAnswer(inv -> Fixtures.withId(inv.getArgument(0), UUID.randomUUID()));

        GrupoMemberResponse response = service.addAnimal(grupo.getId(), new GrupoMemberRequest(cow.getId(), null));

        assertThat(response.grupoId()).isEqualTo(grupo.getId());
        assertThat(response.animalId()).isEqualTo(cow.getId());
        assertThat(response.assignedAt()).isEqualTo(OffsetDateTime.now(clock));
        assertThat(response.removedAt()).isNull();
    }

    @Test
    @DisplayName("an animal already active in the grupo is a conflict")
    void duplicateMembership() {
        actingAs(ownerA);
        when(grupoRepository.findById(grupo.getId())).thenReturn(Optional.of(grupo));
        when(animalRepository.findById(cow.getId())).thenReturn(Optional.of(cow));
        when(animalGroupRepository.existsByGrupo_IdAndAnimal_IdAndRemovedAtIsNull(grupo.getId(), cow.getId())).thenReturn(true);

        assertThatThrownBy(() -> service.addAnimal(grupo.getId(), new GrupoMemberRequest(cow.getId(), null)))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("ANIMAL_ALREADY_IN_GRUPO");
    }

    @Test
    @DisplayName("farm grants do not extend to the farm owner's grupos")
    void grantDoesNotReachGrupo() {
        actingAs(workerB);
        when(grupoRepository.findById(grupo.getId())).thenReturn(Optional.of(grupo));

        assertThatThrownBy(() -> service.getGrupo(grupo.getId()))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCategory())
                .isEqualTo(ProblemCategory.FORBIDDEN);
    }
}
