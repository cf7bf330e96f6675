package com.mifinca.backend.modules.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemCategory;
import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessDecisionEngine;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.application.OwnershipResolver;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.animal.domain.Animal;
import com.mifinca.backend.modules.animal.infrastructure.persistence.AnimalRepository;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.event.application.EventAnimals;
import com.mifinca.backend.modules.event.application.HealthEventService;
import com.mifinca.backend.modules.event.domain.HealthEvent;
import com.mifinca.backend.modules.event.infrastructure.persistence.HealthEventRepository;
import com.mifinca.backend.modules.event.presentation.dto.HealthEventRequest;
import com.mifinca.backend.modules.event.presentation.dto.HealthEventResponse;
import com.mifinca.backend.modules.farm.domain.Farm;
import com.mifinca.backend.modules.farm.domain.Lot;
import com.mifinca.backend.modules.farm.domain.UserFarmAccessId;
import com.mifinca.backend.modules.farm.infrastructure.persistence.FarmRepository;
import com.mifinca.backend.modules.farm.infrastructure.persistence.ProductRepository;
import com.mifinca.backend.modules.farm.infrastructure.persistence.UserFarmAccessRepository;
import com.mifinca.backend.modules.masterdata.application.MasterDataLookup;
import com.mifinca.backend.modules.masterdata.domain.MasterData;
import com.mifinca.backend.modules.masterdata.domain.MasterDataCategory;
import com.mifinca.backend.support.Fixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HealthEventServiceTest {

    private static final OffsetDateTime EVENT_DATE = OffsetDateTime.parse("2025-06-02T07:00:00Z");

    @Mock
    private HealthEventRepository healthEventRepository;

    @Mock
    private ProductRepository productRepository;

    @Mock
    private AnimalRepository animalRepository;

    @Mock
    private FarmRepository farmRepository;

    @Mock
    private UserFarmAccessRepository userFarmAccessRepository;

    @Mock
    private MasterDataLookup masterDataLookup;

    @Mock
    private CurrentActorService currentActorService;

    private HealthEventService service;

    private AppUser ownerA;
    private AppUser workerB;
    private AppUser strangerC;
    private Farm farm;
    private Animal cow;
    private MasterData vaccination;

    @BeforeEach
    void setUp() {
        OwnershipResolver resolver = new OwnershipResolver(farmRepository, userFarmAccessRepository);
        AccessGuard guard = new AccessGuard(resolver, new AccessDecisionEngine());
        service = new HealthEventService(
                healthEventRepository,
                productRepository,
                new EventAnimals(animalRepository, guard),
                masterDataLookup,
                currentActorService,
                resolver,
                guard
        );
        ownerA = Fixtures.user("a@finca.test");
        workerB = Fixtures.user("b@finca.test");
        strangerC = Fixtures.user("c@finca.test");
        farm = Fixtures.farm("Santa Rosa", ownerA);
        Lot lot = Fixtures.lot("Corral", farm);
        cow = Fixtures.animal("COW-20", ownerA, lot);
        vaccination = new MasterData();
        vaccination.setCategory(MasterDataCategory.HEALTH_EVENT_TYPE);
        vaccination.setName("Vacunacion");
        Fixtures.withId(vaccination, UUID.randomUUID());
    }

    private void actingAs(AppUser user) {
        when(currentActorService.requireActor()).thenReturn(Fixtures.actor(user));
    }

    private void grantWorker() {
        when(userFarmAccessRepository.existsById(new UserFarmAccessId(workerB.getId(), farm.getId()))).thenReturn(true);
    }

    private HealthEventRequest vaccinate(Set<UUID> animalIds) {
        return new HealthEventRequest(vaccination.getId(), EVENT_DATE, "aftosa", null, null, null, animalIds);
    }

    private HealthEvent recordedBy(AppUser recorder) {
        HealthEvent event = new HealthEvent();
        event.setEventType(vaccination);
        event.setEventDate(EVENT_DATE);
        event.setAdministeredBy(recorder);
        event.replaceAnimals(List.of(cow));
        return Fixtures.withId(event, UUID.randomUUID());
    }

    @Test
    @DisplayName("worker records a health event on an animal of the shared farm")
    void workerRecordsEvent() {
        actingAs(workerB);
        grantWorker();
        when(animalRepository.findById(cow.getId())).thenReturn(Optional.of(cow));
        when(masterDataLookup.requireCategory(vaccination.getId(), MasterDataCategory.HEALTH_EVENT_TYPE)).thenReturn(vaccination);
        when(currentActorService.reference(any(Actor.class))).thenReturn(workerB);
        when(healthEventRepository.save(any(HealthEvent.class)))
                .thenAnswer(inv -> Fixtures.withId(inv.getArgument(0), UUID.randomUUID()));

        HealthEventResponse response = service.createHealthEvent(vaccinate(Set.of(cow.getId())));

        assertThat(response.administeredByUserId()).isEqualTo(workerB.getId());
        assertThat(response.animalIds()).containsExactly(cow.getId());
    }

    @Test
    @DisplayName("an unknown animal id is not-found before any access check")
    void unknownAnimal() {
        UUID missing = UUID.randomUUID();
        actingAs(strangerC);
        when(animalRepository.findById(cow.getId())).thenReturn(Optional.of(cow));
        when(animalRepository.findById(missing)).thenReturn(Optional.empty());
        Set<UUID> ids = new LinkedHashSet<>(List.of(cow.getId(), missing));

        assertThatThrownBy(() -> service.createHealthEvent(vaccinate(ids)))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("ANIMAL_NOT_FOUND");
        verify(healthEventRepository, never()).save(any());
    }

    @Test
    @DisplayName("animal owner reads the worker's event but only the recorder may change it")
    void ownerReadsButCannotEdit() {
        HealthEvent event = recordedBy(workerB);
        actingAs(ownerA);
        when(healthEventRepository.findById(event.getId())).thenReturn(Optional.of(event));

        assertThat(service.getHealthEvent(event.getId()).healthEventId()).isEqualTo(event.getId());
        assertThatThrownBy(() -> service.deleteHealthEvent(event.getId()))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCategory())
                .isEqualTo(ProblemCategory.FORBIDDEN);
    }

    @Test
    @DisplayName("stranger cannot read an event on animals outside their reach")
    void strangerCannotRead() {
        HealthEvent event = recordedBy(workerB);
        actingAs(strangerC);
        when(healthEventRepository.findById(event.getId())).thenReturn(Optional.of(event));

        assertThatThrownBy(() -> service.getHealthEvent(event.getId()))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCategory())
                .isEqualTo(ProblemCategory.FORBIDDEN);
    }
}
