package com.mifinca.backend.modules.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemCategory;
import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessDecisionEngine;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.application.OwnershipResolver;
import com.mifinca.backend.modules.animal.domain.Animal;
import com.mifinca.backend.modules.animal.infrastructure.persistence.AnimalRepository;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.event.application.EventAnimals;
import com.mifinca.backend.modules.event.application.ReproductiveEventService;
import com.mifinca.backend.modules.event.domain.ReproductiveEvent;
import com.mifinca.backend.modules.event.infrastructure.persistence.OffspringBornRepository;
import com.mifinca.backend.modules.event.infrastructure.persistence.ReproductiveEventRepository;
import com.mifinca.backend.modules.event.presentation.dto.OffspringBornRequest;
import com.mifinca.backend.modules.event.presentation.dto.ReproductiveEventRequest;
import com.mifinca.backend.modules.event.presentation.dto.ReproductiveEventResponse;
import com.mifinca.backend.modules.farm.domain.Farm;
import com.mifinca.backend.modules.farm.domain.Lot;
import com.mifinca.backend.modules.farm.infrastructure.persistence.FarmRepository;
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
class ReproductiveEventServiceTest {

    @Mock
    private ReproductiveEventRepository reproductiveEventRepository;

    @Mock
    private OffspringBornRepository offspringBornRepository;

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

    private ReproductiveEventService service;
    private AppUser ownerA;
    private AppUser breederC;
    private Animal cow;
    private Animal bull;
    private MasterData insemination;
    private ReproductiveEvent event;

    @BeforeEach
    void setUp() {
        OwnershipResolver resolver = new OwnershipResolver(farmRepository, userFarmAccessRepository);
        AccessGuard guard = new AccessGuard(resolver, new AccessDecisionEngine());
        service = new ReproductiveEventService(
                reproductiveEventRepository,
                offspringBornRepository,
                new EventAnimals(animalRepository, guard),
                masterDataLookup,
                currentActorService,
                resolver,
                guard
        );
        ownerA = Fixtures.user("a@finca.test");
        breederC = Fixtures.user("c@finca.test");
        Farm farm = Fixtures.farm("La Pradera", ownerA);
        Lot lot = Fixtures.lot("Lote 3", farm);
        cow = Fixtures.animal("CO-0042", ownerA, lot);
        bull = Fixtures.animal("TO-0007", breederC, null);

        insemination = new MasterData();
        insemination.setCategory(MasterDataCategory.REPRODUCTIVE_EVENT_TYPE);
        insemination.setName("Inseminación");
        Fixtures.withId(insemination, UUID.randomUUID());

        event = new ReproductiveEvent();
        event.setAnimal(cow);
        event.setSire(bull);
        event.setEventType(insemination);
        event.setEventDate(OffsetDateTime.parse("2025-03-10T08:00:00Z"));
        event.setAdministeredBy(ownerA);
        Fixtures.withId(event, UUID.randomUUID());
    }

    private void actingAs(AppUser user) {
        when(currentActorService.requireActor()).thenReturn(Fixtures.actor(user));
    }

    private ReproductiveEventRequest request(UUID animalId) {
        return new ReproductiveEventRequest(animalId, insemination.getId(),
                OffsetDateTime.parse("2025-03-10T08:00:00Z"), null, "positivo", null, null);
    }

    @Test
    @DisplayName("the owner of the sire alone can read the event but not edit it")
    void sireOwnerReadsOnly() {
        actingAs(breederC);
        when(reproductiveEventRepository.findById(event.getId())).thenReturn(Optional.of(event));

        ReproductiveEventResponse response = service.getReproductiveEvent(event.getId());
        assertThat(response.sireAnimalId()).isEqualTo(bull.getId());

        assertThatThrownBy(() -> service.deleteReproductiveEvent(event.getId()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCategory()).isEqualTo(ProblemCategory.FORBIDDEN));
        verify(reproductiveEventRepository, never()).delete(any());
    }

    @Test
    @DisplayName("the female of an event cannot be swapped on update")
    void femaleIsImmutable() {
        actingAs(ownerA);
        when(reproductiveEventRepository.findById(event.getId())).thenReturn(Optional.of(event));

        assertThatThrownBy(() -> service.updateReproductiveEvent(event.getId(), request(UUID.randomUUID())))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCategory()).isEqualTo(ProblemCategory.INVALID);
                    assertThat(ex.getCode()).isEqualTo("IMMUTABLE_FIELD");
                });
        assertThat(event.getAnimal()).isSameAs(cow);
    }

    @Test
    @DisplayName("the recorder updates the event keeping the same female")
    void recorderUpdates() {
        actingAs(ownerA);
        when(reproductiveEventRepository.findById(event.getId())).thenReturn(Optional.of(event));
        when(masterDataLookup.requireCategory(insemination.getId(), MasterDataCategory.REPRODUCTIVE_EVENT_TYPE))
                .thenReturn(insemination);
        when(reproductiveEventRepository.save(event)).thenReturn(event);

        ReproductiveEventResponse response = service.updateReproductiveEvent(event.getId(), request(cow.getId()));

        assertThat(response.gestationDiagnosisResult()).isEqualTo("positivo");
        assertThat(response.sireAnimalId()).isNull();
    }

    @Test
    @DisplayName("an offspring registered a second time is rejected as a duplicate")
    void offspringRegisteredTwice() {
        actingAs(ownerA);
        Animal calf = Fixtures.animal("CO-0101", ownerA, cow.getCurrentLot());
        when(reproductiveEventRepository.findById(event.getId())).thenReturn(Optional.of(event));
        when(animalRepository.findById(calf.getId())).thenReturn(Optional.of(calf));
        when(offspringBornRepository.existsByOffspring_Id(calf.getId())).thenReturn(true);

        assertThatThrownBy(() -> service.registerOffspring(event.getId(), new OffspringBornRequest(calf.getId(), null, null)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCategory()).isEqualTo(ProblemCategory.ALREADY_EXISTS);
                    assertThat(ex.getCode()).isEqualTo("OFFSPRING_ALREADY_REGISTERED");
                });
        verify(offspringBornRepository, never()).saveAndFlush(any());
    }
}
