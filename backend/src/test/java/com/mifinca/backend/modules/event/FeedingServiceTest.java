package com.mifinca.backend.modules.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
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
import com.mifinca.backend.modules.animal.domain.Animal;
import com.mifinca.backend.modules.animal.infrastructure.persistence.AnimalRepository;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.event.application.EventAnimals;
import com.mifinca.backend.modules.event.application.FeedingService;
import com.mifinca.backend.modules.event.domain.Feeding;
import com.mifinca.backend.modules.event.infrastructure.persistence.FeedingRepository;
import com.mifinca.backend.modules.event.presentation.dto.FeedingRequest;
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
class FeedingServiceTest {

    private static final OffsetDateTime FED_AT = OffsetDateTime.parse("2025-04-02T16:00:00Z");

    @Mock
    private FeedingRepository feedingRepository;

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

    private FeedingService service;
    private AppUser ownerA;
    private AppUser strangerC;
    private Animal heifer;
    private Animal foreignCalf;
    private MasterData silage;

    @BeforeEach
    void setUp() {
        OwnershipResolver resolver = new OwnershipResolver(farmRepository, userFarmAccessRepository);
        AccessGuard guard = new AccessGuard(resolver, new AccessDecisionEngine());
        service = new FeedingService(
                feedingRepository,
                new EventAnimals(animalRepository, guard),
                masterDataLookup,
                currentActorService,
                resolver,
                guard
        );
        ownerA = Fixtures.user("a@finca.test");
        strangerC = Fixtures.user("c@finca.test");
        Farm farm = Fixtures.farm("La Pradera", ownerA);
        Lot lot = Fixtures.lot("Lote 3", farm);
        heifer = Fixtures.animal("NO-0120", ownerA, lot);
        foreignCalf = Fixtures.animal("XX-0002", strangerC, null);

        silage = new MasterData();
        silage.setCategory(MasterDataCategory.FEED_TYPE);
        silage.setName("Ensilaje");
        Fixtures.withId(silage, UUID.randomUUID());
    }

    private void actingAs(AppUser user) {
        when(currentActorService.requireActor()).thenReturn(Fixtures.actor(user));
    }

    private static FeedingRequest request(UUID feedTypeId, UUID... animalIds) {
        return new FeedingRequest(feedTypeId, FED_AT, new BigDecimal("25"), null, null,
                new LinkedHashSet<>(List.of(animalIds)));
    }

    private Feeding feedingBy(AppUser recorder, Animal... animals) {
        Feeding feeding = new Feeding();
        feeding.setFeedType(silage);
        feeding.setFeedingDate(FED_AT);
        feeding.setRecordedBy(recorder);
        feeding.replaceAnimals(List.of(animals));
        return Fixtures.withId(feeding, UUID.randomUUID());
    }

    @Test
    @DisplayName("one animal the caller cannot write rejects the whole feeding")
    void oneForeignAnimalRejectsFeeding() {
        actingAs(ownerA);
        when(animalRepository.findById(heifer.getId())).thenReturn(Optional.of(heifer));
        when(animalRepository.findById(foreignCalf.getId())).thenReturn(Optional.of(foreignCalf));
        when(masterDataLookup.requireCategory(silage.getId(), MasterDataCategory.FEED_TYPE)).thenReturn(silage);

        assertThatThrownBy(() -> service.createFeeding(request(silage.getId(), heifer.getId(), foreignCalf.getId())))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCategory()).isEqualTo(ProblemCategory.FORBIDDEN));
        verify(feedingRepository, never()).save(any());
    }

    @Test
    @DisplayName("an unknown animal is reported before any access check")
    void unknownAnimalFirst() {
        actingAs(strangerC);
        UUID missing = UUID.randomUUID();
        when(animalRepository.findById(heifer.getId())).thenReturn(Optional.of(heifer));
        when(animalRepository.findById(missing)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.createFeeding(request(silage.getId(), heifer.getId(), missing)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCategory()).isEqualTo(ProblemCategory.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("ANIMAL_NOT_FOUND");
                });
    }

    @Test
    @DisplayName("owning one fed animal is enough to read the feeding but not to edit it")
    void anyAnimalGrantsReadOnly() {
        actingAs(strangerC);
        Feeding feeding = feedingBy(ownerA, heifer, foreignCalf);
        when(feedingRepository.findById(feeding.getId())).thenReturn(Optional.of(feeding));

        assertThat(service.getFeeding(feeding.getId()).animalIds())
                .containsExactlyInAnyOrder(heifer.getId(), foreignCalf.getId());
        assertThatThrownBy(() -> service.deleteFeeding(feeding.getId()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCategory()).isEqualTo(ProblemCategory.FORBIDDEN));
        verify(feedingRepository, never()).delete(any());
    }

    @Test
    @DisplayName("the recorder replaces the fed animals")
    void recorderReplacesAnimals() {
        actingAs(ownerA);
        Feeding feeding = feedingBy(ownerA, heifer);
        Animal calf = Fixtures.animal("NO-0121", ownerA, null);
        when(feedingRepository.findById(feeding.getId())).thenReturn(Optional.of(feeding));
        when(animalRepository.findById(calf.getId())).thenReturn(Optional.of(calf));
        when(masterDataLookup.requireCategory(silage.getId(), MasterDataCategory.FEED_TYPE)).thenReturn(silage);
        when(feedingRepository.save(feeding)).thenReturn(feeding);

        Set<UUID> fed = Set.copyOf(service.updateFeeding(feeding.getId(), request(silage.getId(), calf.getId())).animalIds());

        assertThat(fed).containsExactly(calf.getId());
    }
}
