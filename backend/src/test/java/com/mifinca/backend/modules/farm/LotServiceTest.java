package com.mifinca.backend.modules.farm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemCategory;
import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessDecisionEngine;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.application.OwnershipResolver;
import com.mifinca.backend.modules.animal.infrastructure.persistence.AnimalRepository;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.farm.application.LotService;
import com.mifinca.backend.modules.farm.domain.Farm;
import com.mifinca.backend.modules.farm.domain.Lot;
import com.mifinca.backend.modules.farm.domain.UserFarmAccessId;
import com.mifinca.backend.modules.farm.infrastructure.persistence.FarmRepository;
import com.mifinca.backend.modules.farm.infrastructure.persistence.LotRepository;
import com.mifinca.backend.modules.farm.infrastructure.persistence.UserFarmAccessRepository;
import com.mifinca.backend.modules.farm.presentation.dto.LotRequest;
import com.mifinca.backend.modules.farm.presentation.dto.LotResponse;
import com.mifinca.backend.support.Fixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LotServiceTest {

    @Mock
    private LotRepository lotRepository;

    @Mock
    private FarmRepository farmRepository;

    @Mock
    private AnimalRepository animalRepository;

    @Mock
    private UserFarmAccessRepository userFarmAccessRepository;

    @Mock
    private CurrentActorService currentActorService;

    private LotService service;
    private AppUser ownerA;
    private AppUser workerB;
    private Farm farm;
    private Lot lot;

    @BeforeEach
    void setUp() {
        OwnershipResolver resolver = new OwnershipResolver(farmRepository, userFarmAccessRepository);
        service = new LotService(
                lotRepository,
                farmRepository,
                animalRepository,
                currentActorService,
                new AccessGuard(resolver, new AccessDecisionEngine())
        );
        ownerA = Fixtures.user("a@finca.test");
        workerB = Fixtures.user("b@finca.test");
        farm = Fixtures.farm("La Pradera", ownerA);
        lot = Fixtures.lot("Lote 3", farm);
    }

    private void actingAs(AppUser user) {
        when(currentActorService.requireActor()).thenReturn(Fixtures.actor(user));
    }

    @Test
    @DisplayName("a grantee reads a lot of the shared farm but cannot rename it")
    void granteeReadsButCannotWrite() {
        actingAs(workerB);
        when(lotRepository.findById(lot.getId())).thenReturn(Optional.of(lot));
        when(userFarmAccessRepository.existsById(new UserFarmAccessId(workerB.getId(), farm.getId()))).thenReturn(true);

        LotResponse response = service.getLot(lot.getId());
        assertThat(response.farmId()).isEqualTo(farm.getId());

        LotRequest rename = new LotRequest("Lote nuevo", farm.getId(), null, null);
        assertThatThrownBy(() -> service.updateLot(lot.getId(), rename))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCategory()).isEqualTo(ProblemCategory.FORBIDDEN));
        assertThat(lot.getName()).isEqualTo("Lote 3");
    }

    @Test
    @DisplayName("moving a lot needs ownership of the target farm too")
    void moveToForeignFarm() {
        actingAs(ownerA);
        Farm foreign = Fixtures.farm("El Retiro", workerB);
        when(lotRepository.findById(lot.getId())).thenReturn(Optional.of(lot));
        when(farmRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));

        LotRequest move = new LotRequest("Lote 3", foreign.getId(), null, null);

        assertThatThrownBy(() -> service.updateLot(lot.getId(), move))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCategory()).isEqualTo(ProblemCategory.FORBIDDEN));
        assertThat(lot.getFarm()).isSameAs(farm);
        verify(lotRepository, never()).save(any());
    }

    @Test
    @DisplayName("a missing target farm is reported before any access check")
    void moveToMissingFarm() {
        actingAs(workerB);
        UUID missing = UUID.randomUUID();
        when(lotRepository.findById(lot.getId())).thenReturn(Optional.of(lot));
        when(farmRepository.findById(missing)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.updateLot(lot.getId(), new LotRequest("Lote 3", missing, null, null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("FARM_NOT_FOUND"));
    }

    @Test
    @DisplayName("deleting a lot keeps its animals and clears their lot")
    void deleteDetachesAnimals() {
        actingAs(ownerA);
        when(lotRepository.findById(lot.getId())).thenReturn(Optional.of(lot));

        service.deleteLot(lot.getId());

        verify(animalRepository).detachFromLot(lot.getId());
        verify(lotRepository).delete(lot);
    }
}
