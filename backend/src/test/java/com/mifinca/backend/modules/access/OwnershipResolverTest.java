package com.mifinca.backend.modules.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.mifinca.backend.modules.access.application.OwnershipResolver;
import com.mifinca.backend.modules.access.domain.AccessFacts;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.access.domain.AnimalAccessFacts;
import com.mifinca.backend.modules.access.domain.AnimalScopedRecord;
import com.mifinca.backend.modules.access.domain.FarmAccessFacts;
import com.mifinca.backend.modules.animal.domain.Animal;
import com.mifinca.backend.modules.animal.domain.Grupo;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.farm.domain.Farm;
import com.mifinca.backend.modules.farm.domain.FarmAccessLevel;
import com.mifinca.backend.modules.farm.domain.Lot;
import com.mifinca.backend.modules.farm.domain.UserFarmAccess;
import com.mifinca.backend.modules.farm.domain.UserFarmAccessId;
import com.mifinca.backend.modules.farm.infrastructure.persistence.FarmRepository;
import com.mifinca.backend.modules.farm.infrastructure.persistence.UserFarmAccessRepository;
import com.mifinca.backend.support.Fixtures;

import jakarta.persistence.EntityNotFoundException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OwnershipResolverTest {

    @Mock
    private FarmRepository farmRepository;

    @Mock
    private UserFarmAccessRepository userFarmAccessRepository;

    private OwnershipResolver resolver;

    private AppUser owner;
    private AppUser worker;
    private AppUser stranger;
    private Farm farm;
    private Lot lot;

    @BeforeEach
    void setUp() {
        resolver = new OwnershipResolver(farmRepository, userFarmAccessRepository);
        owner = Fixtures.user("owner@finca.test");
        worker = Fixtures.user("worker@finca.test");
        stranger = Fixtures.user("stranger@finca.test");
        farm = Fixtures.farm("La Esperanza", owner);
        lot = Fixtures.lot("Potrero 1", farm);
    }

    @Test
    @DisplayName("farm owner is reported as owner")
    void farmOwner() {
        FarmAccessFacts facts = resolver.resolveFarmAccess(Fixtures.actor(owner), farm);

        assertThat(facts.owner()).isTrue();
        assertThat(facts.sharedAccess()).isFalse();
    }

    @Test
    @DisplayName("a grant row gives shared access to the farm and its lots")
    void grantGivesSharedAccess() {
        when(userFarmAccessRepository.existsById(new UserFarmAccessId(worker.getId(), farm.getId()))).thenReturn(true);

        FarmAccessFacts lotFacts = resolver.resolveLotAccess(Fixtures.actor(worker), lot);

        assertThat(lotFacts.owner()).isFalse();
        assertThat(lotFacts.sharedAccess()).isTrue();
    }

    @Test
    @DisplayName("animal owner has access even when the animal sits in someone else's farm")
    void animalOwnerWins() {
        AppUser neighbour = Fixtures.user("neighbour@finca.test");
        Animal animal = Fixtures.animal("COW-1", neighbour, lot);

        AnimalAccessFacts facts = resolver.resolveAnimalAccess(Fixtures.actor(neighbour), animal);

        assertThat(facts.owner()).isTrue();
        assertThat(facts.farmAccess()).isFalse();
    }

    @Test
    @DisplayName("farm owner reaches animals of other owners placed in the farm's lots")
    void farmOwnerReachesPlacedAnimals() {
        AppUser neighbour = Fixtures.user("neighbour@finca.test");
        Animal animal = Fixtures.animal("COW-2", neighbour, lot);

        AnimalAccessFacts facts = resolver.resolveAnimalAccess(Fixtures.actor(owner), animal);

        assertThat(facts.owner()).isFalse();
        assertThat(facts.farmAccess()).isTrue();
    }

    @Test
    @DisplayName("an animal outside any lot is visible to its owner only")
    void unplacedAnimal() {
        Animal animal = Fixtures.animal("COW-3", owner, null);

        assertThat(resolver.resolveAnimalAccess(Fixtures.actor(stranger), animal).any()).isFalse();
        assertThat(resolver.resolveAnimalAccess(Fixtures.actor(owner), animal).owner()).isTrue();
    }

    @Test
    @DisplayName("dangling parent reference yields no access instead of an error")
    void danglingParentFailsClosed() {
        Lot brokenLot = mock(Lot.class);
        when(brokenLot.getFarm()).thenThrow(new EntityNotFoundException("farm gone"));
        Animal animal = Fixtures.animal("COW-4", owner, brokenLot);

        AnimalAccessFacts facts = resolver.resolveAnimalAccess(Fixtures.actor(stranger), animal);

        assertThat(facts).isEqualTo(AnimalAccessFacts.NONE);
    }

    @Test
    @DisplayName("lot without a farm yields no access")
    void lotWithoutFarm() {
        Lot orphan = Fixtures.lot("Huerfano", null);

        assertThat(resolver.resolveLotAccess(Fixtures.actor(owner), orphan)).isEqualTo(FarmAccessFacts.NONE);
    }

    @Test
    @DisplayName("missing farm id resolves to no access")
    void missingFarmId() {
        UUID missing = UUID.randomUUID();
        when(farmRepository.findById(missing)).thenReturn(Optional.empty());

        assertThat(resolver.resolveFarmAccess(Fixtures.actor(owner), missing)).isEqualTo(FarmAccessFacts.NONE);
        assertThat(resolver.resolveFarmAccess(Fixtures.actor(owner), (UUID) null)).isEqualTo(FarmAccessFacts.NONE);
    }

    @Test
    @DisplayName("grupos are visible to their creator only, farm grants do not extend to them")
    void grupoCreatorOnly() {
        Grupo grupo = Fixtures.grupo("Novillas", owner);

        assertThat(resolver.resolveGrupoAccess(Fixtures.actor(owner), grupo)).isTrue();
        assertThat(resolver.resolveGrupoAccess(Fixtures.actor(worker), grupo)).isFalse();
    }

    @Test
    @DisplayName("event access follows the recorder or any affected animal")
    void eventAccess() {
        when(userFarmAccessRepository.existsById(new UserFarmAccessId(worker.getId(), farm.getId()))).thenReturn(true);
        Animal placed = Fixtures.animal("COW-5", owner, lot);
        Animal elsewhere = Fixtures.animal("COW-6", stranger, null);
        AnimalScopedRecord record = record(stranger.getId(), List.of(elsewhere, placed));

        assertThat(resolver.resolveEventAccess(Fixtures.actor(stranger), record)).isTrue();
        assertThat(resolver.resolveEventAccess(Fixtures.actor(worker), record)).isTrue();

        AccessFacts facts = resolver.eventFacts(Fixtures.actor(worker), record);
        assertThat(facts.owner()).isFalse();
        assertThat(facts.sharedAccess()).isTrue();
    }

    @Test
    @DisplayName("event with no reachable animal is hidden from non-recorders")
    void eventWithoutReachableAnimal() {
        Animal elsewhere = Fixtures.animal("COW-7", stranger, null);
        AnimalScopedRecord record = record(stranger.getId(), List.of(elsewhere));

        assertThat(resolver.resolveEventAccess(Fixtures.actor(owner), record)).isFalse();
    }

    @Test
    @DisplayName("grant facts distinguish farm owner, grantee and grantor")
    void grantFacts() {
        AppUser foreman = Fixtures.user("foreman@finca.test");
        UserFarmAccess grant = new UserFarmAccess(worker, farm, FarmAccessLevel.VIEW, foreman);

        AccessFacts ownerFacts = resolver.grantFacts(Fixtures.actor(owner), grant);
        AccessFacts granteeFacts = resolver.grantFacts(Fixtures.actor(worker), grant);
        AccessFacts grantorFacts = resolver.grantFacts(Fixtures.actor(foreman), grant);

        assertThat(ownerFacts.owner()).isTrue();
        assertThat(granteeFacts.sharedAccess()).isTrue();
        assertThat(granteeFacts.owner()).isFalse();
        assertThat(grantorFacts.delegator()).isTrue();
        assertThat(grantorFacts.owner()).isFalse();
    }

    @Test
    @DisplayName("accessible farm ids merge owned and shared farms")
    void accessibleFarmIds() {
        UUID sharedFarm = UUID.randomUUID();
        when(farmRepository.findIdsByOwnerId(owner.getId())).thenReturn(List.of(farm.getId()));
        when(userFarmAccessRepository.findFarmIdsByUserId(owner.getId())).thenReturn(List.of(sharedFarm, farm.getId()));

        Set<UUID> ids = resolver.resolveAccessibleFarmIds(Fixtures.actor(owner));

        assertThat(ids).containsExactly(farm.getId(), sharedFarm);
    }

    @Test
    @DisplayName("farm id filter is never empty")
    void farmIdFilterNeverEmpty() {
        when(farmRepository.findIdsByOwnerId(stranger.getId())).thenReturn(List.of());
        when(userFarmAccessRepository.findFarmIdsByUserId(stranger.getId())).thenReturn(List.of());

        Set<UUID> filter = resolver.farmIdFilter(Fixtures.actor(stranger));

        assertThat(filter).containsExactly(new UUID(0L, 0L));
    }

    @Test
    @DisplayName("revoking the grant removes access to the farm's animals")
    void revokedGrant() {
        Animal animal = Fixtures.animal("COW-8", owner, lot);
        Actor actor = Fixtures.actor(worker);
        UserFarmAccessId grantId = new UserFarmAccessId(worker.getId(), farm.getId());
        when(userFarmAccessRepository.existsById(grantId)).thenReturn(true, false);

        assertThat(resolver.resolveAnimalAccess(actor, animal).farmAccess()).isTrue();
        assertThat(resolver.resolveAnimalAccess(actor, animal).any()).isFalse();
    }

    private static AnimalScopedRecord record(UUID recorderId, Collection<Animal> animals) {
        return new AnimalScopedRecord() {
            @Override
            public UUID getRecorderId() {
                return recorderId;
            }

            @Override
            public Collection<Animal> getAffectedAnimals() {
                return animals;
            }
        };
    }
}
