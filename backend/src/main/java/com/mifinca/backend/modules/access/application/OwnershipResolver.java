package com.mifinca.backend.modules.access.application;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

import com.mifinca.backend.modules.access.domain.AccessFacts;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.access.domain.AnimalAccessFacts;
import com.mifinca.backend.modules.access.domain.AnimalScopedRecord;
import com.mifinca.backend.modules.access.domain.FarmAccessFacts;
import com.mifinca.backend.modules.animal.domain.Animal;
import com.mifinca.backend.modules.animal.domain.Grupo;
import com.mifinca.backend.modules.event.domain.Batch;
import com.mifinca.backend.modules.event.domain.Transaction;
import com.mifinca.backend.modules.farm.domain.Farm;
import com.mifinca.backend.modules.farm.domain.Lot;
import com.mifinca.backend.modules.farm.domain.Product;
import com.mifinca.backend.modules.farm.domain.UserFarmAccess;
import com.mifinca.backend.modules.farm.domain.UserFarmAccessId;
import com.mifinca.backend.modules.farm.infrastructure.persistence.FarmRepository;
import com.mifinca.backend.modules.farm.infrastructure.persistence.UserFarmAccessRepository;

import jakarta.persistence.EntityNotFoundException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Walks the entity graph (animal, lot, farm, grant) and reports access facts. It never decides;
 * see {@link AccessDecisionEngine}.
 *
 * <p>A parent that cannot be loaded (deleted under a concurrent request, or a broken reference)
 * yields "no access" instead of an error.
 */
@Component
public class OwnershipResolver {

    private static final Logger log = LoggerFactory.getLogger(OwnershipResolver.class);

    private static final UUID NO_FARM = new UUID(0L, 0L);

    private final FarmRepository farmRepository;
    private final UserFarmAccessRepository userFarmAccessRepository;

    public OwnershipResolver(FarmRepository farmRepository, UserFarmAccessRepository userFarmAccessRepository) {
        this.farmRepository = farmRepository;
        this.userFarmAccessRepository = userFarmAccessRepository;
    }

    public FarmAccessFacts resolveFarmAccess(Actor actor, Farm farm) {
        if (farm == null) {
            return FarmAccessFacts.NONE;
        }
        return failClosed(FarmAccessFacts.NONE, "farm", farm.getId(), () -> {
            boolean owner = actor.is(farm.getOwnerId());
            boolean shared = userFarmAccessRepository.existsById(new UserFarmAccessId(actor.userId(), farm.getId()));
            return new FarmAccessFacts(owner, shared);
        });
    }

    public FarmAccessFacts resolveFarmAccess(Actor actor, UUID farmId) {
        if (farmId == null) {
            return FarmAccessFacts.NONE;
        }
        return farmRepository.findById(farmId)
                .map(farm -> resolveFarmAccess(actor, farm))
                .orElseGet(() -> {
                    log.warn("Farm {} referenced but missing, denying access for user {}", farmId, actor.userId());
                    return FarmAccessFacts.NONE;
                });
    }

    public FarmAccessFacts resolveLotAccess(Actor actor, Lot lot) {
        if (lot == null) {
            return FarmAccessFacts.NONE;
        }
        return failClosed(FarmAccessFacts.NONE, "lot", lot.getId(), () -> {
            Farm farm = lot.getFarm();
            if (farm == null) {
                log.warn("Lot {} has no farm, denying access for user {}", lot.getId(), actor.userId());
                return FarmAccessFacts.NONE;
            }
            return resolveFarmAccess(actor, farm);
        });
    }

    public AnimalAccessFacts resolveAnimalAccess(Actor actor, Animal animal) {
        if (actor.is(animal.getOwnerId())) {
            return new AnimalAccessFacts(true, false);
        }
        return failClosed(AnimalAccessFacts.NONE, "animal", animal.getId(), () -> {
            Lot lot = animal.getCurrentLot();
            if (lot == null) {
                return AnimalAccessFacts.NONE;
            }
            return new AnimalAccessFacts(false, resolveLotAccess(actor, lot).any());
        });
    }

    /**
     * Farms the actor owns plus farms shared with the actor. Used to filter list queries in one pass.
     */
    public Set<UUID> resolveAccessibleFarmIds(Actor actor) {
        Set<UUID> farmIds = new LinkedHashSet<>(farmRepository.findIdsByOwnerId(actor.userId()));
        farmIds.addAll(userFarmAccessRepository.findFarmIdsByUserId(actor.userId()));
        return farmIds;
    }

    /**
     * {@link #resolveAccessibleFarmIds} for binding to an {@code in} clause: never empty, a nil id
     * stands in for "no farms".
     */
    public Set<UUID> farmIdFilter(Actor actor) {
        Set<UUID> farmIds = resolveAccessibleFarmIds(actor);
        return farmIds.isEmpty() ? Set.of(NO_FARM) : farmIds;
    }

    public boolean resolveEventAccess(Actor actor, AnimalScopedRecord record) {
        if (actor.is(record.getRecorderId())) {
            return true;
        }
        return hasAnyAnimalAccess(actor, record);
    }

    public boolean resolveGrupoAccess(Actor actor, Grupo grupo) {
        return actor.is(grupo.getCreatedById());
    }

    public AccessFacts farmFacts(Actor actor, Farm farm) {
        FarmAccessFacts facts = resolveFarmAccess(actor, farm);
        return AccessFacts.of(actor, facts.owner(), facts.sharedAccess());
    }

    public AccessFacts lotFacts(Actor actor, Lot lot) {
        FarmAccessFacts facts = resolveLotAccess(actor, lot);
        return AccessFacts.of(actor, facts.owner(), facts.sharedAccess());
    }

    public AccessFacts productFacts(Actor actor, Product product) {
        FarmAccessFacts facts = failClosed(FarmAccessFacts.NONE, "product", product.getId(),
                () -> resolveFarmAccess(actor, product.getFarm()));
        return AccessFacts.of(actor, facts.owner(), facts.sharedAccess());
    }

    public AccessFacts animalFacts(Actor actor, Animal animal) {
        AnimalAccessFacts facts = resolveAnimalAccess(actor, animal);
        return AccessFacts.of(actor, facts.owner(), facts.farmAccess());
    }

    public AccessFacts grupoFacts(Actor actor, Grupo grupo) {
        return AccessFacts.of(actor, resolveGrupoAccess(actor, grupo), false);
    }

    public AccessFacts eventFacts(Actor actor, AnimalScopedRecord record) {
        boolean recorder = actor.is(record.getRecorderId());
        boolean animalAccess = !recorder && hasAnyAnimalAccess(actor, record);
        return AccessFacts.of(actor, recorder, animalAccess);
    }

    /**
     * Farm access on the batch's farm counts as ownership of the batch. Recording it, or access to
     * any animal in it, only opens it for reading.
     */
    public AccessFacts batchFacts(Actor actor, Batch batch) {
        FarmAccessFacts farmAccess = failClosed(FarmAccessFacts.NONE, "batch", batch.getId(),
                () -> resolveFarmAccess(actor, batch.getFarm()));
        boolean eventAccess = resolveEventAccess(actor, batch);
        return AccessFacts.of(actor, farmAccess.any(), eventAccess);
    }

    public AccessFacts transactionFacts(Actor actor, Transaction transaction) {
        return AccessFacts.of(actor, actor.is(transaction.getFromOwnerId()), actor.is(transaction.getToOwnerId()));
    }

    public AccessFacts grantFacts(Actor actor, UserFarmAccess grant) {
        boolean farmOwner = resolveFarmAccess(actor, grant.getFarm()).owner();
        boolean grantee = actor.is(grant.getId().getUserId());
        boolean delegator = grant.getAssignedBy() != null && actor.is(grant.getAssignedBy().getId());
        return AccessFacts.forGrant(actor, farmOwner, grantee, delegator);
    }

    private boolean hasAnyAnimalAccess(Actor actor, AnimalScopedRecord record) {
        for (Animal animal : record.getAffectedAnimals()) {
            if (resolveAnimalAccess(actor, animal).any()) {
                return true;
            }
        }
        return false;
    }

    private <T> T failClosed(T denied, String kind, UUID id, Supplier<T> resolution) {
        try {
            return resolution.get();
        } catch (EntityNotFoundException ex) {
            log.warn("Dangling parent reference while resolving {} {}, denying access: {}", kind, id, ex.getMessage());
            return denied;
        }
    }
}
