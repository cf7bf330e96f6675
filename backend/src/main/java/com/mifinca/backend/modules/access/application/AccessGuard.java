package com.mifinca.backend.modules.access.application;

import java.util.UUID;

import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.domain.AccessFacts;
import com.mifinca.backend.modules.access.domain.AccessOperation;
import com.mifinca.backend.modules.access.domain.AccessVerdict;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.access.domain.AnimalScopedRecord;
import com.mifinca.backend.modules.access.domain.ResourcePolicy;
import com.mifinca.backend.modules.animal.domain.Animal;
import com.mifinca.backend.modules.animal.domain.Grupo;
import com.mifinca.backend.modules.event.domain.Batch;
import com.mifinca.backend.modules.event.domain.Transaction;
import com.mifinca.backend.modules.farm.domain.Farm;
import com.mifinca.backend.modules.farm.domain.Lot;
import com.mifinca.backend.modules.farm.domain.Product;
import com.mifinca.backend.modules.farm.domain.UserFarmAccess;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Single entry point the entity services use before touching a resource. Callers load the target
 * first, so a missing entity surfaces as not-found before any access check runs.
 */
@Component
public class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    private final OwnershipResolver ownershipResolver;
    private final AccessDecisionEngine decisionEngine;

    public AccessGuard(OwnershipResolver ownershipResolver, AccessDecisionEngine decisionEngine) {
        this.ownershipResolver = ownershipResolver;
        this.decisionEngine = decisionEngine;
    }

    public void requireFarm(Actor actor, Farm farm, AccessOperation operation) {
        enforce(actor, ResourcePolicy.FARM, ownershipResolver.farmFacts(actor, farm), operation, farm.getId());
    }

    /**
     * Evaluates a farm-anchored policy ({@code LOT}, {@code PRODUCT}) against the farm itself, for
     * listing or creating children of that farm.
     */
    public void requireFarmScope(Actor actor, Farm farm, ResourcePolicy policy, AccessOperation operation) {
        enforce(actor, policy, ownershipResolver.farmFacts(actor, farm), operation, farm.getId());
    }

    public void requireLot(Actor actor, Lot lot, AccessOperation operation) {
        enforce(actor, ResourcePolicy.LOT, ownershipResolver.lotFacts(actor, lot), operation, lot.getId());
    }

    public void requireProduct(Actor actor, Product product, AccessOperation operation) {
        enforce(actor, ResourcePolicy.PRODUCT, ownershipResolver.productFacts(actor, product), operation, product.getId());
    }

    public void requireAnimal(Actor actor, Animal animal, AccessOperation operation) {
        enforce(actor, ResourcePolicy.ANIMAL, ownershipResolver.animalFacts(actor, animal), operation, animal.getId());
    }

    /**
     * Placing an animal in a lot needs the same farm access that writing an animal in that lot needs.
     */
    public void requireLotPlacement(Actor actor, Lot lot) {
        enforce(actor, ResourcePolicy.ANIMAL, ownershipResolver.lotFacts(actor, lot), AccessOperation.WRITE, lot.getId());
    }

    public void requireLineage(Actor actor, Animal parent) {
        enforce(actor, ResourcePolicy.ANIMAL_LINEAGE, ownershipResolver.animalFacts(actor, parent),
                AccessOperation.WRITE, parent.getId());
    }

    public void requireGrupo(Actor actor, Grupo grupo, AccessOperation operation) {
        enforce(actor, ResourcePolicy.GRUPO, ownershipResolver.grupoFacts(actor, grupo), operation, grupo.getId());
    }

    public void requireEvent(Actor actor, AnimalScopedRecord record, UUID recordId, AccessOperation operation) {
        enforce(actor, ResourcePolicy.ANIMAL_EVENT, ownershipResolver.eventFacts(actor, record), operation, recordId);
    }

    public void requireBatch(Actor actor, Batch batch, AccessOperation operation) {
        enforce(actor, ResourcePolicy.BATCH, ownershipResolver.batchFacts(actor, batch), operation, batch.getId());
    }

    public void requireTransaction(Actor actor, Transaction transaction, AccessOperation operation) {
        enforce(actor, ResourcePolicy.TRANSACTION, ownershipResolver.transactionFacts(actor, transaction),
                operation, transaction.getId());
    }

    public void requireGrant(Actor actor, UserFarmAccess grant, AccessOperation operation) {
        enforce(actor, ResourcePolicy.FARM_ACCESS_GRANT, ownershipResolver.grantFacts(actor, grant),
                operation, grant.getId().getFarmId());
    }

    /**
     * For resources with no ownership anchor: rbac catalog and associations, user administration and
     * configuration parameters.
     */
    public void requireSuperuser(Actor actor, ResourcePolicy policy, AccessOperation operation) {
        enforce(actor, policy, AccessFacts.actorOnly(actor), operation, null);
    }

    public boolean canAccessAnimal(Actor actor, Animal animal, AccessOperation operation) {
        return decisionEngine.isAllowed(ResourcePolicy.ANIMAL, ownershipResolver.animalFacts(actor, animal), operation);
    }

    private void enforce(Actor actor, ResourcePolicy policy, AccessFacts facts, AccessOperation operation, UUID resourceId) {
        AccessVerdict verdict = decisionEngine.decide(policy, facts, operation);
        if (verdict.denied()) {
            log.debug("Denied {} on {} {} for user {}: {}",
                    operation, policy, resourceId, actor.userId(), verdict.reason());
            throw ProblemException.forbidden();
        }
    }
}
