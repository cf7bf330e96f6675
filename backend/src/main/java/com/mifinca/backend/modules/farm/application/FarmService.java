package com.mifinca.backend.modules.farm.application;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.application.OwnershipResolver;
import com.mifinca.backend.modules.access.domain.AccessOperation;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.animal.infrastructure.persistence.AnimalRepository;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.farm.domain.Farm;
import com.mifinca.backend.modules.farm.infrastructure.persistence.FarmRepository;
import com.mifinca.backend.modules.farm.presentation.dto.FarmRequest;
import com.mifinca.backend.modules.farm.presentation.dto.FarmResponse;
import com.mifinca.backend.modules.rbac.application.PermissionEvaluator;
import com.mifinca.backend.modules.rbac.application.PermissionNames;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class FarmService {

    private static final Logger log = LoggerFactory.getLogger(FarmService.class);

    private final FarmRepository farmRepository;
    private final AnimalRepository animalRepository;
    private final CurrentActorService currentActorService;
    private final OwnershipResolver ownershipResolver;
    private final AccessGuard accessGuard;
    private final PermissionEvaluator permissionEvaluator;

    public FarmService(
            FarmRepository farmRepository,
            AnimalRepository animalRepository,
            CurrentActorService currentActorService,
            OwnershipResolver ownershipResolver,
            AccessGuard accessGuard,
            PermissionEvaluator permissionEvaluator
    ) {
        this.farmRepository = farmRepository;
        this.animalRepository = animalRepository;
        this.currentActorService = currentActorService;
        this.ownershipResolver = ownershipResolver;
        this.accessGuard = accessGuard;
        this.permissionEvaluator = permissionEvaluator;
    }

    public FarmResponse createFarm(FarmRequest request) {
        Actor actor = currentActorService.requireActor();
        Farm farm = new Farm();
        farm.setOwner(currentActorService.reference(actor));
        apply(farm, request);
        Farm saved = farmRepository.save(farm);
        log.info("Farm {} created by {}", saved.getId(), actor.userId());
        return FarmResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public FarmResponse getFarm(UUID farmId) {
        Actor actor = currentActorService.requireActor();
        Farm farm = loadFarm(farmId);
        accessGuard.requireFarm(actor, farm, AccessOperation.READ);
        return FarmResponse.from(farm);
    }

    /**
     * Farms the caller owns or has been granted access to.
     */
    @Transactional(readOnly = true)
    public List<FarmResponse> listFarms() {
        Actor actor = currentActorService.requireActor();
        Set<UUID> farmIds = ownershipResolver.resolveAccessibleFarmIds(actor);
        if (farmIds.isEmpty()) {
            return List.of();
        }
        return farmRepository.findByIdInOrderByNameAsc(farmIds).stream()
                .map(FarmResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<FarmResponse> listAllFarms() {
        Actor actor = currentActorService.requireActor();
        if (!permissionEvaluator.hasPermission(actor, PermissionNames.FARM_READ_ALL)) {
            throw ProblemException.forbidden();
        }
        return farmRepository.findAllByOrderByNameAsc().stream()
                .map(FarmResponse::from)
                .toList();
    }

    public FarmResponse updateFarm(UUID farmId, FarmRequest request) {
        Actor actor = currentActorService.requireActor();
        Farm farm = loadFarm(farmId);
        accessGuard.requireFarm(actor, farm, AccessOperation.WRITE);
        apply(farm, request);
        return FarmResponse.from(farmRepository.save(farm));
    }

    /**
     * Grants, lots, products and batches go with the farm (storage cascade). Animals stay with their
     * owners and lose their lot.
     */
    public void deleteFarm(UUID farmId) {
        Actor actor = currentActorService.requireActor();
        Farm farm = loadFarm(farmId);
        accessGuard.requireFarm(actor, farm, AccessOperation.DELETE);

        int detached = animalRepository.detachFromFarm(farmId);
        farmRepository.delete(farm);
        log.info("Farm {} deleted by {} ({} animals detached)", farmId, actor.userId(), detached);
    }

    private Farm loadFarm(UUID farmId) {
        return farmRepository.findById(farmId)
                .orElseThrow(() -> ProblemException.notFound("FARM_NOT_FOUND"));
    }

    private void apply(Farm farm, FarmRequest request) {
        farm.setName(request.name().trim());
        farm.setLocation(request.location());
        farm.setAreaHectares(request.areaHectares());
    }
}
