package com.mifinca.backend.modules.farm.application;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.domain.AccessOperation;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.access.domain.ResourcePolicy;
import com.mifinca.backend.modules.animal.infrastructure.persistence.AnimalRepository;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.farm.domain.Farm;
import com.mifinca.backend.modules.farm.domain.Lot;
import com.mifinca.backend.modules.farm.infrastructure.persistence.FarmRepository;
import com.mifinca.backend.modules.farm.infrastructure.persistence.LotRepository;
import com.mifinca.backend.modules.farm.presentation.dto.LotRequest;
import com.mifinca.backend.modules.farm.presentation.dto.LotResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class LotService {

    private final LotRepository lotRepository;
    private final FarmRepository farmRepository;
    private final AnimalRepository animalRepository;
    private final CurrentActorService currentActorService;
    private final AccessGuard accessGuard;

    public LotService(
            LotRepository lotRepository,
            FarmRepository farmRepository,
            AnimalRepository animalRepository,
            CurrentActorService currentActorService,
            AccessGuard accessGuard
    ) {
        this.lotRepository = lotRepository;
        this.farmRepository = farmRepository;
        this.animalRepository = animalRepository;
        this.currentActorService = currentActorService;
        this.accessGuard = accessGuard;
    }

    public LotResponse createLot(LotRequest request) {
        Actor actor = currentActorService.requireActor();
        Farm farm = loadFarm(request.farmId());
        accessGuard.requireFarmScope(actor, farm, ResourcePolicy.LOT, AccessOperation.WRITE);

        Lot lot = new Lot();
        lot.setFarm(farm);
        lot.setCreatedBy(currentActorService.reference(actor));
        apply(lot, request);
        return LotResponse.from(lotRepository.save(lot));
    }

    @Transactional(readOnly = true)
    public LotResponse getLot(UUID lotId) {
        Actor actor = currentActorService.requireActor();
        Lot lot = loadLot(lotId);
        accessGuard.requireLot(actor, lot, AccessOperation.READ);
        return LotResponse.from(lot);
    }

    @Transactional(readOnly = true)
    public List<LotResponse> listLots(UUID farmId) {
        Actor actor = currentActorService.requireActor();
        Farm farm = loadFarm(farmId);
        accessGuard.requireFarmScope(actor, farm, ResourcePolicy.LOT, AccessOperation.READ);
        return lotRepository.findByFarm_IdOrderByNameAsc(farmId).stream()
                .map(LotResponse::from)
                .toList();
    }

    public LotResponse updateLot(UUID lotId, LotRequest request) {
        Actor actor = currentActorService.requireActor();
        Lot lot = loadLot(lotId);
        Farm targetFarm = lot.getFarm().getId().equals(request.farmId()) ? lot.getFarm() : loadFarm(request.farmId());
        accessGuard.requireLot(actor, lot, AccessOperation.WRITE);
        if (targetFarm != lot.getFarm()) {
            accessGuard.requireFarmScope(actor, targetFarm, ResourcePolicy.LOT, AccessOperation.WRITE);
            lot.setFarm(targetFarm);
        }
        apply(lot, request);
        return LotResponse.from(lotRepository.save(lot));
    }

    /**
     * Animals in the lot are kept and detached.
     */
    public void deleteLot(UUID lotId) {
        Actor actor = currentActorService.requireActor();
        Lot lot = loadLot(lotId);
        accessGuard.requireLot(actor, lot, AccessOperation.DELETE);

        animalRepository.detachFromLot(lotId);
        lotRepository.delete(lot);
    }

    private Lot loadLot(UUID lotId) {
        return lotRepository.findById(lotId)
                .orElseThrow(() -> ProblemException.notFound("LOT_NOT_FOUND"));
    }

    private Farm loadFarm(UUID farmId) {
        return farmRepository.findById(farmId)
                .orElseThrow(() -> ProblemException.notFound("FARM_NOT_FOUND"));
    }

    private void apply(Lot lot, LotRequest request) {
        lot.setName(request.name().trim());
        lot.setDescription(request.description());
        lot.setAreaHectares(request.areaHectares());
    }
}
