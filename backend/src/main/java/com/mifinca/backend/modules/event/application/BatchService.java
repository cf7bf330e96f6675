package com.mifinca.backend.modules.event.application;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.application.OwnershipResolver;
import com.mifinca.backend.modules.access.domain.AccessOperation;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.access.domain.ResourcePolicy;
import com.mifinca.backend.modules.animal.domain.Animal;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.event.domain.Batch;
import com.mifinca.backend.modules.event.infrastructure.persistence.BatchRepository;
import com.mifinca.backend.modules.event.presentation.dto.BatchRequest;
import com.mifinca.backend.modules.event.presentation.dto.BatchResponse;
import com.mifinca.backend.modules.farm.domain.Farm;
import com.mifinca.backend.modules.farm.infrastructure.persistence.FarmRepository;
import com.mifinca.backend.modules.masterdata.application.MasterDataLookup;
import com.mifinca.backend.modules.masterdata.domain.MasterData;
import com.mifinca.backend.modules.masterdata.domain.MasterDataCategory;

import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class BatchService {

    private final BatchRepository batchRepository;
    private final FarmRepository farmRepository;
    private final EventAnimals eventAnimals;
    private final MasterDataLookup masterDataLookup;
    private final CurrentActorService currentActorService;
    private final OwnershipResolver ownershipResolver;
    private final AccessGuard accessGuard;

    public BatchService(
            BatchRepository batchRepository,
            FarmRepository farmRepository,
            EventAnimals eventAnimals,
            MasterDataLookup masterDataLookup,
            CurrentActorService currentActorService,
            OwnershipResolver ownershipResolver,
            AccessGuard accessGuard
    ) {
        this.batchRepository = batchRepository;
        this.farmRepository = farmRepository;
        this.eventAnimals = eventAnimals;
        this.masterDataLookup = masterDataLookup;
        this.currentActorService = currentActorService;
        this.ownershipResolver = ownershipResolver;
        this.accessGuard = accessGuard;
    }

    public BatchResponse createBatch(BatchRequest request) {
        Actor actor = currentActorService.requireActor();
        Farm farm = loadFarm(request.farmId());
        List<Animal> animals = eventAnimals.loadAll(request.animalIdsOrEmpty());
        MasterData batchType = masterDataLookup.requireCategory(request.batchTypeId(), MasterDataCategory.BATCH_TYPE);
        requireFarmAccess(actor, farm);
        eventAnimals.requireWritable(actor, animals);

        Batch batch = new Batch();
        batch.setCreatedBy(currentActorService.reference(actor));
        apply(batch, request, farm, batchType);
        batch.replaceAnimals(animals);
        return BatchResponse.from(batchRepository.save(batch));
    }

    @Transactional(readOnly = true)
    public BatchResponse getBatch(UUID batchId) {
        Actor actor = currentActorService.requireActor();
        Batch batch = loadBatch(batchId);
        accessGuard.requireBatch(actor, batch, AccessOperation.READ);
        return BatchResponse.from(batch);
    }

    @Transactional(readOnly = true)
    public List<BatchResponse> listBatches() {
        Actor actor = currentActorService.requireActor();
        List<Batch> batches = actor.superuser()
                ? batchRepository.findAll(Sort.by("name"))
                : batchRepository.findVisible(actor.userId(), ownershipResolver.farmIdFilter(actor));
        return batches.stream().map(BatchResponse::from).toList();
    }

    public BatchResponse updateBatch(UUID batchId, BatchRequest request) {
        Actor actor = currentActorService.requireActor();
        Batch batch = loadBatch(batchId);
        Farm farm = loadFarm(request.farmId());
        List<Animal> animals = eventAnimals.loadAll(request.animalIdsOrEmpty());
        MasterData batchType = masterDataLookup.requireCategory(request.batchTypeId(), MasterDataCategory.BATCH_TYPE);
        accessGuard.requireBatch(actor, batch, AccessOperation.WRITE);
        if (!farm.getId().equals(batch.getFarm().getId())) {
            requireFarmAccess(actor, farm);
        }
        eventAnimals.requireWritable(actor, animals);

        apply(batch, request, farm, batchType);
        batch.replaceAnimals(animals);
        return BatchResponse.from(batchRepository.save(batch));
    }

    public void deleteBatch(UUID batchId) {
        Actor actor = currentActorService.requireActor();
        Batch batch = loadBatch(batchId);
        accessGuard.requireBatch(actor, batch, AccessOperation.DELETE);
        batchRepository.delete(batch);
    }

    /**
     * A batch can be opened on any farm the caller owns or has been granted.
     */
    private void requireFarmAccess(Actor actor, Farm farm) {
        accessGuard.requireFarmScope(actor, farm, ResourcePolicy.BATCH, AccessOperation.READ);
    }

    private void apply(Batch batch, BatchRequest request, Farm farm, MasterData batchType) {
        batch.setName(request.name().trim());
        batch.setBatchType(batchType);
        batch.setFarm(farm);
        batch.setDescription(request.description());
    }

    private Farm loadFarm(UUID farmId) {
        return farmRepository.findById(farmId)
                .orElseThrow(() -> ProblemException.notFound("FARM_NOT_FOUND"));
    }

    private Batch loadBatch(UUID batchId) {
        return batchRepository.findById(batchId)
                .orElseThrow(() -> ProblemException.notFound("BATCH_NOT_FOUND"));
    }
}
