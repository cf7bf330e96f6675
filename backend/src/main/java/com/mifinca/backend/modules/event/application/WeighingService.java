package com.mifinca.backend.modules.event.application;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.application.OwnershipResolver;
import com.mifinca.backend.modules.access.domain.AccessOperation;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.animal.domain.Animal;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.event.domain.Weighing;
import com.mifinca.backend.modules.event.infrastructure.persistence.WeighingRepository;
import com.mifinca.backend.modules.event.presentation.dto.WeighingRequest;
import com.mifinca.backend.modules.event.presentation.dto.WeighingResponse;
import com.mifinca.backend.modules.masterdata.application.MasterDataLookup;
import com.mifinca.backend.modules.masterdata.domain.MasterData;
import com.mifinca.backend.modules.masterdata.domain.MasterDataCategory;

import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class WeighingService {

    private final WeighingRepository weighingRepository;
    private final EventAnimals eventAnimals;
    private final MasterDataLookup masterDataLookup;
    private final CurrentActorService currentActorService;
    private final OwnershipResolver ownershipResolver;
    private final AccessGuard accessGuard;

    public WeighingService(
            WeighingRepository weighingRepository,
            EventAnimals eventAnimals,
            MasterDataLookup masterDataLookup,
            CurrentActorService currentActorService,
            OwnershipResolver ownershipResolver,
            AccessGuard accessGuard
    ) {
        this.weighingRepository = weighingRepository;
        this.eventAnimals = eventAnimals;
        this.masterDataLookup = masterDataLookup;
        this.currentActorService = currentActorService;
        this.ownershipResolver = ownershipResolver;
        this.accessGuard = accessGuard;
    }

    public WeighingResponse createWeighing(WeighingRequest request) {
        Actor actor = currentActorService.requireActor();
        Animal animal = eventAnimals.load(request.animalId());
        MasterData unit = masterDataLookup.optionalCategory(request.unitId(), MasterDataCategory.UNIT);
        accessGuard.requireAnimal(actor, animal, AccessOperation.WRITE);

        Weighing weighing = new Weighing();
        weighing.setRecordedBy(currentActorService.reference(actor));
        weighing.setAnimal(animal);
        apply(weighing, request, unit);
        return WeighingResponse.from(weighingRepository.save(weighing));
    }

    @Transactional(readOnly = true)
    public WeighingResponse getWeighing(UUID weighingId) {
        Actor actor = currentActorService.requireActor();
        Weighing weighing = loadWeighing(weighingId);
        accessGuard.requireEvent(actor, weighing, weighing.getId(), AccessOperation.READ);
        return WeighingResponse.from(weighing);
    }

    /**
     * With an animal id, that animal's weight curve; it requires read access to the animal.
     */
    @Transactional(readOnly = true)
    public List<WeighingResponse> listWeighings(UUID animalId) {
        Actor actor = currentActorService.requireActor();
        List<Weighing> weighings;
        if (animalId != null) {
            Animal animal = eventAnimals.load(animalId);
            accessGuard.requireAnimal(actor, animal, AccessOperation.READ);
            weighings = weighingRepository.findByAnimal_IdOrderByWeighingDateDesc(animalId);
        } else if (actor.superuser()) {
            weighings = weighingRepository.findAll(Sort.by(Sort.Direction.DESC, "weighingDate"));
        } else {
            weighings = weighingRepository.findVisible(actor.userId(), ownershipResolver.farmIdFilter(actor));
        }
        return weighings.stream().map(WeighingResponse::from).toList();
    }

    public WeighingResponse updateWeighing(UUID weighingId, WeighingRequest request) {
        Actor actor = currentActorService.requireActor();
        Weighing weighing = loadWeighing(weighingId);
        Animal animal = eventAnimals.load(request.animalId());
        MasterData unit = masterDataLookup.optionalCategory(request.unitId(), MasterDataCategory.UNIT);
        accessGuard.requireEvent(actor, weighing, weighing.getId(), AccessOperation.WRITE);
        if (!animal.getId().equals(weighing.getAnimal().getId())) {
            accessGuard.requireAnimal(actor, animal, AccessOperation.WRITE);
            weighing.setAnimal(animal);
        }

        apply(weighing, request, unit);
        return WeighingResponse.from(weighingRepository.save(weighing));
    }

    public void deleteWeighing(UUID weighingId) {
        Actor actor = currentActorService.requireActor();
        Weighing weighing = loadWeighing(weighingId);
        accessGuard.requireEvent(actor, weighing, weighing.getId(), AccessOperation.DELETE);
        weighingRepository.delete(weighing);
    }

    private void apply(Weighing weighing, WeighingRequest request, MasterData unit) {
        weighing.setWeighingDate(request.weighingDate());
        weighing.setWeight(request.weight());
        weighing.setUnit(unit);
        weighing.setNotes(request.notes());
    }

    private Weighing loadWeighing(UUID weighingId) {
        return weighingRepository.findById(weighingId)
                .orElseThrow(() -> ProblemException.notFound("WEIGHING_NOT_FOUND"));
    }
}
