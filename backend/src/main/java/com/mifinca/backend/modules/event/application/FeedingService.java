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
import com.mifinca.backend.modules.event.domain.Feeding;
import com.mifinca.backend.modules.event.infrastructure.persistence.FeedingRepository;
import com.mifinca.backend.modules.event.presentation.dto.FeedingRequest;
import com.mifinca.backend.modules.event.presentation.dto.FeedingResponse;
import com.mifinca.backend.modules.masterdata.application.MasterDataLookup;
import com.mifinca.backend.modules.masterdata.domain.MasterData;
import com.mifinca.backend.modules.masterdata.domain.MasterDataCategory;

import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class FeedingService {

    private final FeedingRepository feedingRepository;
    private final EventAnimals eventAnimals;
    private final MasterDataLookup masterDataLookup;
    private final CurrentActorService currentActorService;
    private final OwnershipResolver ownershipResolver;
    private final AccessGuard accessGuard;

    public FeedingService(
            FeedingRepository feedingRepository,
            EventAnimals eventAnimals,
            MasterDataLookup masterDataLookup,
            CurrentActorService currentActorService,
            OwnershipResolver ownershipResolver,
            AccessGuard accessGuard
    ) {
        this.feedingRepository = feedingRepository;
        this.eventAnimals = eventAnimals;
        this.masterDataLookup = masterDataLookup;
        this.currentActorService = currentActorService;
        this.ownershipResolver = ownershipResolver;
        this.accessGuard = accessGuard;
    }

    public FeedingResponse createFeeding(FeedingRequest request) {
        Actor actor = currentActorService.requireActor();
        List<Animal> animals = eventAnimals.loadAll(request.animalIds());
        MasterData feedType = masterDataLookup.requireCategory(request.feedTypeId(), MasterDataCategory.FEED_TYPE);
        MasterData unit = masterDataLookup.optionalCategory(request.unitId(), MasterDataCategory.UNIT);
        eventAnimals.requireWritable(actor, animals);

        Feeding feeding = new Feeding();
        feeding.setRecordedBy(currentActorService.reference(actor));
        apply(feeding, request, feedType, unit);
        feeding.replaceAnimals(animals);
        return FeedingResponse.from(feedingRepository.save(feeding));
    }

    @Transactional(readOnly = true)
    public FeedingResponse getFeeding(UUID feedingId) {
        Actor actor = currentActorService.requireActor();
        Feeding feeding = loadFeeding(feedingId);
        accessGuard.requireEvent(actor, feeding, feeding.getId(), AccessOperation.READ);
        return FeedingResponse.from(feeding);
    }

    @Transactional(readOnly = true)
    public List<FeedingResponse> listFeedings() {
        Actor actor = currentActorService.requireActor();
        List<Feeding> feedings = actor.superuser()
                ? feedingRepository.findAll(Sort.by(Sort.Direction.DESC, "feedingDate"))
                : feedingRepository.findVisible(actor.userId(), ownershipResolver.farmIdFilter(actor));
        return feedings.stream().map(FeedingResponse::from).toList();
    }

    public FeedingResponse updateFeeding(UUID feedingId, FeedingRequest request) {
        Actor actor = currentActorService.requireActor();
        Feeding feeding = loadFeeding(feedingId);
        List<Animal> animals = eventAnimals.loadAll(request.animalIds());
        MasterData feedType = masterDataLookup.requireCategory(request.feedTypeId(), MasterDataCategory.FEED_TYPE);
        MasterData unit = masterDataLookup.optionalCategory(request.unitId(), MasterDataCategory.UNIT);
        accessGuard.requireEvent(actor, feeding, feeding.getId(), AccessOperation.WRITE);
        eventAnimals.requireWritable(actor, animals);

        apply(feeding, request, feedType, unit);
        feeding.replaceAnimals(animals);
        return FeedingResponse.from(feedingRepository.save(feeding));
    }

    public void deleteFeeding(UUID feedingId) {
        Actor actor = currentActorService.requireActor();
        Feeding feeding = loadFeeding(feedingId);
        accessGuard.requireEvent(actor, feeding, feeding.getId(), AccessOperation.DELETE);
        feedingRepository.delete(feeding);
    }

    private void apply(Feeding feeding, FeedingRequest request, MasterData feedType, MasterData unit) {
        feeding.setFeedType(feedType);
        feeding.setFeedingDate(request.feedingDate());
        feeding.setQuantity(request.quantity());
        feeding.setUnit(unit);
        feeding.setNotes(request.notes());
    }

    private Feeding loadFeeding(UUID feedingId) {
        return feedingRepository.findById(feedingId)
                .orElseThrow(() -> ProblemException.notFound("FEEDING_NOT_FOUND"));
    }
}
