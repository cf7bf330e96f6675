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
import com.mifinca.backend.modules.event.domain.HealthEvent;
import com.mifinca.backend.modules.event.infrastructure.persistence.HealthEventRepository;
import com.mifinca.backend.modules.event.presentation.dto.HealthEventRequest;
import com.mifinca.backend.modules.event.presentation.dto.HealthEventResponse;
import com.mifinca.backend.modules.farm.domain.Product;
import com.mifinca.backend.modules.farm.infrastructure.persistence.ProductRepository;
import com.mifinca.backend.modules.masterdata.application.MasterDataLookup;
import com.mifinca.backend.modules.masterdata.domain.MasterData;
import com.mifinca.backend.modules.masterdata.domain.MasterDataCategory;

import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class HealthEventService {

    private final HealthEventRepository healthEventRepository;
    private final ProductRepository productRepository;
    private final EventAnimals eventAnimals;
    private final MasterDataLookup masterDataLookup;
    private final CurrentActorService currentActorService;
    private final OwnershipResolver ownershipResolver;
    private final AccessGuard accessGuard;

    public HealthEventService(
            HealthEventRepository healthEventRepository,
            ProductRepository productRepository,
            EventAnimals eventAnimals,
            MasterDataLookup masterDataLookup,
            CurrentActorService currentActorService,
            OwnershipResolver ownershipResolver,
            AccessGuard accessGuard
    ) {
        this.healthEventRepository = healthEventRepository;
        this.productRepository = productRepository;
        this.eventAnimals = eventAnimals;
        this.masterDataLookup = masterDataLookup;
        this.currentActorService = currentActorService;
        this.ownershipResolver = ownershipResolver;
        this.accessGuard = accessGuard;
    }

    public HealthEventResponse createHealthEvent(HealthEventRequest request) {
        Actor actor = currentActorService.requireActor();
        List<Animal> animals = eventAnimals.loadAll(request.animalIds());
        HealthEventReferences refs = resolveReferences(request);
        eventAnimals.requireWritable(actor, animals);
        requireProduct(actor, refs.product());

        HealthEvent event = new HealthEvent();
        event.setAdministeredBy(currentActorService.reference(actor));
        apply(event, request, refs);
        event.replaceAnimals(animals);
        return HealthEventResponse.from(healthEventRepository.save(event));
    }

    @Transactional(readOnly = true)
    public HealthEventResponse getHealthEvent(UUID healthEventId) {
        Actor actor = currentActorService.requireActor();
        HealthEvent event = loadEvent(healthEventId);
        accessGuard.requireEvent(actor, event, event.getId(), AccessOperation.READ);
        return HealthEventResponse.from(event);
    }

    @Transactional(readOnly = true)
    public List<HealthEventResponse> listHealthEvents() {
        Actor actor = currentActorService.requireActor();
        List<HealthEvent> events = actor.superuser()
                ? healthEventRepository.findAll(Sort.by(Sort.Direction.DESC, "eventDate"))
                : healthEventRepository.findVisible(actor.userId(), ownershipResolver.farmIdFilter(actor));
        return events.stream().map(HealthEventResponse::from).toList();
    }

    public HealthEventResponse updateHealthEvent(UUID healthEventId, HealthEventRequest request) {
        Actor actor = currentActorService.requireActor();
        HealthEvent event = loadEvent(healthEventId);
        List<Animal> animals = eventAnimals.loadAll(request.animalIds());
        HealthEventReferences refs = resolveReferences(request);
        accessGuard.requireEvent(actor, event, event.getId(), AccessOperation.WRITE);
        eventAnimals.requireWritable(actor, animals);
        requireProduct(actor, refs.product());

        apply(event, request, refs);
        event.replaceAnimals(animals);
        return HealthEventResponse.from(healthEventRepository.save(event));
    }

    public void deleteHealthEvent(UUID healthEventId) {
        Actor actor = currentActorService.requireActor();
        HealthEvent event = loadEvent(healthEventId);
        accessGuard.requireEvent(actor, event, event.getId(), AccessOperation.DELETE);
        healthEventRepository.delete(event);
    }

    private void requireProduct(Actor actor, Product product) {
        if (product != null) {
            accessGuard.requireProduct(actor, product, AccessOperation.READ);
        }
    }

    private HealthEventReferences resolveReferences(HealthEventRequest request) {
        Product product = request.productId() == null ? null : productRepository.findById(request.productId())
                .orElseThrow(() -> ProblemException.notFound("PRODUCT_NOT_FOUND"));
        return new HealthEventReferences(
                masterDataLookup.requireCategory(request.eventTypeId(), MasterDataCategory.HEALTH_EVENT_TYPE),
                masterDataLookup.optionalCategory(request.unitId(), MasterDataCategory.UNIT),
                product
        );
    }

    private void apply(HealthEvent event, HealthEventRequest request, HealthEventReferences refs) {
        event.setEventType(refs.eventType());
        event.setEventDate(request.eventDate());
        event.setDescription(request.description());
        event.setProduct(refs.product());
        event.setQuantity(request.quantity());
        event.setUnit(refs.unit());
    }

    private record HealthEventReferences(MasterData eventType, MasterData unit, Product product) {
    }

    private HealthEvent loadEvent(UUID healthEventId) {
        return healthEventRepository.findById(healthEventId)
                .orElseThrow(() -> ProblemException.notFound("HEALTH_EVENT_NOT_FOUND"));
    }
}
