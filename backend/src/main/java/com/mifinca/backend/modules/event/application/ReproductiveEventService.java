package com.mifinca.backend.modules.event.application;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemCategory;
import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.application.OwnershipResolver;
import com.mifinca.backend.modules.access.domain.AccessOperation;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.animal.domain.Animal;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.event.domain.OffspringBorn;
import com.mifinca.backend.modules.event.domain.ReproductiveEvent;
import com.mifinca.backend.modules.event.infrastructure.persistence.OffspringBornRepository;
import com.mifinca.backend.modules.event.infrastructure.persistence.ReproductiveEventRepository;
import com.mifinca.backend.modules.event.presentation.dto.OffspringBornRequest;
import com.mifinca.backend.modules.event.presentation.dto.OffspringBornResponse;
import com.mifinca.backend.modules.event.presentation.dto.ReproductiveEventRequest;
import com.mifinca.backend.modules.event.presentation.dto.ReproductiveEventResponse;
import com.mifinca.backend.modules.masterdata.application.MasterDataLookup;
import com.mifinca.backend.modules.masterdata.domain.MasterData;
import com.mifinca.backend.modules.masterdata.domain.MasterDataCategory;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reproductive events and the offspring registered against them. The event is written against
 * the female; a sire only needs to be readable by the caller.
 */
@Service
@Transactional
public class ReproductiveEventService {

    private final ReproductiveEventRepository reproductiveEventRepository;
    private final OffspringBornRepository offspringBornRepository;
    private final EventAnimals eventAnimals;
    private final MasterDataLookup masterDataLookup;
    private final CurrentActorService currentActorService;
    private final OwnershipResolver ownershipResolver;
    private final AccessGuard accessGuard;

    public ReproductiveEventService(
            ReproductiveEventRepository reproductiveEventRepository,
            OffspringBornRepository offspringBornRepository,
            EventAnimals eventAnimals,
            MasterDataLookup masterDataLookup,
            CurrentActorService currentActorService,
            OwnershipResolver ownershipResolver,
            AccessGuard accessGuard
    ) {
        this.reproductiveEventRepository = reproductiveEventRepository;
        this.offspringBornRepository = offspringBornRepository;
        this.eventAnimals = eventAnimals;
        this.masterDataLookup = masterDataLookup;
        this.currentActorService = currentActorService;
        this.ownershipResolver = ownershipResolver;
        this.accessGuard = accessGuard;
    }

    public ReproductiveEventResponse createReproductiveEvent(ReproductiveEventRequest request) {
        Actor actor = currentActorService.requireActor();
        Animal animal = eventAnimals.load(request.animalId());
        Animal sire = request.sireAnimalId() != null ? eventAnimals.load(request.sireAnimalId()) : null;
        MasterData eventType = masterDataLookup.requireCategory(request.eventTypeId(), MasterDataCategory.REPRODUCTIVE_EVENT_TYPE);
        accessGuard.requireAnimal(actor, animal, AccessOperation.WRITE);
        requireSire(actor, sire);

        ReproductiveEvent event = new ReproductiveEvent();
        event.setAdministeredBy(currentActorService.reference(actor));
        event.setAnimal(animal);
        apply(event, request, eventType, sire);
        return ReproductiveEventResponse.from(reproductiveEventRepository.save(event));
    }

    @Transactional(readOnly = true)
    public ReproductiveEventResponse getReproductiveEvent(UUID eventId) {
        Actor actor = currentActorService.requireActor();
        ReproductiveEvent event = loadEvent(eventId);
        accessGuard.requireEvent(actor, event, event.getId(), AccessOperation.READ);
        return ReproductiveEventResponse.from(event);
    }

    @Transactional(readOnly = true)
    public List<ReproductiveEventResponse> listReproductiveEvents() {
        Actor actor = currentActorService.requireActor();
        List<ReproductiveEvent> events = actor.superuser()
                ? reproductiveEventRepository.findAll(Sort.by(Sort.Direction.DESC, "eventDate"))
                : reproductiveEventRepository.findVisible(actor.userId(), ownershipResolver.farmIdFilter(actor));
        return events.stream().map(ReproductiveEventResponse::from).toList();
    }

    /**
     * The female an event was recorded against cannot change.
     */
    public ReproductiveEventResponse updateReproductiveEvent(UUID eventId, ReproductiveEventRequest request) {
        Actor actor = currentActorService.requireActor();
        ReproductiveEvent event = loadEvent(eventId);
        if (!event.getAnimal().getId().equals(request.animalId())) {
            throw ProblemException.invalid("IMMUTABLE_FIELD", "animalId cannot be changed");
        }
        Animal sire = request.sireAnimalId() != null ? eventAnimals.load(request.sireAnimalId()) : null;
        MasterData eventType = masterDataLookup.requireCategory(request.eventTypeId(), MasterDataCategory.REPRODUCTIVE_EVENT_TYPE);
        accessGuard.requireEvent(actor, event, event.getId(), AccessOperation.WRITE);
        requireSire(actor, sire);

        apply(event, request, eventType, sire);
        return ReproductiveEventResponse.from(reproductiveEventRepository.save(event));
    }

    public void deleteReproductiveEvent(UUID eventId) {
        Actor actor = currentActorService.requireActor();
        ReproductiveEvent event = loadEvent(eventId);
        accessGuard.requireEvent(actor, event, event.getId(), AccessOperation.DELETE);
        reproductiveEventRepository.delete(event);
    }

    public OffspringBornResponse registerOffspring(UUID eventId, OffspringBornRequest request) {
        Actor actor = currentActorService.requireActor();
        ReproductiveEvent event = loadEvent(eventId);
        Animal offspring = eventAnimals.load(request.offspringAnimalId());
        accessGuard.requireEvent(actor, event, event.getId(), AccessOperation.WRITE);
        accessGuard.requireAnimal(actor, offspring, AccessOperation.WRITE);

        if (offspringBornRepository.existsByOffspring_Id(offspring.getId())) {
            throw ProblemException.alreadyExists("OFFSPRING_ALREADY_REGISTERED");
        }
        OffspringBorn record = new OffspringBorn();
        record.setReproductiveEvent(event);
        record.setOffspring(offspring);
        record.setDateOfBirth(request.dateOfBirth() != null ? request.dateOfBirth() : offspring.getDateOfBirth());
        record.setNotes(request.notes());
        record.setBornBy(currentActorService.reference(actor));
        try {
            return OffspringBornResponse.from(offspringBornRepository.saveAndFlush(record));
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(ProblemCategory.ALREADY_EXISTS, "OFFSPRING_ALREADY_REGISTERED", null, ex);
        }
    }

    @Transactional(readOnly = true)
    public List<OffspringBornResponse> listOffspring(UUID eventId) {
        Actor actor = currentActorService.requireActor();
        ReproductiveEvent event = loadEvent(eventId);
        accessGuard.requireEvent(actor, event, event.getId(), AccessOperation.READ);
        return offspringBornRepository.findByReproductiveEvent_IdOrderByDateOfBirthAsc(eventId).stream()
                .map(OffspringBornResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public OffspringBornResponse getOffspring(UUID offspringBornId) {
        Actor actor = currentActorService.requireActor();
        OffspringBorn record = loadOffspring(offspringBornId);
        accessGuard.requireEvent(actor, record, record.getId(), AccessOperation.READ);
        return OffspringBornResponse.from(record);
    }

    public void deleteOffspring(UUID offspringBornId) {
        Actor actor = currentActorService.requireActor();
        OffspringBorn record = loadOffspring(offspringBornId);
        accessGuard.requireEvent(actor, record, record.getId(), AccessOperation.DELETE);
        offspringBornRepository.delete(record);
    }

    private void requireSire(Actor actor, Animal sire) {
        if (sire != null) {
            accessGuard.requireAnimal(actor, sire, AccessOperation.READ);
        }
    }

    private void apply(ReproductiveEvent event, ReproductiveEventRequest request, MasterData eventType, Animal sire) {
        event.setEventType(eventType);
        event.setEventDate(request.eventDate());
        event.setSire(sire);
        event.setGestationDiagnosisResult(request.gestationDiagnosisResult());
        event.setExpectedCalvingDate(request.expectedCalvingDate());
        event.setNotes(request.notes());
    }

    private ReproductiveEvent loadEvent(UUID eventId) {
        return reproductiveEventRepository.findById(eventId)
                .orElseThrow(() -> ProblemException.notFound("REPRODUCTIVE_EVENT_NOT_FOUND"));
    }

    private OffspringBorn loadOffspring(UUID offspringBornId) {
        return offspringBornRepository.findById(offspringBornId)
                .orElseThrow(() -> ProblemException.notFound("OFFSPRING_BORN_NOT_FOUND"));
    }
}
