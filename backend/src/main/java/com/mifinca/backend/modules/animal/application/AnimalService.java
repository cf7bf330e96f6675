package com.mifinca.backend.modules.animal.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.application.OwnershipResolver;
import com.mifinca.backend.modules.access.domain.AccessOperation;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.access.domain.ResourcePolicy;
import com.mifinca.backend.modules.animal.domain.Animal;
import com.mifinca.backend.modules.animal.domain.AnimalLocationHistory;
import com.mifinca.backend.modules.animal.infrastructure.persistence.AnimalLocationHistoryRepository;
import com.mifinca.backend.modules.animal.infrastructure.persistence.AnimalRepository;
import com.mifinca.backend.modules.animal.presentation.dto.AnimalLocationResponse;
import com.mifinca.backend.modules.animal.presentation.dto.AnimalRequest;
import com.mifinca.backend.modules.animal.presentation.dto.AnimalResponse;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.farm.domain.Farm;
import com.mifinca.backend.modules.farm.domain.Lot;
import com.mifinca.backend.modules.farm.infrastructure.persistence.FarmRepository;
import com.mifinca.backend.modules.farm.infrastructure.persistence.LotRepository;
import com.mifinca.backend.modules.masterdata.application.MasterDataLookup;
import com.mifinca.backend.modules.masterdata.domain.MasterData;
import com.mifinca.backend.modules.masterdata.domain.MasterDataCategory;

import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AnimalService {

    private final AnimalRepository animalRepository;
    private final AnimalLocationHistoryRepository locationHistoryRepository;
    private final LotRepository lotRepository;
    private final FarmRepository farmRepository;
    private final MasterDataLookup masterDataLookup;
    private final CurrentActorService currentActorService;
    private final OwnershipResolver ownershipResolver;
    private final AccessGuard accessGuard;
    private final Clock clock;

    public AnimalService(
            AnimalRepository animalRepository,
            AnimalLocationHistoryRepository locationHistoryRepository,
            LotRepository lotRepository,
            FarmRepository farmRepository,
            MasterDataLookup masterDataLookup,
            CurrentActorService currentActorService,
            OwnershipResolver ownershipResolver,
            AccessGuard accessGuard,
            Clock clock
    ) {
        this.animalRepository = animalRepository;
        this.locationHistoryRepository = locationHistoryRepository;
        this.lotRepository = lotRepository;
        this.farmRepository = farmRepository;
        this.masterDataLookup = masterDataLookup;
        this.currentActorService = currentActorService;
        this.ownershipResolver = ownershipResolver;
        this.accessGuard = accessGuard;
        this.clock = clock;
    }

    public AnimalResponse createAnimal(AnimalRequest request) {
        Actor actor = currentActorService.requireActor();
        Lot lot = optionalLot(request.currentLotId());
        Animal mother = optionalParent(request.motherAnimalId(), "MOTHER_ANIMAL_NOT_FOUND");
        Animal father = optionalParent(request.fatherAnimalId(), "FATHER_ANIMAL_NOT_FOUND");
        AnimalReferences refs = resolveReferences(request);

        if (lot != null) {
            accessGuard.requireLotPlacement(actor, lot);
        }
        requireLineage(actor, mother);
        requireLineage(actor, father);

        Animal animal = new Animal();
        animal.setOwner(currentActorService.reference(actor));
        animal.setCurrentLot(lot);
        animal.setMother(mother);
        animal.setFather(father);
        apply(animal, request, refs);
        Animal saved = animalRepository.save(animal);
        if (lot != null) {
            openLocation(saved, lot, actor);
        }
        return AnimalResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public AnimalResponse getAnimal(UUID animalId) {
        Actor actor = currentActorService.requireActor();
        Animal animal = loadAnimal(animalId);
        accessGuard.requireAnimal(actor, animal, AccessOperation.READ);
        return AnimalResponse.from(animal);
    }

    /**
     * Animals the caller owns plus animals in lots of accessible farms, optionally narrowed to
     * one farm or one lot. A filter the caller cannot read is rejected instead of returning an
     * empty list.
     */
    @Transactional(readOnly = true)
    public List<AnimalResponse> listAnimals(UUID farmId, UUID lotId) {
        Actor actor = currentActorService.requireActor();
        if (lotId != null) {
            Lot lot = loadLot(lotId);
            accessGuard.requireLot(actor, lot, AccessOperation.READ);
            return toResponses(animalRepository.findByCurrentLot_IdOrderByTagIdAsc(lotId));
        }
        if (farmId != null) {
            Farm farm = farmRepository.findById(farmId)
                    .orElseThrow(() -> ProblemException.notFound("FARM_NOT_FOUND"));
            accessGuard.requireFarmScope(actor, farm, ResourcePolicy.ANIMAL, AccessOperation.READ);
            return toResponses(animalRepository.findByCurrentLot_Farm_IdOrderByTagIdAsc(farmId));
        }
        if (actor.superuser()) {
            return toResponses(animalRepository.findAll(Sort.by("tagId")));
        }
        return toResponses(animalRepository.findVisible(actor.userId(), ownershipResolver.farmIdFilter(actor)));
    }

    public AnimalResponse updateAnimal(UUID animalId, AnimalRequest request) {
        Actor actor = currentActorService.requireActor();
        Animal animal = loadAnimal(animalId);
        Lot targetLot = optionalLot(request.currentLotId());
        Animal mother = optionalParent(request.motherAnimalId(), "MOTHER_ANIMAL_NOT_FOUND");
        Animal father = optionalParent(request.fatherAnimalId(), "FATHER_ANIMAL_NOT_FOUND");
        AnimalReferences refs = resolveReferences(request);
        if (animalId.equals(request.motherAnimalId()) || animalId.equals(request.fatherAnimalId())) {
            throw ProblemException.invalid("INVALID_PARENT", "an animal cannot be its own parent");
        }

        accessGuard.requireAnimal(actor, animal, AccessOperation.WRITE);
        boolean moved = !Objects.equals(lotId(animal.getCurrentLot()), request.currentLotId());
        if (moved && targetLot != null) {
            accessGuard.requireLotPlacement(actor, targetLot);
        }
        if (!Objects.equals(idOf(animal.getMother()), request.motherAnimalId())) {
            requireLineage(actor, mother);
        }
        if (!Objects.equals(idOf(animal.getFather()), request.fatherAnimalId())) {
            requireLineage(actor, father);
        }

        if (moved) {
            closeLocation(animal);
            animal.setCurrentLot(targetLot);
            if (targetLot != null) {
                openLocation(animal, targetLot, actor);
            }
        }
        animal.setMother(mother);
        animal.setFather(father);
        apply(animal, request, refs);
        return AnimalResponse.from(animalRepository.save(animal));
    }

    /**
     * Memberships, location history, weighings and reproductive events of the animal are removed
     * with it by the schema; offspring keep existing with the parent link cleared.
     */
    public void deleteAnimal(UUID animalId) {
        Actor actor = currentActorService.requireActor();
        Animal animal = loadAnimal(animalId);
        accessGuard.requireAnimal(actor, animal, AccessOperation.DELETE);
        animalRepository.delete(animal);
    }

    @Transactional(readOnly = true)
    public List<AnimalLocationResponse> listLocationHistory(UUID animalId) {
        Actor actor = currentActorService.requireActor();
        Animal animal = loadAnimal(animalId);
        accessGuard.requireAnimal(actor, animal, AccessOperation.READ);
        return locationHistoryRepository.findByAnimal_IdOrderByEnteredAtDesc(animalId).stream()
                .map(AnimalLocationResponse::from)
                .toList();
    }

    private void openLocation(Animal animal, Lot lot, Actor actor) {
        AnimalLocationHistory entry = new AnimalLocationHistory();
        entry.setAnimal(animal);
        entry.setLot(lot);
        entry.setEnteredAt(OffsetDateTime.now(clock));
        entry.setRecordedBy(currentActorService.reference(actor));
        locationHistoryRepository.save(entry);
    }

    private void closeLocation(Animal animal) {
        locationHistoryRepository.findFirstByAnimal_IdAndLeftAtIsNullOrderByEnteredAtDesc(animal.getId())
                .ifPresent(open -> open.setLeftAt(OffsetDateTime.now(clock)));
    }

    private void requireLineage(Actor actor, Animal parent) {
        if (parent != null) {
            accessGuard.requireLineage(actor, parent);
        }
    }

    private AnimalReferences resolveReferences(AnimalRequest request) {
        return new AnimalReferences(
                masterDataLookup.optionalCategory(request.speciesId(), MasterDataCategory.SPECIES),
                masterDataLookup.optionalCategory(request.breedId(), MasterDataCategory.BREED),
                masterDataLookup.optionalCategory(request.sexId(), MasterDataCategory.SEX),
                masterDataLookup.optionalCategory(request.statusId(), MasterDataCategory.ANIMAL_STATUS)
        );
    }

    private void apply(Animal animal, AnimalRequest request, AnimalReferences refs) {
        animal.setTagId(request.tagId().trim());
        animal.setName(request.name());
        animal.setSpecies(refs.species());
        animal.setBreed(refs.breed());
        animal.setSex(refs.sex());
        animal.setStatus(refs.status());
        animal.setDateOfBirth(request.dateOfBirth());
        animal.setNotes(request.notes());
    }

    private record AnimalReferences(MasterData species, MasterData breed, MasterData sex, MasterData status) {
    }

    private Animal loadAnimal(UUID animalId) {
        return animalRepository.findById(animalId)
                .orElseThrow(() -> ProblemException.notFound("ANIMAL_NOT_FOUND"));
    }

    private Animal optionalParent(UUID parentId, String notFoundCode) {
        if (parentId == null) {
            return null;
        }
        return animalRepository.findById(parentId)
                .orElseThrow(() -> ProblemException.notFound(notFoundCode));
    }

    private Lot loadLot(UUID lotId) {
        return lotRepository.findById(lotId)
                .orElseThrow(() -> ProblemException.notFound("LOT_NOT_FOUND"));
    }

    private Lot optionalLot(UUID lotId) {
        return lotId == null ? null : loadLot(lotId);
    }

    private static UUID lotId(Lot lot) {
        return lot != null ? lot.getId() : null;
    }

    private static UUID idOf(Animal animal) {
        return animal != null ? animal.getId() : null;
    }

    private static List<AnimalResponse> toResponses(List<Animal> animals) {
        return animals.stream().map(AnimalResponse::from).toList();
    }
}
