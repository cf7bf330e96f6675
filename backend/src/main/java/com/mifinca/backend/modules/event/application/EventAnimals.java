package com.mifinca.backend.modules.event.application;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.domain.AccessOperation;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.animal.domain.Animal;
import com.mifinca.backend.modules.animal.infrastructure.persistence.AnimalRepository;

import org.springframework.stereotype.Component;

/**
 * Loads the animals named by an event request. Every id must exist before any of them is checked
 * for access, so a missing animal is always reported as not found.
 */
@Component
public class EventAnimals {

    private final AnimalRepository animalRepository;
    private final AccessGuard accessGuard;

    public EventAnimals(AnimalRepository animalRepository, AccessGuard accessGuard) {
        this.animalRepository = animalRepository;
        this.accessGuard = accessGuard;
    }

    public Animal load(UUID animalId) {
        return animalRepository.findById(animalId)
                .orElseThrow(() -> ProblemException.notFound("ANIMAL_NOT_FOUND"));
    }

    public List<Animal> loadAll(Collection<UUID> animalIds) {
        List<Animal> animals = new ArrayList<>(animalIds.size());
        for (UUID animalId : new LinkedHashSet<>(animalIds)) {
            animals.add(load(animalId));
        }
        return animals;
    }

    public void requireWritable(Actor actor, Collection<Animal> animals) {
        for (Animal animal : animals) {
            accessGuard.requireAnimal(actor, animal, AccessOperation.WRITE);
        }
    }

    public static List<UUID> ids(Collection<Animal> animals) {
        return animals.stream().map(Animal::getId).toList();
    }
}
