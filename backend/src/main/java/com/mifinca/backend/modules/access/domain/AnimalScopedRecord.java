package com.mifinca.backend.modules.access.domain;

import java.util.Collection;
import java.util.UUID;

import com.mifinca.backend.modules.animal.domain.Animal;

/**
 * A record whose visibility follows the animals it touches: health events, feedings, weighings,
 * reproductive events and batches.
 */
public interface AnimalScopedRecord {

    /**
     * User who administered, recorded or created the record.
     */
    UUID getRecorderId();

    Collection<Animal> getAffectedAnimals();
}
