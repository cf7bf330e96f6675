package com.mifinca.backend.modules.event.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.event.domain.OffspringBorn;

import org.springframework.data.jpa.repository.JpaRepository;

public interface OffspringBornRepository extends JpaRepository<OffspringBorn, UUID> {

    List<OffspringBorn> findByReproductiveEvent_IdOrderByDateOfBirthAsc(UUID reproductiveEventId);

    boolean existsByOffspring_Id(UUID offspringAnimalId);
}
