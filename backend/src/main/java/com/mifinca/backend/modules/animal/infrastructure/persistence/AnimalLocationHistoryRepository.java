package com.mifinca.backend.modules.animal.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.mifinca.backend.modules.animal.domain.AnimalLocationHistory;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AnimalLocationHistoryRepository extends JpaRepository<AnimalLocationHistory, UUID> {

    List<AnimalLocationHistory> findByAnimal_IdOrderByEnteredAtDesc(UUID animalId);

    Optional<AnimalLocationHistory> findFirstByAnimal_IdAndLeftAtIsNullOrderByEnteredAtDesc(UUID animalId);
}
