package com.mifinca.backend.modules.animal.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.animal.domain.AnimalGroup;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AnimalGroupRepository extends JpaRepository<AnimalGroup, UUID> {

    List<AnimalGroup> findByGrupo_IdOrderByAssignedAtAsc(UUID grupoId);

    boolean existsByGrupo_IdAndAnimal_IdAndRemovedAtIsNull(UUID grupoId, UUID animalId);
}
