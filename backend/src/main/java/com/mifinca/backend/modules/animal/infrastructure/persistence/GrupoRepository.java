package com.mifinca.backend.modules.animal.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.animal.domain.Grupo;

import org.springframework.data.jpa.repository.JpaRepository;

public interface GrupoRepository extends JpaRepository<Grupo, UUID> {

    List<Grupo> findByCreatedBy_IdOrderByNameAsc(UUID userId);

    boolean existsByNameIgnoreCaseAndCreatedBy_Id(String name, UUID userId);
}
