package com.mifinca.backend.modules.config.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.mifinca.backend.modules.config.domain.ConfigurationParameter;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ConfigurationParameterRepository extends JpaRepository<ConfigurationParameter, UUID> {

    @EntityGraph(attributePaths = "dataType")
    List<ConfigurationParameter> findAllByOrderByNameAsc();

    @EntityGraph(attributePaths = "dataType")
    Optional<ConfigurationParameter> findByNameIgnoreCase(String name);

    boolean existsByNameIgnoreCase(String name);
}
