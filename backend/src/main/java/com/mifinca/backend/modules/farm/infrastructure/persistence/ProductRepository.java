package com.mifinca.backend.modules.farm.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.farm.domain.Product;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ProductRepository extends JpaRepository<Product, UUID> {

    List<Product> findByFarm_IdOrderByNameAsc(UUID farmId);
}
