package com.mifinca.backend.modules.farm.presentation.dto;

import java.math.BigDecimal;
import java.util.UUID;

import com.mifinca.backend.modules.farm.domain.Product;

public record ProductResponse(
        UUID productId,
        UUID farmId,
        String name,
        UUID productTypeId,
        UUID unitId,
        BigDecimal quantity,
        String description
) {

    public static ProductResponse from(Product product) {
        return new ProductResponse(
                product.getId(),
                product.getFarm().getId(),
                product.getName(),
                product.getProductType() != null ? product.getProductType().getId() : null,
                product.getUnit() != null ? product.getUnit().getId() : null,
                product.getQuantity(),
                product.getDescription()
        );
    }
}
