package com.mifinca.backend.modules.event.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.mifinca.backend.modules.event.domain.TransactionSubjectKind;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

/**
 * {@code fromOwnerUserId} is optional; when present it must be the caller.
 */
public record TransactionRequest(
        @NotNull UUID transactionTypeId,
        @NotNull OffsetDateTime transactionDate,
        @NotNull TransactionSubjectKind subjectKind,
        @NotNull UUID subjectId,
        UUID fromOwnerUserId,
        UUID toOwnerUserId,
        UUID fromFarmId,
        UUID toFarmId,
        @DecimalMin("0.0") BigDecimal quantity,
        UUID unitId,
        @DecimalMin("0.0") BigDecimal pricePerUnit,
        @DecimalMin("0.0") BigDecimal totalAmount,
        String notes
) {
}
