package com.mifinca.backend.modules.event.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.mifinca.backend.modules.event.domain.Transaction;
import com.mifinca.backend.modules.event.domain.TransactionSubject;
import com.mifinca.backend.modules.event.domain.TransactionSubjectKind;

public record TransactionResponse(
        UUID transactionId,
        UUID transactionTypeId,
        OffsetDateTime transactionDate,
        TransactionSubjectKind subjectKind,
        UUID subjectId,
        UUID fromOwnerUserId,
        UUID toOwnerUserId,
        UUID fromFarmId,
        UUID toFarmId,
        BigDecimal quantity,
        UUID unitId,
        BigDecimal pricePerUnit,
        BigDecimal totalAmount,
        String notes
) {

    public static TransactionResponse from(Transaction transaction) {
        TransactionSubject subject = transaction.getSubject();
        return new TransactionResponse(
                transaction.getId(),
                transaction.getTransactionType().getId(),
                transaction.getTransactionDate(),
                subject.kind(),
                subject.id(),
                transaction.getFromOwnerId(),
                transaction.getToOwnerId(),
                transaction.getFromFarm() != null ? transaction.getFromFarm().getId() : null,
                transaction.getToFarm() != null ? transaction.getToFarm().getId() : null,
                transaction.getQuantity(),
                transaction.getUnit() != null ? transaction.getUnit().getId() : null,
                transaction.getPricePerUnit(),
                transaction.getTotalAmount(),
                transaction.getNotes()
        );
    }
}
