package com.mifinca.backend.modules.event.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * What a transaction moves: an animal, a product or a whole batch.
 */
public sealed interface TransactionSubject
        permits TransactionSubject.AnimalSubject, TransactionSubject.ProductSubject, TransactionSubject.BatchSubject {

    UUID id();

    TransactionSubjectKind kind();

    static TransactionSubject of(TransactionSubjectKind kind, UUID id) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
        return switch (kind) {
            case ANIMAL -> new AnimalSubject(id);
            case PRODUCT -> new ProductSubject(id);
            case BATCH -> new BatchSubject(id);
        };
    }

    record AnimalSubject(UUID id) implements TransactionSubject {
        @Override
        public TransactionSubjectKind kind() {
            return TransactionSubjectKind.ANIMAL;
        }
    }

    record ProductSubject(UUID id) implements TransactionSubject {
        @Override
        public TransactionSubjectKind kind() {
            return TransactionSubjectKind.PRODUCT;
        }
    }

    record BatchSubject(UUID id) implements TransactionSubject {
        @Override
        public TransactionSubjectKind kind() {
            return TransactionSubjectKind.BATCH;
        }
    }
}
