package com.mifinca.backend.modules.event.domain;

public enum TransactionSubjectKind {
    ANIMAL,
    PRODUCT,
    BATCH
}
