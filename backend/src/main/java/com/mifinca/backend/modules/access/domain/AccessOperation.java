package com.mifinca.backend.modules.access.domain;

public enum AccessOperation {
    READ,
    WRITE,
    DELETE
}
