package com.mifinca.backend.modules.masterdata.domain;

/**
 * Controlled vocabularies. Every foreign key into {@code master_data} expects exactly one of these.
 */
public enum MasterDataCategory {
    SPECIES,
    BREED,
    SEX,
    ANIMAL_STATUS,
    ORIGIN,
    UNIT,
    PRODUCT_TYPE,
    HEALTH_EVENT_TYPE,
    REPRODUCTIVE_EVENT_TYPE,
    FEED_TYPE,
    BATCH_TYPE,
    TRANSACTION_TYPE,
    ENTITY_TYPE,
    DATA_TYPE
}
