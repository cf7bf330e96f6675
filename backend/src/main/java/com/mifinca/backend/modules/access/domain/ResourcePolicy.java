package com.mifinca.backend.modules.access.domain;

/**
 * Resource types with their own row in the policy table.
 */
public enum ResourcePolicy {
    FARM,
    LOT,
    PRODUCT,
    ANIMAL,
    /** Linking an animal as mother or father of another. */
    ANIMAL_LINEAGE,
    GRUPO,
    ANIMAL_EVENT,
    /** Batches belong to their farm; anyone working the farm manages them. */
    BATCH,
    TRANSACTION,
    FARM_ACCESS_GRANT,
    RBAC_ASSOCIATION,
    USER_ADMINISTRATION,
    /** System-wide settings; readable by every active user. */
    CONFIGURATION_PARAMETER
}
