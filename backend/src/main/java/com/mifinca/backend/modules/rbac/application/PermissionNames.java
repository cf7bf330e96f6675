package com.mifinca.backend.modules.rbac.application;

/**
 * Permissions checked by the application. Seeded by the initial migration.
 */
public final class PermissionNames {

    public static final String FARM_READ_ALL = "farm:read_all";
    public static final String MASTER_DATA_MANAGE = "master_data:manage";

    private PermissionNames() {
    }
}
