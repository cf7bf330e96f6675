package com.mifinca.backend.modules.farm.domain;

/**
 * Recorded on a grant. The policy table treats every level as shared access.
 */
public enum FarmAccessLevel {
    VIEW,
    EDIT,
    MANAGE
}
