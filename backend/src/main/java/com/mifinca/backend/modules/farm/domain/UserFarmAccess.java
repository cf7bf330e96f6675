package com.mifinca.backend.modules.farm.domain;

import com.mifinca.backend.global.jpa.AbstractTimestampedEntity;
import com.mifinca.backend.modules.auth.domain.AppUser;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.MapsId;
import jakarta.persistence.Table;

/**
 * Shared access to a farm for a user who does not own it. One row per (user, farm).
 */
@Entity
@Table(name = "user_farm_access")
public class UserFarmAccess extends AbstractTimestampedEntity {

    @EmbeddedId
    private UserFarmAccessId id;

    @MapsId("userId")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private AppUser user;

    @MapsId("farmId")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "farm_id", nullable = false)
    private Farm farm;

    @Enumerated(EnumType.STRING)
    @Column(name = "access_level", nullable = false, length = 16)
    private FarmAccessLevel accessLevel = FarmAccessLevel.VIEW;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assigned_by_user_id")
    private AppUser assignedBy;

    @Column(name = "notes")
    private String notes;

    protected UserFarmAccess() {
    }

    public UserFarmAccess(AppUser user, Farm farm, FarmAccessLevel accessLevel, AppUser assignedBy) {
        this.id = new UserFarmAccessId(user.getId(), farm.getId());
        this.user = user;
        this.farm = farm;
        this.accessLevel = accessLevel;
        this.assignedBy = assignedBy;
    }

    public UserFarmAccessId getId() {
        return id;
    }

    public AppUser getUser() {
        return user;
    }

    public Farm getFarm() {
        return farm;
    }

    public FarmAccessLevel getAccessLevel() {
        return accessLevel;
    }

    public void setAccessLevel(FarmAccessLevel accessLevel) {
        this.accessLevel = accessLevel;
    }

    public AppUser getAssignedBy() {
        return assignedBy;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}
