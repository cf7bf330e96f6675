package com.mifinca.backend.modules.farm.domain;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class UserFarmAccessId implements Serializable {

    @Column(name = "user_id", nullable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "farm_id", nullable = false, columnDefinition = "uuid")
    private UUID farmId;

    protected UserFarmAccessId() {
    }

    public UserFarmAccessId(UUID userId, UUID farmId) {
        this.userId = userId;
        this.farmId = farmId;
    }

    public UUID getUserId() {
        return userId;
    }

    public UUID getFarmId() {
        return farmId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UserFarmAccessId that)) return false;
        return Objects.equals(userId, that.userId) && Objects.equals(farmId, that.farmId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, farmId);
    }
}
