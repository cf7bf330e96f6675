package com.mifinca.backend.modules.event.domain;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

import com.mifinca.backend.global.jpa.AbstractTimestampedEntity;
import com.mifinca.backend.modules.access.domain.AnimalScopedRecord;
import com.mifinca.backend.modules.animal.domain.Animal;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.masterdata.domain.MasterData;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "feeding")
public class Feeding extends AbstractTimestampedEntity implements AnimalScopedRecord {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "feed_type_id", nullable = false)
    private MasterData feedType;

    @Column(name = "feeding_date", nullable = false)
    private OffsetDateTime feedingDate;

    @Column(name = "quantity", precision = 14, scale = 3)
    private BigDecimal quantity;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "unit_id")
    private MasterData unit;

    @Column(name = "notes")
    private String notes;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "recorded_by_user_id", nullable = false)
    private AppUser recordedBy;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "feeding_animal",
            joinColumns = @JoinColumn(name = "feeding_id"),
            inverseJoinColumns = @JoinColumn(name = "animal_id"))
    private Set<Animal> animals = new LinkedHashSet<>();

    public UUID getId() {
        return id;
    }

    public MasterData getFeedType() {
        return feedType;
    }

    public void setFeedType(MasterData feedType) {
        this.feedType = feedType;
    }

    public OffsetDateTime getFeedingDate() {
        return feedingDate;
    }

    public void setFeedingDate(OffsetDateTime feedingDate) {
        this.feedingDate = feedingDate;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public void setQuantity(BigDecimal quantity) {
        this.quantity = quantity;
    }

    public MasterData getUnit() {
        return unit;
    }

    public void setUnit(MasterData unit) {
        this.unit = unit;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public AppUser getRecordedBy() {
        return recordedBy;
    }

    public void setRecordedBy(AppUser recordedBy) {
        this.recordedBy = recordedBy;
    }

    public Set<Animal> getAnimals() {
        return animals;
    }

    public void replaceAnimals(Collection<Animal> newAnimals) {
        animals.clear();
        animals.addAll(newAnimals);
    }

    @Override
    public UUID getRecorderId() {
        return recordedBy != null ? recordedBy.getId() : null;
    }

    @Override
    public Collection<Animal> getAffectedAnimals() {
        return animals;
    }
}
