package com.mifinca.backend.modules.event.domain;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

import com.mifinca.backend.global.jpa.AbstractTimestampedEntity;
import com.mifinca.backend.modules.access.domain.AnimalScopedRecord;
import com.mifinca.backend.modules.animal.domain.Animal;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.farm.domain.Farm;
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

/**
 * Operational batch of animals on a farm (a shipment, a sale lot, a treatment round).
 */
@Entity
@Table(name = "batch")
public class Batch extends AbstractTimestampedEntity implements AnimalScopedRecord {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, length = 150)
    private String name;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "batch_type_id", nullable = false)
    private MasterData batchType;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "farm_id", nullable = false)
    private Farm farm;

    @Column(name = "description")
    private String description;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "created_by_user_id", nullable = false)
    private AppUser createdBy;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "batch_animal",
            joinColumns = @JoinColumn(name = "batch_id"),
            inverseJoinColumns = @JoinColumn(name = "animal_id"))
    private Set<Animal> animals = new LinkedHashSet<>();

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public MasterData getBatchType() {
        return batchType;
    }

    public void setBatchType(MasterData batchType) {
        this.batchType = batchType;
    }

    public Farm getFarm() {
        return farm;
    }

    public void setFarm(Farm farm) {
        this.farm = farm;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public AppUser getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(AppUser createdBy) {
        this.createdBy = createdBy;
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
        return createdBy != null ? createdBy.getId() : null;
    }

    @Override
    public Collection<Animal> getAffectedAnimals() {
        return animals;
    }
}
