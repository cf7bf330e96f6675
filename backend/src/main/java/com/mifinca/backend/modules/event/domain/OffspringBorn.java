package com.mifinca.backend.modules.event.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.mifinca.backend.global.jpa.AbstractTimestampedEntity;
import com.mifinca.backend.modules.access.domain.AnimalScopedRecord;
import com.mifinca.backend.modules.animal.domain.Animal;
import com.mifinca.backend.modules.auth.domain.AppUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Birth record linking a calving event to the newborn animal.
 */
@Entity
@Table(name = "offspring_born")
public class OffspringBorn extends AbstractTimestampedEntity implements AnimalScopedRecord {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "reproductive_event_id", nullable = false)
    private ReproductiveEvent reproductiveEvent;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "offspring_animal_id", nullable = false)
    private Animal offspring;

    @Column(name = "date_of_birth", nullable = false)
    private LocalDate dateOfBirth;

    @Column(name = "notes")
    private String notes;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "born_by_user_id", nullable = false)
    private AppUser bornBy;

    public UUID getId() {
        return id;
    }

    public ReproductiveEvent getReproductiveEvent() {
        return reproductiveEvent;
    }

    public void setReproductiveEvent(ReproductiveEvent reproductiveEvent) {
        this.reproductiveEvent = reproductiveEvent;
    }

    public Animal getOffspring() {
        return offspring;
    }

    public void setOffspring(Animal offspring) {
        this.offspring = offspring;
    }

    public LocalDate getDateOfBirth() {
        return dateOfBirth;
    }

    public void setDateOfBirth(LocalDate dateOfBirth) {
        this.dateOfBirth = dateOfBirth;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public AppUser getBornBy() {
        return bornBy;
    }

    public void setBornBy(AppUser bornBy) {
        this.bornBy = bornBy;
    }

    @Override
    public UUID getRecorderId() {
        return bornBy != null ? bornBy.getId() : null;
    }

    @Override
    public Collection<Animal> getAffectedAnimals() {
        List<Animal> affected = new ArrayList<>(2);
        if (offspring != null) {
            affected.add(offspring);
        }
        if (reproductiveEvent != null && reproductiveEvent.getAnimal() != null) {
            affected.add(reproductiveEvent.getAnimal());
        }
        return affected;
    }
}
