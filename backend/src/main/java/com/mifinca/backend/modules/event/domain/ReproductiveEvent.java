package com.mifinca.backend.modules.event.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
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
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Heat, insemination, pregnancy check or calving of a female, optionally with the sire.
 */
@Entity
@Table(name = "reproductive_event")
public class ReproductiveEvent extends AbstractTimestampedEntity implements AnimalScopedRecord {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "animal_id", nullable = false)
    private Animal animal;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "event_type_id", nullable = false)
    private MasterData eventType;

    @Column(name = "event_date", nullable = false)
    private OffsetDateTime eventDate;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "sire_animal_id")
    private Animal sire;

    @Column(name = "gestation_diagnosis_result", length = 60)
    private String gestationDiagnosisResult;

    @Column(name = "expected_calving_date")
    private OffsetDateTime expectedCalvingDate;

    @Column(name = "notes")
    private String notes;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "administered_by_user_id", nullable = false)
    private AppUser administeredBy;

    public UUID getId() {
        return id;
    }

    public Animal getAnimal() {
        return animal;
    }

    public void setAnimal(Animal animal) {
        this.animal = animal;
    }

    public MasterData getEventType() {
        return eventType;
    }

    public void setEventType(MasterData eventType) {
        this.eventType = eventType;
    }

    public OffsetDateTime getEventDate() {
        return eventDate;
    }

    public void setEventDate(OffsetDateTime eventDate) {
        this.eventDate = eventDate;
    }

    public Animal getSire() {
        return sire;
    }

    public void setSire(Animal sire) {
        this.sire = sire;
    }

    public String getGestationDiagnosisResult() {
        return gestationDiagnosisResult;
    }

    public void setGestationDiagnosisResult(String gestationDiagnosisResult) {
        this.gestationDiagnosisResult = gestationDiagnosisResult;
    }

    public OffsetDateTime getExpectedCalvingDate() {
        return expectedCalvingDate;
    }

    public void setExpectedCalvingDate(OffsetDateTime expectedCalvingDate) {
        this.expectedCalvingDate = expectedCalvingDate;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public AppUser getAdministeredBy() {
        return administeredBy;
    }

    public void setAdministeredBy(AppUser administeredBy) {
        this.administeredBy = administeredBy;
    }

    @Override
    public UUID getRecorderId() {
        return administeredBy != null ? administeredBy.getId() : null;
    }

    @Override
    public Collection<Animal> getAffectedAnimals() {
        List<Animal> affected = new ArrayList<>(2);
        if (animal != null) {
            affected.add(animal);
        }
        if (sire != null) {
            affected.add(sire);
        }
        return affected;
    }
}
