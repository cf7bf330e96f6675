package com.mifinca.backend.modules.animal.domain;

import java.time.LocalDate;
import java.util.UUID;

import com.mifinca.backend.global.jpa.AbstractTimestampedEntity;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.farm.domain.Lot;
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
 * Animal owned directly by a user. When placed in a lot it also becomes visible to everyone
 * with access to that lot's farm.
 */
@Entity
@Table(name = "animal")
public class Animal extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "tag_id", nullable = false, length = 60)
    private String tagId;

    @Column(name = "name", length = 120)
    private String name;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "species_id")
    private MasterData species;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "breed_id")
    private MasterData breed;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "sex_id")
    private MasterData sex;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "status_id")
    private MasterData status;

    @Column(name = "date_of_birth")
    private LocalDate dateOfBirth;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "owner_user_id", nullable = false)
    private AppUser owner;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "current_lot_id")
    private Lot currentLot;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "mother_animal_id")
    private Animal mother;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "father_animal_id")
    private Animal father;

    @Column(name = "notes")
    private String notes;

    public UUID getId() {
        return id;
    }

    public String getTagId() {
        return tagId;
    }

    public void setTagId(String tagId) {
        this.tagId = tagId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public MasterData getSpecies() {
        return species;
    }

    public void setSpecies(MasterData species) {
        this.species = species;
    }

    public MasterData getBreed() {
        return breed;
    }

    public void setBreed(MasterData breed) {
        this.breed = breed;
    }

    public MasterData getSex() {
        return sex;
    }

    public void setSex(MasterData sex) {
        this.sex = sex;
    }

    public MasterData getStatus() {
        return status;
    }

    public void setStatus(MasterData status) {
        this.status = status;
    }

    public LocalDate getDateOfBirth() {
        return dateOfBirth;
    }

    public void setDateOfBirth(LocalDate dateOfBirth) {
        this.dateOfBirth = dateOfBirth;
    }

    public AppUser getOwner() {
        return owner;
    }

    public void setOwner(AppUser owner) {
        this.owner = owner;
    }

    public UUID getOwnerId() {
        return owner != null ? owner.getId() : null;
    }

    public Lot getCurrentLot() {
        return currentLot;
    }

    public void setCurrentLot(Lot currentLot) {
        this.currentLot = currentLot;
    }

    public Animal getMother() {
        return mother;
    }

    public void setMother(Animal mother) {
        this.mother = mother;
    }

    public Animal getFather() {
        return father;
    }

    public void setFather(Animal father) {
        this.father = father;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}
