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
import com.mifinca.backend.modules.farm.domain.Product;
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
 * Vaccination, treatment or check-up applied to one or more animals.
 */
@Entity
@Table(name = "health_event")
public class HealthEvent extends AbstractTimestampedEntity implements AnimalScopedRecord {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "event_type_id", nullable = false)
    private MasterData eventType;

    @Column(name = "event_date", nullable = false)
    private OffsetDateTime eventDate;

    @Column(name = "description")
    private String description;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "product_id")
    private Product product;

    @Column(name = "quantity", precision = 14, scale = 3)
    private BigDecimal quantity;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "unit_id")
    private MasterData unit;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "administered_by_user_id", nullable = false)
    private AppUser administeredBy;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "health_event_animal",
            joinColumns = @JoinColumn(name = "health_event_id"),
            inverseJoinColumns = @JoinColumn(name = "animal_id"))
    private Set<Animal> animals = new LinkedHashSet<>();

    public UUID getId() {
        return id;
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

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Product getProduct() {
        return product;
    }

    public void setProduct(Product product) {
        this.product = product;
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

    public AppUser getAdministeredBy() {
        return administeredBy;
    }

    public void setAdministeredBy(AppUser administeredBy) {
        this.administeredBy = administeredBy;
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
        return administeredBy != null ? administeredBy.getId() : null;
    }

    @Override
    public Collection<Animal> getAffectedAnimals() {
        return animals;
    }
}
