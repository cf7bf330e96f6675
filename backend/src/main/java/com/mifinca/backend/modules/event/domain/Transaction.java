package com.mifinca.backend.modules.event.domain;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.mifinca.backend.global.jpa.AbstractTimestampedEntity;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.farm.domain.Farm;
import com.mifinca.backend.modules.masterdata.domain.MasterData;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Sale, purchase or transfer of a {@link TransactionSubject} from one owner (and farm) to another.
 * The sender is fixed at creation.
 */
@Entity
@Table(name = "farm_transaction")
public class Transaction extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "transaction_type_id", nullable = false)
    private MasterData transactionType;

    @Column(name = "transaction_date", nullable = false)
    private OffsetDateTime transactionDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "subject_kind", nullable = false, length = 16)
    private TransactionSubjectKind subjectKind;

    @Column(name = "subject_id", nullable = false, columnDefinition = "uuid")
    private UUID subjectId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "from_owner_user_id", nullable = false, updatable = false)
    private AppUser fromOwner;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "to_owner_user_id")
    private AppUser toOwner;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "from_farm_id")
    private Farm fromFarm;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "to_farm_id")
    private Farm toFarm;

    @Column(name = "quantity", precision = 14, scale = 3)
    private BigDecimal quantity;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "unit_id")
    private MasterData unit;

    @Column(name = "price_per_unit", precision = 14, scale = 2)
    private BigDecimal pricePerUnit;

    @Column(name = "total_amount", precision = 16, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "notes")
    private String notes;

    public UUID getId() {
        return id;
    }

    public MasterData getTransactionType() {
        return transactionType;
    }

    public void setTransactionType(MasterData transactionType) {
        this.transactionType = transactionType;
    }

    public OffsetDateTime getTransactionDate() {
        return transactionDate;
    }

    public void setTransactionDate(OffsetDateTime transactionDate) {
        this.transactionDate = transactionDate;
    }

    public TransactionSubject getSubject() {
        return TransactionSubject.of(subjectKind, subjectId);
    }

    public void setSubject(TransactionSubject subject) {
        this.subjectKind = subject.kind();
        this.subjectId = subject.id();
    }

    public AppUser getFromOwner() {
        return fromOwner;
    }

    public void setFromOwner(AppUser fromOwner) {
        this.fromOwner = fromOwner;
    }

    public UUID getFromOwnerId() {
        return fromOwner != null ? fromOwner.getId() : null;
    }

    public AppUser getToOwner() {
        return toOwner;
    }

    public void setToOwner(AppUser toOwner) {
        this.toOwner = toOwner;
    }

    public UUID getToOwnerId() {
        return toOwner != null ? toOwner.getId() : null;
    }

    public Farm getFromFarm() {
        return fromFarm;
    }

    public void setFromFarm(Farm fromFarm) {
        this.fromFarm = fromFarm;
    }

    public Farm getToFarm() {
        return toFarm;
    }

    public void setToFarm(Farm toFarm) {
        this.toFarm = toFarm;
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

    public BigDecimal getPricePerUnit() {
        return pricePerUnit;
    }

    public void setPricePerUnit(BigDecimal pricePerUnit) {
        this.pricePerUnit = pricePerUnit;
    }

    public BigDecimal getTotalAmount() {
        return totalAmount;
    }

    public void setTotalAmount(BigDecimal totalAmount) {
        this.totalAmount = totalAmount;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}
