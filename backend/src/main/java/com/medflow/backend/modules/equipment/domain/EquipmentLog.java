package com.medflow.backend.modules.equipment.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Immutable
@Table(name = "equipment_log")
public class EquipmentLog {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "equipment_id", nullable = false)
    private Equipment equipment;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 32)
    private EquipmentLogAction action;

    @Enumerated(EnumType.STRING)
    @Column(name = "old_status", length = 20)
    private EquipmentStatus oldStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", length = 20)
    private EquipmentStatus newStatus;

    @Column(name = "description")
    private String description;

    @Column(name = "operator_id", length = 128)
    private String operatorId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected EquipmentLog() {
    }

    public EquipmentLog(
            Equipment equipment,
            EquipmentLogAction action,
            EquipmentStatus oldStatus,
            EquipmentStatus newStatus,
            String description,
            String operatorId,
            OffsetDateTime createdAt
    ) {
        this.equipment = equipment;
        this.action = action;
        this.oldStatus = oldStatus;
        this.newStatus = newStatus;
        this.description = description;
        this.operatorId = operatorId;
        this.createdAt = createdAt;
    }

    public UUID getId() {
        return id;
    }

    public Equipment getEquipment() {
        return equipment;
    }

    public EquipmentLogAction getAction() {
        return action;
    }

    public EquipmentStatus getOldStatus() {
        return oldStatus;
    }

    public EquipmentStatus getNewStatus() {
        return newStatus;
    }

    public String getDescription() {
        return description;
    }

    public String getOperatorId() {
        return operatorId;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
