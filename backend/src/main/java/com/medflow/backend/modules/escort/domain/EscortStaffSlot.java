package com.medflow.backend.modules.escort.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * Lock row for one staff member on one exam date. Escort changes that move the staff member take it
 * after the patient lock.
 */
@Entity
@Table(
        name = "escort_staff_slot",
        uniqueConstraints = @UniqueConstraint(name = "uq_escort_staff_slot", columnNames = {"staff_id", "exam_date"})
)
public class EscortStaffSlot {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "staff_id", nullable = false, updatable = false, length = 128)
    private String staffId;

    @Column(name = "exam_date", nullable = false, updatable = false)
    private LocalDate examDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected EscortStaffSlot() {
    }

    public EscortStaffSlot(String staffId, LocalDate examDate, OffsetDateTime createdAt) {
        this.staffId = staffId;
        this.examDate = examDate;
        this.createdAt = createdAt;
    }

    public UUID getId() {
        return id;
    }

    public String getStaffId() {
        return staffId;
    }

    public LocalDate getExamDate() {
        return examDate;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
