package com.medflow.backend.modules.escort.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Staff member escorting a patient on an exam date. At most one row per (patient, date) is active.
 */
@Entity
@Table(name = "escort_assignment")
public class EscortAssignment {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "patient_id", nullable = false, updatable = false)
    private UUID patientId;

    @Column(name = "exam_date", nullable = false, updatable = false)
    private LocalDate examDate;

    @Column(name = "staff_id", nullable = false, updatable = false, length = 128)
    private String staffId;

    @Column(name = "assigned_at", nullable = false, updatable = false)
    private OffsetDateTime assignedAt;

    @Column(name = "assigned_by", length = 128, updatable = false)
    private String assignedBy;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "released_at")
    private OffsetDateTime releasedAt;

    @Column(name = "released_by", length = 128)
    private String releasedBy;

    protected EscortAssignment() {
    }

    public EscortAssignment(UUID patientId, LocalDate examDate, String staffId, String assignedBy, OffsetDateTime assignedAt) {
        this.patientId = patientId;
        this.examDate = examDate;
        this.staffId = staffId;
        this.assignedBy = assignedBy;
        this.assignedAt = assignedAt;
    }

    public void release(String actorId, OffsetDateTime at) {
        this.active = false;
        this.releasedAt = at;
        this.releasedBy = actorId;
    }

    public UUID getId() {
        return id;
    }

    public UUID getPatientId() {
        return patientId;
    }

    public LocalDate getExamDate() {
        return examDate;
    }

    public String getStaffId() {
        return staffId;
    }

    public OffsetDateTime getAssignedAt() {
        return assignedAt;
    }

    public String getAssignedBy() {
        return assignedBy;
    }

    public boolean isActive() {
        return active;
    }

    public OffsetDateTime getReleasedAt() {
        return releasedAt;
    }

    public String getReleasedBy() {
        return releasedBy;
    }
}
