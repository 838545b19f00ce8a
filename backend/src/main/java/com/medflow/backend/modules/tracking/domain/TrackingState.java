package com.medflow.backend.modules.tracking.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;

import org.hibernate.annotations.UuidGenerator;

/**
 * Live position of one patient on one exam date. Only {@code TrackingService} mutates it.
 */
@Entity
@Table(
        name = "tracking_state",
        uniqueConstraints = @UniqueConstraint(name = "uq_tracking_state_patient_date", columnNames = {"patient_id", "exam_date"})
)
public class TrackingState {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "patient_id", nullable = false, updatable = false)
    private UUID patientId;

    @Column(name = "exam_date", nullable = false, updatable = false)
    private LocalDate examDate;

    @Column(name = "current_station_code", length = 20)
    private String currentStationCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TrackingStatus status;

    @Column(name = "next_station_code", length = 20)
    private String nextStationCode;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Column(name = "updated_by", length = 128)
    private String updatedBy;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected TrackingState() {
    }

    public TrackingState(UUID patientId, LocalDate examDate) {
        this.patientId = patientId;
        this.examDate = examDate;
    }

    public void apply(TrackingStatus status, String currentStationCode, String nextStationCode, String actorId, OffsetDateTime at) {
        this.status = status;
        this.currentStationCode = currentStationCode;
        this.nextStationCode = nextStationCode;
        this.updatedBy = actorId;
        this.updatedAt = at;
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

    public String getCurrentStationCode() {
        return currentStationCode;
    }

    public TrackingStatus getStatus() {
        return status;
    }

    public String getNextStationCode() {
        return nextStationCode;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public String getUpdatedBy() {
        return updatedBy;
    }

    public long getVersion() {
        return version;
    }
}
