package com.medflow.backend.modules.tracking.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

/**
 * Append-only record of a committed transition. The identity column doubles as the append order.
 */
@Entity
@Immutable
@Table(name = "tracking_history")
public class TrackingHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "patient_id", nullable = false, updatable = false)
    private UUID patientId;

    @Column(name = "exam_date", nullable = false, updatable = false)
    private LocalDate examDate;

    @Column(name = "station_code", length = 20, updatable = false)
    private String stationCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20, updatable = false)
    private TrackingStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 20, updatable = false)
    private TrackingAction action;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private OffsetDateTime occurredAt;

    @Column(name = "actor_id", length = 128, updatable = false)
    private String actorId;

    @Column(name = "notes", updatable = false)
    private String notes;

    protected TrackingHistory() {
    }

    public TrackingHistory(
            UUID patientId,
            LocalDate examDate,
            String stationCode,
            TrackingStatus status,
            TrackingAction action,
            OffsetDateTime occurredAt,
            String actorId,
            String notes
    ) {
        this.patientId = patientId;
        this.examDate = examDate;
        this.stationCode = stationCode;
        this.status = status;
        this.action = action;
        this.occurredAt = occurredAt;
        this.actorId = actorId;
        this.notes = notes;
    }

    public Long getId() {
        return id;
    }

    public UUID getPatientId() {
        return patientId;
    }

    public LocalDate getExamDate() {
        return examDate;
    }

    public String getStationCode() {
        return stationCode;
    }

    public TrackingStatus getStatus() {
        return status;
    }

    public TrackingAction getAction() {
        return action;
    }

    public OffsetDateTime getOccurredAt() {
        return occurredAt;
    }

    public String getActorId() {
        return actorId;
    }

    public String getNotes() {
        return notes;
    }
}
