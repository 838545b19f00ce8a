package com.medflow.backend.modules.tracking.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.medflow.backend.modules.tracking.domain.TrackingAction;
import com.medflow.backend.modules.tracking.domain.TrackingHistory;
import com.medflow.backend.modules.tracking.domain.TrackingStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoryEntryResponse(
        Long entryId,
        UUID patientId,
        LocalDate examDate,
        String stationCode,
        TrackingStatus status,
        TrackingAction action,
        OffsetDateTime occurredAt,
        String actorId,
        String notes
) {

    public static HistoryEntryResponse from(TrackingHistory entry) {
        return new HistoryEntryResponse(
                entry.getId(),
                entry.getPatientId(),
                entry.getExamDate(),
                entry.getStationCode(),
                entry.getStatus(),
                entry.getAction(),
                entry.getOccurredAt(),
                entry.getActorId(),
                entry.getNotes()
        );
    }
}
