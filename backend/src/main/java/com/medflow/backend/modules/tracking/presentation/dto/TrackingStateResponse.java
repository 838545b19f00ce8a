package com.medflow.backend.modules.tracking.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.medflow.backend.modules.tracking.domain.TrackingState;
import com.medflow.backend.modules.tracking.domain.TrackingStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrackingStateResponse(
        UUID patientId,
        LocalDate examDate,
        String currentStationCode,
        TrackingStatus status,
        String nextStationCode,
        OffsetDateTime updatedAt,
        String updatedBy,
        long version
) {

    public static TrackingStateResponse from(TrackingState state) {
        return new TrackingStateResponse(
                state.getPatientId(),
                state.getExamDate(),
                state.getCurrentStationCode(),
                state.getStatus(),
                state.getNextStationCode(),
                state.getUpdatedAt(),
                state.getUpdatedBy(),
                state.getVersion()
        );
    }
}
