package com.medflow.backend.modules.occupancy.domain;

import java.time.OffsetDateTime;

public record WaitTimeEstimate(
        String stationCode,
        String stationName,
        long waiting,
        long inExam,
        int averageDurationMinutes,
        boolean fromHistory,
        int estimatedWaitMinutes,
        OffsetDateTime estimatedReadyAt
) {
}
