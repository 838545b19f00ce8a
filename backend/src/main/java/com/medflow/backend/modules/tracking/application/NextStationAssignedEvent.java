package com.medflow.backend.modules.tracking.application;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

public record NextStationAssignedEvent(
        UUID patientId,
        String chartNo,
        String patientName,
        LocalDate examDate,
        String currentStationCode,
        String nextStationCode,
        String assignedBy,
        boolean override,
        OffsetDateTime assignedAt
) {
}
