package com.medflow.backend.modules.conflict.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Raised when an assignment is attempted against a station whose equipment is broken.
 * Listeners observe it whether or not the attempt commits.
 */
public record EquipmentBrokenDetectedEvent(
        String stationCode,
        UUID patientId,
        LocalDate examDate,
        String requestedBy,
        OffsetDateTime detectedAt
) {
}
