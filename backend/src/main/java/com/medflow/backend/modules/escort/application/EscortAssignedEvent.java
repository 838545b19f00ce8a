package com.medflow.backend.modules.escort.application;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

public record EscortAssignedEvent(
        UUID assignmentId,
        UUID patientId,
        String chartNo,
        String patientName,
        LocalDate examDate,
        String staffId,
        String previousStaffId,
        String assignedBy,
        OffsetDateTime assignedAt
) {
}
