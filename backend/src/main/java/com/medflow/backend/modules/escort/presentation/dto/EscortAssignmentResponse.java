package com.medflow.backend.modules.escort.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.medflow.backend.modules.escort.domain.EscortAssignment;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EscortAssignmentResponse(
        UUID assignmentId,
        UUID patientId,
        LocalDate examDate,
        String staffId,
        OffsetDateTime assignedAt,
        String assignedBy,
        boolean active,
        OffsetDateTime releasedAt,
        String releasedBy
) {

    public static EscortAssignmentResponse from(EscortAssignment assignment) {
        return new EscortAssignmentResponse(
                assignment.getId(),
                assignment.getPatientId(),
                assignment.getExamDate(),
                assignment.getStaffId(),
                assignment.getAssignedAt(),
                assignment.getAssignedBy(),
                assignment.isActive(),
                assignment.getReleasedAt(),
                assignment.getReleasedBy()
        );
    }
}
