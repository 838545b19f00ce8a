package com.medflow.backend.modules.patient.presentation.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.medflow.backend.modules.patient.domain.Patient;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PatientResponse(
        UUID patientId,
        String chartNo,
        String fullName,
        LocalDate checkupDate,
        boolean active,
        int vipLevel,
        String notes,
        List<String> requiredExamCodes
) {

    public static PatientResponse from(Patient patient) {
        return new PatientResponse(
                patient.getId(),
                patient.getChartNo(),
                patient.getFullName(),
                patient.getCheckupDate(),
                patient.isActive(),
                patient.getVipLevel(),
                patient.getNotes(),
                List.copyOf(patient.getRequiredExamCodes())
        );
    }
}
