package com.medflow.backend.modules.patient.presentation.dto;

import java.time.LocalDate;
import java.util.List;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RegisterPatientRequest(
        @NotBlank @Size(max = 50) String chartNo,
        @NotBlank @Size(max = 100) String fullName,
        @NotNull LocalDate checkupDate,
        @Min(0) @Max(3) Integer vipLevel,
        @Size(max = 1000) String notes,
        List<String> requiredExamCodes
) {
}
