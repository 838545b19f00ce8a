package com.medflow.backend.modules.patient.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotNull;

public record UpdateRequiredExamsRequest(
        @NotNull List<String> requiredExamCodes
) {
}
