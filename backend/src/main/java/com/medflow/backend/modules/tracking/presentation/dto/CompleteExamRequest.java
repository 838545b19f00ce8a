package com.medflow.backend.modules.tracking.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CompleteExamRequest(
        @NotNull LocalDate examDate,
        @Size(max = 1000) String notes
) {
}
