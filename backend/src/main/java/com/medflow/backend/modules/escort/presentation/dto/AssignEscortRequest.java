package com.medflow.backend.modules.escort.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record AssignEscortRequest(
        @NotNull LocalDate examDate,
        @NotBlank @Size(max = 128) String staffId
) {
}
