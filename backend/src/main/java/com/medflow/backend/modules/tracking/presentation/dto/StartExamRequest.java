package com.medflow.backend.modules.tracking.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotNull;

public record StartExamRequest(@NotNull LocalDate examDate) {
}
