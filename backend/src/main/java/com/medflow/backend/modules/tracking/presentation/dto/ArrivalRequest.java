package com.medflow.backend.modules.tracking.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ArrivalRequest(
        @NotNull LocalDate examDate,
        @NotBlank @Size(max = 20) String stationCode
) {
}
