package com.medflow.backend.modules.tracking.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * {@code reason} is only read by the override endpoint, where it is mandatory.
 */
public record AssignNextStationRequest(
        @NotNull LocalDate examDate,
        @NotBlank @Size(max = 20) String stationCode,
        @Size(max = 500) String reason
) {
}
