package com.medflow.backend.modules.station.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateStationRequest(
        @NotBlank @Size(max = 20) String code,
        @NotBlank @Size(max = 100) String name,
        @Size(max = 100) String location,
        @NotNull @Min(1) Integer durationMinutes,
        @NotNull @Min(1) Integer capacity,
        Boolean fastingPreferred,
        List<String> predecessorCodes
) {
}
