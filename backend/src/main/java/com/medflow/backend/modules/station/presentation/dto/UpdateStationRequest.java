package com.medflow.backend.modules.station.presentation.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdateStationRequest(
        @Size(max = 100) String name,
        @Size(max = 100) String location,
        @Min(1) Integer durationMinutes,
        @Min(1) Integer capacity,
        Boolean active,
        Boolean fastingPreferred,
        List<String> predecessorCodes
) {
}
