package com.medflow.backend.modules.equipment.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterEquipmentRequest(
        @NotBlank @Size(max = 100) String name,
        @NotBlank @Size(max = 20) String stationCode,
        @Size(max = 50) String equipmentType,
        String description
) {
}
