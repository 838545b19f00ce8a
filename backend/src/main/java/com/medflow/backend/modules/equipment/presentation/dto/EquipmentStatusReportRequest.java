package com.medflow.backend.modules.equipment.presentation.dto;

import jakarta.validation.constraints.Size;

public record EquipmentStatusReportRequest(
        @Size(max = 500) String description
) {
}
