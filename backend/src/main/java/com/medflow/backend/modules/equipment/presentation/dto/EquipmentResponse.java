package com.medflow.backend.modules.equipment.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.medflow.backend.modules.equipment.domain.Equipment;
import com.medflow.backend.modules.equipment.domain.EquipmentStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EquipmentResponse(
        UUID equipmentId,
        String name,
        String stationCode,
        String equipmentType,
        String description,
        EquipmentStatus status,
        OffsetDateTime updatedAt
) {

    public static EquipmentResponse from(Equipment equipment) {
        return new EquipmentResponse(
                equipment.getId(),
                equipment.getName(),
                equipment.getStationCode(),
                equipment.getEquipmentType(),
                equipment.getDescription(),
                equipment.getStatus(),
                equipment.getUpdatedAt()
        );
    }
}
