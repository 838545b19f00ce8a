package com.medflow.backend.modules.equipment.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medflow.backend.modules.equipment.domain.EquipmentStatus;

public record EquipmentFailureReportedEvent(
        UUID equipmentId,
        String equipmentName,
        String stationCode,
        EquipmentStatus newStatus,
        String description,
        String reportedBy,
        OffsetDateTime reportedAt
) {
}
