package com.medflow.backend.modules.equipment.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.medflow.backend.modules.equipment.domain.EquipmentLog;
import com.medflow.backend.modules.equipment.domain.EquipmentLogAction;
import com.medflow.backend.modules.equipment.domain.EquipmentStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EquipmentLogResponse(
        UUID logId,
        EquipmentLogAction action,
        EquipmentStatus oldStatus,
        EquipmentStatus newStatus,
        String description,
        String operatorId,
        OffsetDateTime createdAt
) {

    public static EquipmentLogResponse from(EquipmentLog log) {
        return new EquipmentLogResponse(
                log.getId(),
                log.getAction(),
                log.getOldStatus(),
                log.getNewStatus(),
                log.getDescription(),
                log.getOperatorId(),
                log.getCreatedAt()
        );
    }
}
