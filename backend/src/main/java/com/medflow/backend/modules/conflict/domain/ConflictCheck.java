package com.medflow.backend.modules.conflict.domain;

import java.util.List;
import java.util.Set;

import com.medflow.backend.modules.equipment.domain.EquipmentStatus;

/**
 * Inputs of a conflict check for one candidate station. {@code requiredStationCodes} is the
 * patient's package; an empty package means every predecessor counts. {@code currentStationCode}
 * is where the patient is now, null when unknown.
 */
public record ConflictCheck(
        String stationCode,
        int capacity,
        long inExam,
        EquipmentStatus equipmentStatus,
        List<String> predecessorCodes,
        Set<String> completedStationCodes,
        List<String> requiredStationCodes,
        String currentStationCode
) {

    public ConflictCheck(
            String stationCode,
            int capacity,
            long inExam,
            EquipmentStatus equipmentStatus,
            List<String> predecessorCodes,
            Set<String> completedStationCodes,
            List<String> requiredStationCodes
    ) {
        this(stationCode, capacity, inExam, equipmentStatus, predecessorCodes, completedStationCodes,
                requiredStationCodes, null);
    }

    public ConflictCheck {
        equipmentStatus = equipmentStatus != null ? equipmentStatus : EquipmentStatus.NORMAL;
        predecessorCodes = predecessorCodes != null ? List.copyOf(predecessorCodes) : List.of();
        completedStationCodes = completedStationCodes != null ? Set.copyOf(completedStationCodes) : Set.of();
        requiredStationCodes = requiredStationCodes != null ? List.copyOf(requiredStationCodes) : List.of();
    }
}
