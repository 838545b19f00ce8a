package com.medflow.backend.modules.recommendation.domain;

import java.util.List;

import com.medflow.backend.modules.equipment.domain.EquipmentStatus;
import com.medflow.backend.modules.occupancy.domain.StationOccupancy;

public record CandidateStation(
        String stationCode,
        String stationName,
        boolean fastingPreferred,
        List<String> predecessorCodes,
        StationOccupancy occupancy,
        EquipmentStatus equipmentStatus
) {

    public CandidateStation {
        predecessorCodes = predecessorCodes != null ? List.copyOf(predecessorCodes) : List.of();
        equipmentStatus = equipmentStatus != null ? equipmentStatus : EquipmentStatus.NORMAL;
    }

    public long waiting() {
        return occupancy != null ? occupancy.waiting() : 0;
    }
}
