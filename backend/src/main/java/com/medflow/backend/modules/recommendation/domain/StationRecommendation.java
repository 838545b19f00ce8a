package com.medflow.backend.modules.recommendation.domain;

import java.util.List;

import com.medflow.backend.modules.equipment.domain.EquipmentStatus;

public record StationRecommendation(
        String stationCode,
        String stationName,
        int score,
        long waiting,
        EquipmentStatus equipmentStatus,
        List<ScoreContribution> reasons
) {

    public StationRecommendation {
        reasons = List.copyOf(reasons);
    }
}
