package com.medflow.backend.modules.recommendation.domain;

import java.time.LocalTime;
import java.util.List;
import java.util.Set;

/**
 * Patient-side inputs shared by every rule. {@code facilityTime} is the wall clock at the facility.
 */
public record ScoringContext(
        List<String> requiredStationCodes,
        Set<String> completedStationCodes,
        LocalTime facilityTime
) {

    public ScoringContext {
        requiredStationCodes = requiredStationCodes != null ? List.copyOf(requiredStationCodes) : List.of();
        completedStationCodes = completedStationCodes != null ? Set.copyOf(completedStationCodes) : Set.of();
    }
}
