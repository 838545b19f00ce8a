package com.medflow.backend.modules.occupancy.application;

import com.medflow.backend.modules.occupancy.domain.OccupancyLevel;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Utilization bands shown to dashboards. They are informational; capacity itself is enforced on exam start.
 */
@Component
public class OccupancyThresholds {

    private final double warningUtilization;
    private final double fullUtilization;

    public OccupancyThresholds(
            @Value("${medflow.occupancy.warning-utilization:0.70}") double warningUtilization,
            @Value("${medflow.occupancy.full-utilization:1.0}") double fullUtilization
    ) {
        if (warningUtilization <= 0 || fullUtilization <= 0 || warningUtilization > fullUtilization) {
            throw new IllegalArgumentException("occupancy thresholds must satisfy 0 < warning <= full");
        }
        this.warningUtilization = warningUtilization;
        this.fullUtilization = fullUtilization;
    }

    public static double utilization(long inExam, int capacity) {
        return capacity <= 0 ? 1.0 : (double) inExam / capacity;
    }

    public OccupancyLevel classify(double utilization) {
        if (utilization >= fullUtilization) {
            return OccupancyLevel.FULL;
        }
        if (utilization >= warningUtilization) {
            return OccupancyLevel.WARNING;
        }
        return OccupancyLevel.NORMAL;
    }

    public double getWarningUtilization() {
        return warningUtilization;
    }

    public double getFullUtilization() {
        return fullUtilization;
    }
}
