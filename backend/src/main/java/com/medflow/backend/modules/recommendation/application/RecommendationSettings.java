package com.medflow.backend.modules.recommendation.application;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class RecommendationSettings {

    private final int baseScore;
    private final int waitingWeight;
    private final int dependencyPenalty;
    private final int brokenEquipmentPenalty;
    private final int warningEquipmentPenalty;
    private final int fastingAdjustment;
    private final int fastingCutoffHour;

    public RecommendationSettings(
            @Value("${medflow.recommendation.base-score:100}") int baseScore,
            @Value("${medflow.recommendation.waiting-weight:10}") int waitingWeight,
            @Value("${medflow.recommendation.dependency-penalty:1000}") int dependencyPenalty,
            @Value("${medflow.recommendation.broken-equipment-penalty:1000}") int brokenEquipmentPenalty,
            @Value("${medflow.recommendation.warning-equipment-penalty:30}") int warningEquipmentPenalty,
            @Value("${medflow.recommendation.fasting-adjustment:20}") int fastingAdjustment,
            @Value("${medflow.recommendation.fasting-cutoff-hour:10}") int fastingCutoffHour
    ) {
        this.baseScore = baseScore;
        this.waitingWeight = waitingWeight;
        this.dependencyPenalty = dependencyPenalty;
        this.brokenEquipmentPenalty = brokenEquipmentPenalty;
        this.warningEquipmentPenalty = warningEquipmentPenalty;
        this.fastingAdjustment = fastingAdjustment;
        this.fastingCutoffHour = fastingCutoffHour;
    }

    public static RecommendationSettings defaults() {
        return new RecommendationSettings(100, 10, 1000, 1000, 30, 20, 10);
    }

    public int getBaseScore() {
        return baseScore;
    }

    public int getWaitingWeight() {
        return waitingWeight;
    }

    public int getDependencyPenalty() {
        return dependencyPenalty;
    }

    public int getBrokenEquipmentPenalty() {
        return brokenEquipmentPenalty;
    }

    public int getWarningEquipmentPenalty() {
        return warningEquipmentPenalty;
    }

    public int getFastingAdjustment() {
        return fastingAdjustment;
    }

    public int getFastingCutoffHour() {
        return fastingCutoffHour;
    }
}
