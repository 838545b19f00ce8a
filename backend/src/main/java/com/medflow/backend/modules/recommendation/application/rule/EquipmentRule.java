package com.medflow.backend.modules.recommendation.application.rule;

import java.util.Optional;

import com.medflow.backend.modules.recommendation.application.RecommendationSettings;
import com.medflow.backend.modules.recommendation.domain.CandidateStation;
import com.medflow.backend.modules.recommendation.domain.ScoreContribution;
import com.medflow.backend.modules.recommendation.domain.ScoringContext;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(30)
public class EquipmentRule implements ScoringRule {

    private final RecommendationSettings settings;

    public EquipmentRule(RecommendationSettings settings) {
        this.settings = settings;
    }

    @Override
    public String name() {
        return "EQUIPMENT";
    }

    @Override
    public Optional<ScoreContribution> score(CandidateStation candidate, ScoringContext context) {
        return switch (candidate.equipmentStatus()) {
            case BROKEN -> Optional.of(new ScoreContribution(name(), -settings.getBrokenEquipmentPenalty(), "equipment broken"));
            case WARNING -> Optional.of(new ScoreContribution(name(), -settings.getWarningEquipmentPenalty(), "equipment warning"));
            case NORMAL -> Optional.empty();
        };
    }
}
