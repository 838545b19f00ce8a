package com.medflow.backend.modules.recommendation.application.rule;

import java.util.List;
import java.util.Optional;

import com.medflow.backend.modules.recommendation.application.RecommendationSettings;
import com.medflow.backend.modules.recommendation.domain.CandidateStation;
import com.medflow.backend.modules.recommendation.domain.ScoreContribution;
import com.medflow.backend.modules.recommendation.domain.ScoringContext;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Penalizes stations whose predecessors are still open. Predecessors outside a booked package are ignored.
 */
@Component
@Order(20)
public class DependencyRule implements ScoringRule {

    private final RecommendationSettings settings;

    public DependencyRule(RecommendationSettings settings) {
        this.settings = settings;
    }

    @Override
    public String name() {
        return "DEPENDENCY";
    }

    @Override
    public Optional<ScoreContribution> score(CandidateStation candidate, ScoringContext context) {
        List<String> unmet = candidate.predecessorCodes().stream()
                .filter(code -> !context.completedStationCodes().contains(code))
                .filter(code -> context.requiredStationCodes().isEmpty() || context.requiredStationCodes().contains(code))
                .toList();
        if (unmet.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ScoreContribution(name(), -settings.getDependencyPenalty(),
                "complete " + String.join(", ", unmet) + " first"));
    }
}
