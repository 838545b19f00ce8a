package com.medflow.backend.modules.recommendation.application.rule;

import java.util.Optional;

import com.medflow.backend.modules.recommendation.application.RecommendationSettings;
import com.medflow.backend.modules.recommendation.domain.CandidateStation;
import com.medflow.backend.modules.recommendation.domain.ScoreContribution;
import com.medflow.backend.modules.recommendation.domain.ScoringContext;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Fasting-preferred stations get a bonus before the cutoff hour and a penalty from the cutoff on.
 */
@Component
@Order(40)
public class FastingTimeRule implements ScoringRule {

    private final RecommendationSettings settings;

    public FastingTimeRule(RecommendationSettings settings) {
        this.settings = settings;
    }

    @Override
    public String name() {
        return "FASTING_TIME";
    }

    @Override
    public Optional<ScoreContribution> score(CandidateStation candidate, ScoringContext context) {
        if (!candidate.fastingPreferred() || context.facilityTime() == null) {
            return Optional.empty();
        }
        int cutoff = settings.getFastingCutoffHour();
        if (context.facilityTime().getHour() < cutoff) {
            return Optional.of(new ScoreContribution(name(), settings.getFastingAdjustment(),
                    "fasting-friendly before " + cutoff + ":00"));
        }
        return Optional.of(new ScoreContribution(name(), -settings.getFastingAdjustment(),
                "fasting window passed at " + cutoff + ":00"));
    }
}
