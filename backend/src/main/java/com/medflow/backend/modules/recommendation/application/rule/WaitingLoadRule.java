package com.medflow.backend.modules.recommendation.application.rule;

import java.util.Optional;

import com.medflow.backend.modules.recommendation.application.RecommendationSettings;
import com.medflow.backend.modules.recommendation.domain.CandidateStation;
import com.medflow.backend.modules.recommendation.domain.ScoreContribution;
import com.medflow.backend.modules.recommendation.domain.ScoringContext;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(10)
public class WaitingLoadRule implements ScoringRule {

    private final RecommendationSettings settings;

    public WaitingLoadRule(RecommendationSettings settings) {
        this.settings = settings;
    }

    @Override
    public String name() {
        return "WAITING_LOAD";
    }

    @Override
    public Optional<ScoreContribution> score(CandidateStation candidate, ScoringContext context) {
        long waiting = candidate.waiting();
        if (waiting == 0) {
            return Optional.empty();
        }
        int delta = (int) -(waiting * settings.getWaitingWeight());
        return Optional.of(new ScoreContribution(name(), delta, waiting + " waiting"));
    }
}
