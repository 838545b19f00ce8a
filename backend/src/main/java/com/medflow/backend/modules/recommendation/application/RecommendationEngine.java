package com.medflow.backend.modules.recommendation.application;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.medflow.backend.modules.recommendation.application.rule.ScoringRule;
import com.medflow.backend.modules.recommendation.domain.CandidateStation;
import com.medflow.backend.modules.recommendation.domain.ScoreContribution;
import com.medflow.backend.modules.recommendation.domain.ScoringContext;
import com.medflow.backend.modules.recommendation.domain.StationRecommendation;

import org.springframework.stereotype.Component;

/**
 * Scores candidates with every rule and ranks them by score, highest first, then by station code.
 * Has no side effects.
 */
@Component
public class RecommendationEngine {

    static final Comparator<StationRecommendation> RANKING = Comparator
            .comparingInt(StationRecommendation::score).reversed()
            .thenComparing(StationRecommendation::stationCode);

    private final List<ScoringRule> rules;
    private final RecommendationSettings settings;

    public RecommendationEngine(List<ScoringRule> rules, RecommendationSettings settings) {
        this.rules = List.copyOf(rules);
        this.settings = settings;
    }

    public List<StationRecommendation> rank(List<CandidateStation> candidates, ScoringContext context) {
        List<StationRecommendation> ranked = new ArrayList<>(candidates.size());
        for (CandidateStation candidate : candidates) {
            ranked.add(score(candidate, context));
        }
        ranked.sort(RANKING);
        return List.copyOf(ranked);
    }

    public StationRecommendation score(CandidateStation candidate, ScoringContext context) {
        int score = settings.getBaseScore();
        List<ScoreContribution> reasons = new ArrayList<>();
        for (ScoringRule rule : rules) {
            rule.score(candidate, context).ifPresent(reasons::add);
        }
        for (ScoreContribution reason : reasons) {
            score += reason.delta();
        }
        return new StationRecommendation(
                candidate.stationCode(),
                candidate.stationName(),
                score,
                candidate.waiting(),
                candidate.equipmentStatus(),
                reasons
        );
    }
}
