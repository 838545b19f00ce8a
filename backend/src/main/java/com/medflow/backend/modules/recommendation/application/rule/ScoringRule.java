package com.medflow.backend.modules.recommendation.application.rule;

import java.util.Optional;

import com.medflow.backend.modules.recommendation.domain.CandidateStation;
import com.medflow.backend.modules.recommendation.domain.ScoreContribution;
import com.medflow.backend.modules.recommendation.domain.ScoringContext;

/**
 * One independent term of a candidate's score. Rules must be pure: same inputs, same contribution.
 */
public interface ScoringRule {

    String name();

    Optional<ScoreContribution> score(CandidateStation candidate, ScoringContext context);
}
