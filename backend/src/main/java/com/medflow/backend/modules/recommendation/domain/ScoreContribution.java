package com.medflow.backend.modules.recommendation.domain;

public record ScoreContribution(String rule, int delta, String reason) {
}
