package com.medflow.backend.modules.recommendation.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Ranked next stations for a patient. {@code suggested} is the head of the ranking, absent when nothing is left.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Recommendation(
        UUID patientId,
        LocalDate examDate,
        StationRecommendation suggested,
        List<StationRecommendation> ranking,
        OffsetDateTime computedAt
) {
}
