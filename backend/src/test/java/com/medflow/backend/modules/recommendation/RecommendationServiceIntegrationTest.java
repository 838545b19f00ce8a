package com.medflow.backend.modules.recommendation;

import static com.medflow.backend.support.TestFixtures.EXAM_DATE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;

import com.medflow.backend.global.error.NotFoundException;
import com.medflow.backend.modules.equipment.domain.EquipmentStatus;
import com.medflow.backend.modules.recommendation.application.RecommendationService;
import com.medflow.backend.modules.recommendation.domain.Recommendation;
import com.medflow.backend.modules.recommendation.domain.StationRecommendation;
import com.medflow.backend.modules.tracking.application.TrackingService;
import com.medflow.backend.support.AbstractIntegrationTest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class RecommendationServiceIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private RecommendationService recommendationService;

    @Autowired
    private TrackingService trackingService;

    @Test
    @DisplayName("candidates are the open stations of the package, minus the one the patient is at")
    void candidatesComeFromPackage() {
        UUID id = fixtures.patient("R-001", "PHY", "BLOOD", "XRAY", "CARDIO").getId();
        trackingService.reportArrival(id, EXAM_DATE, "PHY", "nurse-1");
        trackingService.reportStart(id, EXAM_DATE, "nurse-1");
        trackingService.reportComplete(id, EXAM_DATE, "nurse-1", null);
        trackingService.reportArrival(id, EXAM_DATE, "BLOOD", "nurse-1");

        Recommendation recommendation = recommendationService.getRecommendation(id, EXAM_DATE);

        assertThat(recommendation.ranking()).extracting(StationRecommendation::stationCode)
                .containsExactly("CARDIO", "XRAY");
        assertThat(recommendation.suggested().stationCode()).isEqualTo("CARDIO");
    }

    @Test
    @DisplayName("busy and broken stations sink in the ranking")
    void loadAndEquipmentShapeRanking() {
        UUID other = fixtures.patient("R-002", "XRAY").getId();
        trackingService.reportArrival(other, EXAM_DATE, "XRAY", "nurse-1");
        fixtures.setEquipmentStatus("CARDIO", EquipmentStatus.BROKEN);
        UUID id = fixtures.patient("R-003", "PHY", "XRAY", "CARDIO").getId();

        Recommendation recommendation = recommendationService.getRecommendation(id, EXAM_DATE);

        assertThat(recommendation.ranking()).extracting(StationRecommendation::stationCode)
                .containsExactly("PHY", "XRAY", "CARDIO");
        assertThat(recommendation.ranking().get(1).waiting()).isEqualTo(1);
        assertThat(recommendation.ranking().get(2).equipmentStatus()).isEqualTo(EquipmentStatus.BROKEN);
    }

    @Test
    void completedPatientGetsNothing() {
        UUID id = fixtures.patient("R-004", "PHY").getId();
        trackingService.reportArrival(id, EXAM_DATE, "PHY", "nurse-1");
        trackingService.reportStart(id, EXAM_DATE, "nurse-1");
        trackingService.reportComplete(id, EXAM_DATE, "nurse-1", null);

        Recommendation recommendation = recommendationService.getRecommendation(id, EXAM_DATE);

        assertThat(recommendation.ranking()).isEmpty();
        assertThat(recommendation.suggested()).isNull();
    }

    @Test
    void otherDateIsNotFound() {
        UUID id = fixtures.patient("R-010", "PHY").getId();

        assertThatThrownBy(() -> recommendationService.getRecommendation(id, EXAM_DATE.minusDays(1)))
                .isInstanceOf(NotFoundException.class);
    }
}
