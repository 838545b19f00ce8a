package com.medflow.backend.modules.recommendation.presentation;

import java.time.LocalDate;
import java.util.UUID;

import com.medflow.backend.modules.recommendation.application.RecommendationService;
import com.medflow.backend.modules.recommendation.domain.Recommendation;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/recommendations")
@Tag(name = "Recommendations")
public class RecommendationController {

    private final RecommendationService recommendationService;

    public RecommendationController(RecommendationService recommendationService) {
        this.recommendationService = recommendationService;
    }

    @GetMapping("/{patientId}")
    @Operation(summary = "Ranked next-station suggestions; read only")
    public ResponseEntity<Recommendation> recommend(
            @PathVariable("patientId") UUID patientId,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(recommendationService.getRecommendation(patientId, date));
    }
}
