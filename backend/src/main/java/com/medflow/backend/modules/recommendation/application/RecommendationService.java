package com.medflow.backend.modules.recommendation.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.medflow.backend.modules.equipment.domain.EquipmentStatus;
import com.medflow.backend.modules.occupancy.application.OccupancyService;
import com.medflow.backend.modules.occupancy.domain.OccupancySnapshot;
import com.medflow.backend.modules.occupancy.domain.StationOccupancy;
import com.medflow.backend.modules.patient.application.PatientService;
import com.medflow.backend.modules.patient.domain.Patient;
import com.medflow.backend.modules.recommendation.domain.CandidateStation;
import com.medflow.backend.modules.recommendation.domain.Recommendation;
import com.medflow.backend.modules.recommendation.domain.ScoringContext;
import com.medflow.backend.modules.recommendation.domain.StationRecommendation;
import com.medflow.backend.modules.station.application.StationRegistryService;
import com.medflow.backend.modules.station.domain.Station;
import com.medflow.backend.modules.tracking.application.TrackingService;
import com.medflow.backend.modules.tracking.domain.TrackingState;
import com.medflow.backend.modules.tracking.domain.TrackingStatus;
import com.medflow.backend.modules.tracking.infrastructure.persistence.TrackingStateRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Gathers the inputs of the recommendation engine. Never commits an assignment.
 */
@Service
@Transactional(readOnly = true)
public class RecommendationService {

    private final PatientService patientService;
    private final TrackingService trackingService;
    private final TrackingStateRepository trackingStateRepository;
    private final StationRegistryService stationRegistryService;
    private final OccupancyService occupancyService;
    private final RecommendationEngine recommendationEngine;
    private final Clock clock;
    private final ZoneId facilityZoneId;

    public RecommendationService(
            PatientService patientService,
            TrackingService trackingService,
            TrackingStateRepository trackingStateRepository,
            StationRegistryService stationRegistryService,
            OccupancyService occupancyService,
            RecommendationEngine recommendationEngine,
            Clock clock,
            ZoneId facilityZoneId
    ) {
        this.patientService = patientService;
        this.trackingService = trackingService;
        this.trackingStateRepository = trackingStateRepository;
        this.stationRegistryService = stationRegistryService;
        this.occupancyService = occupancyService;
        this.recommendationEngine = recommendationEngine;
        this.clock = clock;
        this.facilityZoneId = facilityZoneId;
    }

    public Recommendation getRecommendation(UUID patientId, LocalDate examDate) {
        Patient patient = patientService.getPatientOn(patientId, examDate);
        Optional<TrackingState> state = trackingStateRepository.findByPatientIdAndExamDate(patientId, examDate);
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (state.map(current -> current.getStatus() == TrackingStatus.COMPLETED).orElse(false)) {
            return new Recommendation(patientId, examDate, null, List.of(), now);
        }

        Set<String> completed = trackingService.completedStations(patientId, examDate);
        String excluded = state
                .filter(current -> current.getStatus() == TrackingStatus.WAITING || current.getStatus() == TrackingStatus.IN_EXAM)
                .map(TrackingState::getCurrentStationCode)
                .orElse(null);
        List<String> required = List.copyOf(patient.getRequiredExamCodes());
        OccupancySnapshot snapshot = occupancyService.snapshot(examDate);

        List<CandidateStation> candidates = new ArrayList<>();
        for (Station station : stationRegistryService.listStations(false)) {
            String code = station.getCode();
            if (!required.isEmpty() && !required.contains(code)) {
                continue;
            }
            if (completed.contains(code) || code.equals(excluded)) {
                continue;
            }
            StationOccupancy occupancy = snapshot.station(code).orElse(null);
            candidates.add(new CandidateStation(
                    code,
                    station.getName(),
                    station.isFastingPreferred(),
                    station.getPredecessorCodes(),
                    occupancy,
                    occupancy != null ? occupancy.equipmentStatus() : EquipmentStatus.NORMAL
            ));
        }

        ScoringContext context = new ScoringContext(
                required,
                completed,
                ZonedDateTime.now(clock.withZone(facilityZoneId)).toLocalTime()
        );
        List<StationRecommendation> ranking = recommendationEngine.rank(candidates, context);
        return new Recommendation(patientId, examDate, ranking.isEmpty() ? null : ranking.get(0), ranking, now);
    }
}
