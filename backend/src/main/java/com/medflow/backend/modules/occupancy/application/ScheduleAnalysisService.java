package com.medflow.backend.modules.occupancy.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.medflow.backend.modules.occupancy.domain.Bottleneck;
import com.medflow.backend.modules.occupancy.domain.BottleneckSeverity;
import com.medflow.backend.modules.occupancy.domain.OccupancySnapshot;
import com.medflow.backend.modules.occupancy.domain.ScheduleAnalysis;
import com.medflow.backend.modules.occupancy.domain.StationDemand;
import com.medflow.backend.modules.occupancy.domain.StationOccupancy;
import com.medflow.backend.modules.patient.domain.Patient;
import com.medflow.backend.modules.patient.infrastructure.persistence.PatientRepository;
import com.medflow.backend.modules.station.domain.Station;
import com.medflow.backend.modules.station.infrastructure.persistence.StationRepository;
import com.medflow.backend.modules.tracking.domain.TrackingAction;
import com.medflow.backend.modules.tracking.domain.TrackingHistory;
import com.medflow.backend.modules.tracking.infrastructure.persistence.TrackingHistoryRepository;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only daily load analysis.
 * <p>
 * A station's demand is the number of active patients whose package includes it, or every active
 * patient when the package is empty. Remaining load is demand minus the patients who already
 * completed the station, spread over its capacity and multiplied by its exam duration. Stations
 * whose remaining load exceeds the bottleneck threshold are reported, most loaded first.
 */
@Service
@Transactional(readOnly = true)
public class ScheduleAnalysisService {

    private final PatientRepository patientRepository;
    private final StationRepository stationRepository;
    private final TrackingHistoryRepository trackingHistoryRepository;
    private final OccupancyService occupancyService;
    private final Clock clock;
    private final ZoneId facilityZoneId;
    private final int bottleneckMinutes;
    private final int highSeverityMinutes;

    public ScheduleAnalysisService(
            PatientRepository patientRepository,
            StationRepository stationRepository,
            TrackingHistoryRepository trackingHistoryRepository,
            OccupancyService occupancyService,
            Clock clock,
            ZoneId facilityZoneId,
            @Value("${medflow.schedule.bottleneck-minutes:120}") int bottleneckMinutes,
            @Value("${medflow.schedule.high-severity-minutes:180}") int highSeverityMinutes
    ) {
        if (highSeverityMinutes < bottleneckMinutes) {
            throw new IllegalArgumentException("high-severity-minutes must not be below bottleneck-minutes");
        }
        this.patientRepository = patientRepository;
        this.stationRepository = stationRepository;
        this.trackingHistoryRepository = trackingHistoryRepository;
        this.occupancyService = occupancyService;
        this.clock = clock;
        this.facilityZoneId = facilityZoneId;
        this.bottleneckMinutes = bottleneckMinutes;
        this.highSeverityMinutes = highSeverityMinutes;
    }

    public ScheduleAnalysis analyze(LocalDate examDate) {
        OffsetDateTime now = OffsetDateTime.now(clock).atZoneSameInstant(facilityZoneId).toOffsetDateTime();
        List<Patient> patients = patientRepository.findByCheckupDateOrderByChartNoAsc(examDate).stream()
                .filter(Patient::isActive)
                .toList();
        List<Station> stations = stationRepository.findByActiveTrueOrderByCodeAsc();
        Map<UUID, Set<String>> completedByPatient = completedStations(examDate);
        OccupancySnapshot snapshot = occupancyService.snapshot(examDate);

        List<StationDemand> demands = new ArrayList<>();
        List<Bottleneck> bottlenecks = new ArrayList<>();
        long longestMinutes = 0;
        for (Station station : stations) {
            long required = 0;
            long completed = 0;
            for (Patient patient : patients) {
                if (!requires(patient, station.getCode())) {
                    continue;
                }
                required++;
                if (completedByPatient.getOrDefault(patient.getId(), Set.of()).contains(station.getCode())) {
                    completed++;
                }
            }
            long remaining = required - completed;
            int capacity = Math.max(1, station.getCapacity());
            double load = (double) remaining / capacity * station.getDurationMinutes();
            long estimatedMinutes = (long) load;
            long waiting = snapshot.station(station.getCode()).map(StationOccupancy::waiting).orElse(0L);
            demands.add(new StationDemand(
                    station.getCode(),
                    station.getName(),
                    station.getCapacity(),
                    station.getDurationMinutes(),
                    required,
                    completed,
                    remaining,
                    waiting,
                    estimatedMinutes
            ));
            if (remaining > 0) {
                longestMinutes = Math.max(longestMinutes, estimatedMinutes);
            }
            if (load > bottleneckMinutes) {
                BottleneckSeverity severity = load > highSeverityMinutes ? BottleneckSeverity.HIGH : BottleneckSeverity.MEDIUM;
                bottlenecks.add(new Bottleneck(station.getCode(), station.getName(), remaining, estimatedMinutes, severity));
            }
        }
        bottlenecks.sort(Comparator.comparingLong(Bottleneck::estimatedMinutes).reversed()
                .thenComparing(Bottleneck::stationCode));

        boolean workRemains = demands.stream().anyMatch(demand -> demand.remaining() > 0);
        OffsetDateTime estimatedCompletion = workRemains ? now.plusMinutes(longestMinutes) : null;
        return new ScheduleAnalysis(examDate, now, patients.size(), demands, bottlenecks, estimatedCompletion);
    }

    private Map<UUID, Set<String>> completedStations(LocalDate examDate) {
        Map<UUID, Set<String>> completed = new HashMap<>();
        for (TrackingHistory entry : trackingHistoryRepository.findByExamDateOrderByIdAsc(examDate)) {
            if (entry.getAction() == TrackingAction.COMPLETE && entry.getStationCode() != null) {
                completed.computeIfAbsent(entry.getPatientId(), id -> new HashSet<>()).add(entry.getStationCode());
            }
        }
        return completed;
    }

    private static boolean requires(Patient patient, String stationCode) {
        List<String> exams = patient.getRequiredExamCodes();
        return exams.isEmpty() || exams.contains(stationCode);
    }
}
