package com.medflow.backend.modules.occupancy.application;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.UUID;

import com.medflow.backend.global.error.ProblemException;
import com.medflow.backend.modules.occupancy.domain.QueuePosition;
import com.medflow.backend.modules.occupancy.domain.StationOccupancy;
import com.medflow.backend.modules.occupancy.domain.WaitTimeEstimate;
import com.medflow.backend.modules.station.application.StationRegistryService;
import com.medflow.backend.modules.station.domain.Station;
import com.medflow.backend.modules.tracking.domain.TrackingAction;
import com.medflow.backend.modules.tracking.domain.TrackingHistory;
import com.medflow.backend.modules.tracking.domain.TrackingState;
import com.medflow.backend.modules.tracking.domain.TrackingStatus;
import com.medflow.backend.modules.tracking.infrastructure.persistence.TrackingHistoryRepository;
import com.medflow.backend.modules.tracking.infrastructure.persistence.TrackingStateRepository;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Wait-time estimates from observed exam durations. Estimated wait is the waiting count times the
 * average duration, plus half a duration when the station is currently examining someone.
 */
@Service
@Transactional(readOnly = true)
public class WaitTimeEstimator {

    static final int MIN_PLAUSIBLE_MINUTES = 1;
    static final int MAX_PLAUSIBLE_MINUTES = 120;

    private final TrackingHistoryRepository trackingHistoryRepository;
    private final TrackingStateRepository trackingStateRepository;
    private final StationRegistryService stationRegistryService;
    private final OccupancyService occupancyService;
    private final Clock clock;
    private final int lookbackDays;

    public WaitTimeEstimator(
            TrackingHistoryRepository trackingHistoryRepository,
            TrackingStateRepository trackingStateRepository,
            StationRegistryService stationRegistryService,
            OccupancyService occupancyService,
            Clock clock,
            @Value("${medflow.wait-time.lookback-days:7}") int lookbackDays
    ) {
        this.trackingHistoryRepository = trackingHistoryRepository;
        this.trackingStateRepository = trackingStateRepository;
        this.stationRegistryService = stationRegistryService;
        this.occupancyService = occupancyService;
        this.clock = clock;
        this.lookbackDays = lookbackDays;
    }

    /**
     * Mean START to COMPLETE duration at the station over the lookback window, ignoring implausible pairs.
     */
    public OptionalInt averageDurationMinutes(String stationCode, LocalDate examDate) {
        List<TrackingHistory> entries = trackingHistoryRepository.findStationEntries(
                stationCode,
                examDate.minusDays(lookbackDays),
                examDate,
                EnumSet.of(TrackingAction.START, TrackingAction.COMPLETE)
        );
        Map<String, OffsetDateTime> openStarts = new HashMap<>();
        List<Long> durations = new ArrayList<>();
        for (TrackingHistory entry : entries) {
            String key = entry.getPatientId() + "|" + entry.getExamDate();
            if (entry.getAction() == TrackingAction.START) {
                openStarts.put(key, entry.getOccurredAt());
                continue;
            }
            OffsetDateTime startedAt = openStarts.remove(key);
            if (startedAt == null) {
                continue;
            }
            long minutes = Duration.between(startedAt, entry.getOccurredAt()).toMinutes();
            if (minutes >= MIN_PLAUSIBLE_MINUTES && minutes <= MAX_PLAUSIBLE_MINUTES) {
                durations.add(minutes);
            }
        }
        if (durations.isEmpty()) {
            return OptionalInt.empty();
        }
        long total = durations.stream().mapToLong(Long::longValue).sum();
        return OptionalInt.of((int) (total / durations.size()));
    }

    public WaitTimeEstimate estimate(LocalDate examDate, String stationCode) {
        Station station = stationRegistryService.getStation(stationCode);
        StationOccupancy occupancy = occupancyService.stationOccupancy(examDate, station.getCode());
        return estimate(examDate, station, occupancy.waiting(), occupancy.inExam());
    }

    public List<WaitTimeEstimate> estimateAll(LocalDate examDate) {
        Map<String, Station> stations = stationRegistryService.activeStationsByCode();
        return occupancyService.snapshot(examDate).stations().stream()
                .filter(occupancy -> stations.containsKey(occupancy.stationCode()))
                .map(occupancy -> estimate(examDate, stations.get(occupancy.stationCode()), occupancy.waiting(), occupancy.inExam()))
                .toList();
    }

    /**
     * Position of the patient in the queue of the station they are waiting at.
     */
    public QueuePosition queuePosition(UUID patientId, LocalDate examDate) {
        TrackingState state = trackingStateRepository.findByPatientIdAndExamDate(patientId, examDate)
                .filter(candidate -> candidate.getStatus() == TrackingStatus.WAITING)
                .orElseThrow(() -> new ProblemException(HttpStatus.CONFLICT, "PATIENT_NOT_WAITING",
                        "Patient " + patientId + " is not waiting at a station on " + examDate));
        String code = state.getCurrentStationCode();
        List<TrackingState> queue = trackingStateRepository.findWaitingQueue(examDate, code);
        int index = 0;
        for (int i = 0; i < queue.size(); i++) {
            if (queue.get(i).getPatientId().equals(patientId)) {
                index = i;
                break;
            }
        }
        Station station = stationRegistryService.getStation(code);
        int average = averageDurationMinutes(code, examDate).orElse(station.getDurationMinutes());
        long inExam = trackingStateRepository.countByExamDateAndCurrentStationCodeAndStatus(examDate, code, TrackingStatus.IN_EXAM);
        int wait = waitMinutes(index, inExam, average);
        return new QueuePosition(patientId, code, index + 1, queue.size(), wait);
    }

    private WaitTimeEstimate estimate(LocalDate examDate, Station station, long waiting, long inExam) {
        OptionalInt observed = averageDurationMinutes(station.getCode(), examDate);
        int average = observed.orElse(station.getDurationMinutes());
        int wait = waitMinutes(waiting, inExam, average);
        return new WaitTimeEstimate(
                station.getCode(),
                station.getName(),
                waiting,
                inExam,
                average,
                observed.isPresent(),
                wait,
                OffsetDateTime.now(clock).plusMinutes(wait)
        );
    }

    static int waitMinutes(long ahead, long inExam, int averageMinutes) {
        long wait = ahead * averageMinutes;
        if (inExam > 0) {
            wait += averageMinutes / 2;
        }
        return (int) wait;
    }
}
