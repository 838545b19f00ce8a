package com.medflow.backend.modules.statistics.application;

import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.medflow.backend.modules.equipment.application.EquipmentService;
import com.medflow.backend.modules.equipment.domain.Equipment;
import com.medflow.backend.modules.equipment.domain.EquipmentStatus;
import com.medflow.backend.modules.patient.infrastructure.persistence.PatientRepository;
import com.medflow.backend.modules.station.application.StationRegistryService;
import com.medflow.backend.modules.station.domain.Station;
import com.medflow.backend.modules.statistics.domain.ActorActivity;
import com.medflow.backend.modules.statistics.domain.DailySummary;
import com.medflow.backend.modules.statistics.domain.HourlyActivity;
import com.medflow.backend.modules.statistics.domain.StationThroughput;
import com.medflow.backend.modules.tracking.domain.TrackingAction;
import com.medflow.backend.modules.tracking.domain.TrackingHistory;
import com.medflow.backend.modules.tracking.domain.TrackingStatus;
import com.medflow.backend.modules.tracking.infrastructure.persistence.TrackingHistoryRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reporting over the history log and the catalogs. Never reads live tracking rows.
 */
@Service
@Transactional(readOnly = true)
public class StatisticsService {

    public static final int FIRST_HOUR = 7;
    public static final int LAST_HOUR = 17;

    private final TrackingHistoryRepository trackingHistoryRepository;
    private final PatientRepository patientRepository;
    private final StationRegistryService stationRegistryService;
    private final EquipmentService equipmentService;
    private final ZoneId facilityZoneId;

    public StatisticsService(
            TrackingHistoryRepository trackingHistoryRepository,
            PatientRepository patientRepository,
            StationRegistryService stationRegistryService,
            EquipmentService equipmentService,
            ZoneId facilityZoneId
    ) {
        this.trackingHistoryRepository = trackingHistoryRepository;
        this.patientRepository = patientRepository;
        this.stationRegistryService = stationRegistryService;
        this.equipmentService = equipmentService;
        this.facilityZoneId = facilityZoneId;
    }

    public DailySummary dailySummary(LocalDate date) {
        List<TrackingHistory> entries = trackingHistoryRepository.findByExamDateOrderByIdAsc(date);
        Map<UUID, TrackingStatus> latest = new HashMap<>();
        for (TrackingHistory entry : entries) {
            latest.put(entry.getPatientId(), entry.getStatus());
        }
        long completed = latest.values().stream().filter(status -> status == TrackingStatus.COMPLETED).count();
        long inProgress = latest.size() - completed;
        long totalPatients = Math.max(patientRepository.countByCheckupDateAndActiveTrue(date), latest.size());
        double completionRate = totalPatients == 0 ? 0.0 : Math.round(completed * 1000.0 / totalPatients) / 10.0;

        List<Equipment> equipment = equipmentService.listEquipment(null);
        long broken = equipment.stream().filter(item -> item.getStatus() == EquipmentStatus.BROKEN).count();

        return new DailySummary(
                date,
                totalPatients,
                completed,
                inProgress,
                totalPatients - completed - inProgress,
                completionRate,
                equipment.size(),
                broken,
                entries.size()
        );
    }

    public List<DailySummary> dailySummaries(LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("to must not be before from");
        }
        List<DailySummary> summaries = new ArrayList<>();
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            summaries.add(dailySummary(day));
        }
        return summaries;
    }

    /**
     * Started and completed exams per facility-time hour, 07:00 to 17:00.
     */
    public List<HourlyActivity> hourlyActivity(LocalDate date) {
        Map<Integer, long[]> buckets = new LinkedHashMap<>();
        for (int hour = FIRST_HOUR; hour <= LAST_HOUR; hour++) {
            buckets.put(hour, new long[2]);
        }
        for (TrackingHistory entry : trackingHistoryRepository.findByExamDateOrderByIdAsc(date)) {
            int hour = entry.getOccurredAt().atZoneSameInstant(facilityZoneId).getHour();
            long[] bucket = buckets.get(hour);
            if (bucket == null) {
                continue;
            }
            if (entry.getAction() == TrackingAction.START) {
                bucket[0]++;
            } else if (entry.getAction() == TrackingAction.COMPLETE) {
                bucket[1]++;
            }
        }
        List<HourlyActivity> result = new ArrayList<>();
        buckets.forEach((hour, bucket) -> result.add(
                new HourlyActivity(hour, String.format("%02d:00", hour), bucket[0], bucket[1])));
        return result;
    }

    public List<StationThroughput> stationThroughput(LocalDate date) {
        List<TrackingHistory> entries = trackingHistoryRepository.findByExamDateOrderByIdAsc(date);
        List<StationThroughput> result = new ArrayList<>();
        for (Station station : stationRegistryService.listStations(false)) {
            String code = station.getCode();
            EnumMap<TrackingAction, Long> counts = new EnumMap<>(TrackingAction.class);
            Map<UUID, OffsetDateTime> openStarts = new HashMap<>();
            long totalMinutes = 0;
            int pairs = 0;
            for (TrackingHistory entry : entries) {
                if (!code.equals(entry.getStationCode())) {
                    continue;
                }
                counts.merge(entry.getAction(), 1L, Long::sum);
                if (entry.getAction() == TrackingAction.START) {
                    openStarts.put(entry.getPatientId(), entry.getOccurredAt());
                } else if (entry.getAction() == TrackingAction.COMPLETE) {
                    OffsetDateTime startedAt = openStarts.remove(entry.getPatientId());
                    if (startedAt != null) {
                        totalMinutes += Duration.between(startedAt, entry.getOccurredAt()).toMinutes();
                        pairs++;
                    }
                }
            }
            result.add(new StationThroughput(
                    code,
                    station.getName(),
                    counts.getOrDefault(TrackingAction.ARRIVE, 0L),
                    counts.getOrDefault(TrackingAction.START, 0L),
                    counts.getOrDefault(TrackingAction.COMPLETE, 0L),
                    pairs == 0 ? null : (int) (totalMinutes / pairs),
                    station.getDurationMinutes()
            ));
        }
        return result;
    }

    /**
     * Operations per actor, busiest first.
     */
    public List<ActorActivity> actorActivity(LocalDate date) {
        Map<String, EnumMap<TrackingAction, Long>> byActor = new HashMap<>();
        for (TrackingHistory entry : trackingHistoryRepository.findByExamDateOrderByIdAsc(date)) {
            if (entry.getActorId() == null) {
                continue;
            }
            byActor.computeIfAbsent(entry.getActorId(), key -> new EnumMap<>(TrackingAction.class))
                    .merge(entry.getAction(), 1L, Long::sum);
        }
        return byActor.entrySet().stream()
                .map(actor -> {
                    EnumMap<TrackingAction, Long> counts = actor.getValue();
                    long total = counts.values().stream().mapToLong(Long::longValue).sum();
                    return new ActorActivity(
                            actor.getKey(),
                            total,
                            counts.getOrDefault(TrackingAction.ARRIVE, 0L),
                            counts.getOrDefault(TrackingAction.START, 0L),
                            counts.getOrDefault(TrackingAction.COMPLETE, 0L),
                            counts.getOrDefault(TrackingAction.ASSIGN, 0L)
                    );
                })
                .sorted(Comparator.comparingLong(ActorActivity::operations).reversed()
                        .thenComparing(ActorActivity::actorId))
                .toList();
    }

    /**
     * History entries in a date range, newest first, optionally narrowed to a patient or a station.
     */
    public List<TrackingHistory> historyRecords(LocalDate from, LocalDate to, UUID patientId, String stationCode, int limit) {
        List<TrackingHistory> entries = new ArrayList<>(trackingHistoryRepository.findBetween(from, to));
        entries.sort(Comparator.comparing(TrackingHistory::getId).reversed());
        return entries.stream()
                .filter(entry -> patientId == null || patientId.equals(entry.getPatientId()))
                .filter(entry -> stationCode == null || stationCode.equalsIgnoreCase(String.valueOf(entry.getStationCode())))
                .limit(Math.max(1, limit))
                .toList();
    }
}
