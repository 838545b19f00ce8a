package com.medflow.backend.modules.occupancy.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.medflow.backend.global.error.NotFoundException;
import com.medflow.backend.modules.equipment.application.EquipmentStatusFeed;
import com.medflow.backend.modules.equipment.domain.EquipmentStatus;
import com.medflow.backend.modules.occupancy.domain.OccupancySnapshot;
import com.medflow.backend.modules.occupancy.domain.StationOccupancy;
import com.medflow.backend.modules.station.domain.Station;
import com.medflow.backend.modules.station.infrastructure.persistence.StationRepository;
import com.medflow.backend.modules.tracking.domain.TrackingStatus;
import com.medflow.backend.modules.tracking.infrastructure.persistence.StationCount;
import com.medflow.backend.modules.tracking.infrastructure.persistence.StationStatusCount;
import com.medflow.backend.modules.tracking.infrastructure.persistence.TrackingStateRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Station occupancy read model. Counts may lag a concurrent transition by one commit.
 */
@Service
@Transactional(readOnly = true)
public class OccupancyService {

    private static final EnumSet<TrackingStatus> INCOMING_STATUSES = EnumSet.of(TrackingStatus.IN_EXAM, TrackingStatus.MOVING);

    private final StationRepository stationRepository;
    private final TrackingStateRepository trackingStateRepository;
    private final EquipmentStatusFeed equipmentStatusFeed;
    private final OccupancyThresholds thresholds;
    private final Clock clock;

    public OccupancyService(
            StationRepository stationRepository,
            TrackingStateRepository trackingStateRepository,
            EquipmentStatusFeed equipmentStatusFeed,
            OccupancyThresholds thresholds,
            Clock clock
    ) {
        this.stationRepository = stationRepository;
        this.trackingStateRepository = trackingStateRepository;
        this.equipmentStatusFeed = equipmentStatusFeed;
        this.thresholds = thresholds;
        this.clock = clock;
    }

    public OccupancySnapshot snapshot(LocalDate examDate) {
        Map<String, long[]> counts = new HashMap<>();
        for (StationStatusCount row : trackingStateRepository.countByStationAndStatus(examDate)) {
            long[] slot = counts.computeIfAbsent(row.stationCode(), key -> new long[2]);
            if (row.status() == TrackingStatus.WAITING) {
                slot[0] += row.count();
            } else if (row.status() == TrackingStatus.IN_EXAM) {
                slot[1] += row.count();
            }
        }
        Map<String, Long> incoming = new HashMap<>();
        for (StationCount row : trackingStateRepository.countIncomingByStation(examDate, INCOMING_STATUSES)) {
            incoming.put(row.stationCode(), row.count());
        }
        Map<String, EquipmentStatus> equipment = equipmentStatusFeed.statusByStation();

        List<StationOccupancy> stations = new ArrayList<>();
        for (Station station : stationRepository.findByActiveTrueOrderByCodeAsc()) {
            long[] slot = counts.getOrDefault(station.getCode(), new long[2]);
            double utilization = OccupancyThresholds.utilization(slot[1], station.getCapacity());
            stations.add(new StationOccupancy(
                    station.getCode(),
                    station.getName(),
                    station.getCapacity(),
                    slot[0],
                    slot[1],
                    incoming.getOrDefault(station.getCode(), 0L),
                    utilization,
                    thresholds.classify(utilization),
                    equipment.getOrDefault(station.getCode(), EquipmentStatus.NORMAL)
            ));
        }
        return new OccupancySnapshot(examDate, OffsetDateTime.now(clock), stations);
    }

    public StationOccupancy stationOccupancy(LocalDate examDate, String stationCode) {
        return snapshot(examDate).station(stationCode)
                .orElseThrow(() -> NotFoundException.station(stationCode));
    }
}
