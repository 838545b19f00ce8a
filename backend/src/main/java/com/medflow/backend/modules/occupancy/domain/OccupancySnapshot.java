package com.medflow.backend.modules.occupancy.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time aggregate of station counts for one date. Derived on demand and never stored.
 */
public record OccupancySnapshot(LocalDate examDate, OffsetDateTime computedAt, List<StationOccupancy> stations) {

    public OccupancySnapshot {
        stations = List.copyOf(stations);
    }

    public Optional<StationOccupancy> station(String stationCode) {
        return stations.stream()
                .filter(station -> station.stationCode().equals(stationCode))
                .findFirst();
    }

    public long totalWaiting() {
        return stations.stream().mapToLong(StationOccupancy::waiting).sum();
    }

    public long totalInExam() {
        return stations.stream().mapToLong(StationOccupancy::inExam).sum();
    }
}
