package com.medflow.backend.modules.occupancy.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Daily load analysis. {@code estimatedCompletion} is null once no station has remaining work.
 */
public record ScheduleAnalysis(
        LocalDate examDate,
        OffsetDateTime computedAt,
        int totalPatients,
        List<StationDemand> stations,
        List<Bottleneck> bottlenecks,
        OffsetDateTime estimatedCompletion
) {

    public Optional<StationDemand> station(String code) {
        return stations.stream().filter(demand -> demand.stationCode().equals(code)).findFirst();
    }
}
