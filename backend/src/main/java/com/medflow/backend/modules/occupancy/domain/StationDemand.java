package com.medflow.backend.modules.occupancy.domain;

/**
 * Remaining exam load of one station for a checkup date.
 *
 * @param required active patients whose package includes the station
 * @param completed of those, patients with a completed exam at the station
 * @param estimatedMinutes remaining load spread over the station capacity
 */
public record StationDemand(
        String stationCode,
        String stationName,
        int capacity,
        int durationMinutes,
        long required,
        long completed,
        long remaining,
        long waiting,
        long estimatedMinutes
) {
}
