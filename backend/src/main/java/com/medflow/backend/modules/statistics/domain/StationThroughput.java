package com.medflow.backend.modules.statistics.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * {@code averageDurationMinutes} is absent when no START/COMPLETE pair was observed that day.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StationThroughput(
        String stationCode,
        String stationName,
        long arrivals,
        long started,
        long completed,
        Integer averageDurationMinutes,
        int expectedDurationMinutes
) {
}
