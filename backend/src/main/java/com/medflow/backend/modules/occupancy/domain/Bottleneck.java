package com.medflow.backend.modules.occupancy.domain;

public record Bottleneck(
        String stationCode,
        String stationName,
        long remaining,
        long estimatedMinutes,
        BottleneckSeverity severity
) {
}
