package com.medflow.backend.modules.tracking.infrastructure.persistence;

public record StationCount(String stationCode, Long count) {
}
