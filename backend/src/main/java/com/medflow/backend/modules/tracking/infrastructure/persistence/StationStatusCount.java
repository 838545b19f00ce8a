package com.medflow.backend.modules.tracking.infrastructure.persistence;

import com.medflow.backend.modules.tracking.domain.TrackingStatus;

public record StationStatusCount(String stationCode, TrackingStatus status, Long count) {
}
