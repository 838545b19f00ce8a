package com.medflow.backend.modules.tracking.domain;

public enum TrackingStatus {
    WAITING,
    IN_EXAM,
    MOVING,
    COMPLETED
}
