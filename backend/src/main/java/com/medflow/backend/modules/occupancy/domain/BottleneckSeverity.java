package com.medflow.backend.modules.occupancy.domain;

public enum BottleneckSeverity {
    MEDIUM,
    HIGH
}
