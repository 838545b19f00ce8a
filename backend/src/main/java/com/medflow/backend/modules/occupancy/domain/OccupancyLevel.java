package com.medflow.backend.modules.occupancy.domain;

public enum OccupancyLevel {
    NORMAL,
    WARNING,
    FULL
}
