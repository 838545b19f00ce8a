package com.medflow.backend.modules.occupancy.domain;

import com.medflow.backend.modules.equipment.domain.EquipmentStatus;

public record StationOccupancy(
        String stationCode,
        String stationName,
        int capacity,
        long waiting,
        long inExam,
        long incoming,
        double utilization,
        OccupancyLevel level,
        EquipmentStatus equipmentStatus
) {

    public boolean isFull() {
        return inExam >= capacity;
    }
}
