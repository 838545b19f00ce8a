package com.medflow.backend.modules.station.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.medflow.backend.modules.station.domain.Station;

public record StationResponse(
        UUID stationId,
        String code,
        String name,
        String location,
        int durationMinutes,
        int capacity,
        boolean active,
        boolean fastingPreferred,
        List<String> predecessorCodes
) {

    public static StationResponse from(Station station) {
        return new StationResponse(
                station.getId(),
                station.getCode(),
                station.getName(),
                station.getLocation(),
                station.getDurationMinutes(),
                station.getCapacity(),
                station.isActive(),
                station.isFastingPreferred(),
                List.copyOf(station.getPredecessorCodes())
        );
    }
}
