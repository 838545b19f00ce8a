package com.medflow.backend.modules.occupancy.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

import com.medflow.backend.modules.occupancy.domain.OccupancySnapshot;
import com.medflow.backend.modules.occupancy.domain.StationOccupancy;

public record OccupancySnapshotResponse(
        LocalDate examDate,
        OffsetDateTime computedAt,
        long totalWaiting,
        long totalInExam,
        List<StationOccupancy> stations
) {

    public static OccupancySnapshotResponse from(OccupancySnapshot snapshot) {
        return new OccupancySnapshotResponse(
                snapshot.examDate(),
                snapshot.computedAt(),
                snapshot.totalWaiting(),
                snapshot.totalInExam(),
                snapshot.stations()
        );
    }
}
