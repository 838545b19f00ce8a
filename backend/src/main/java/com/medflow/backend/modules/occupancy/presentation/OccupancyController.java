package com.medflow.backend.modules.occupancy.presentation;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.medflow.backend.modules.occupancy.application.OccupancyService;
import com.medflow.backend.modules.occupancy.application.ScheduleAnalysisService;
import com.medflow.backend.modules.occupancy.application.WaitTimeEstimator;
import com.medflow.backend.modules.occupancy.domain.QueuePosition;
import com.medflow.backend.modules.occupancy.domain.ScheduleAnalysis;
import com.medflow.backend.modules.occupancy.domain.StationOccupancy;
import com.medflow.backend.modules.occupancy.domain.WaitTimeEstimate;
import com.medflow.backend.modules.occupancy.presentation.dto.OccupancySnapshotResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/occupancy")
@Tag(name = "Occupancy")
public class OccupancyController {

    private final OccupancyService occupancyService;
    private final WaitTimeEstimator waitTimeEstimator;
    private final ScheduleAnalysisService scheduleAnalysisService;

    public OccupancyController(
            OccupancyService occupancyService,
            WaitTimeEstimator waitTimeEstimator,
            ScheduleAnalysisService scheduleAnalysisService
    ) {
        this.occupancyService = occupancyService;
        this.waitTimeEstimator = waitTimeEstimator;
        this.scheduleAnalysisService = scheduleAnalysisService;
    }

    @GetMapping
    @Operation(summary = "Waiting, in-exam and incoming counts per active station")
    public ResponseEntity<OccupancySnapshotResponse> snapshot(
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(OccupancySnapshotResponse.from(occupancyService.snapshot(date)));
    }

    @GetMapping("/stations/{code}")
    public ResponseEntity<StationOccupancy> station(
            @PathVariable("code") String code,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(occupancyService.stationOccupancy(date, code.trim().toUpperCase()));
    }

    @GetMapping("/wait-times")
    @Operation(summary = "Estimated wait per active station")
    public ResponseEntity<List<WaitTimeEstimate>> waitTimes(
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(waitTimeEstimator.estimateAll(date));
    }

    @GetMapping("/wait-times/{code}")
    public ResponseEntity<WaitTimeEstimate> waitTime(
            @PathVariable("code") String code,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(waitTimeEstimator.estimate(date, code));
    }

    @GetMapping("/queue-position/{patientId}")
    @Operation(summary = "Queue position of a waiting patient")
    public ResponseEntity<QueuePosition> queuePosition(
            @PathVariable("patientId") UUID patientId,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(waitTimeEstimator.queuePosition(patientId, date));
    }

    @GetMapping("/schedule-analysis")
    @Operation(summary = "Remaining demand per station, bottlenecks and estimated completion time")
    public ResponseEntity<ScheduleAnalysis> scheduleAnalysis(
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(scheduleAnalysisService.analyze(date));
    }
}
