package com.medflow.backend.modules.tracking.presentation;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.medflow.backend.global.web.RequestIdFilter;
import com.medflow.backend.modules.tracking.application.TrackingService;
import com.medflow.backend.modules.tracking.domain.TrackingStatus;
import com.medflow.backend.modules.tracking.presentation.dto.ArrivalRequest;
import com.medflow.backend.modules.tracking.presentation.dto.AssignNextStationRequest;
import com.medflow.backend.modules.tracking.presentation.dto.AssignmentResponse;
import com.medflow.backend.modules.tracking.presentation.dto.CompleteExamRequest;
import com.medflow.backend.modules.tracking.presentation.dto.HistoryEntryResponse;
import com.medflow.backend.modules.tracking.presentation.dto.StartExamRequest;
import com.medflow.backend.modules.tracking.presentation.dto.TrackingStateResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tracking")
@Tag(name = "Tracking")
public class TrackingController {

    private final TrackingService trackingService;

    public TrackingController(TrackingService trackingService) {
        this.trackingService = trackingService;
    }

    @GetMapping
    @Operation(summary = "Tracking states of a date, optionally filtered by status")
    public ResponseEntity<List<TrackingStateResponse>> list(
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(name = "status", required = false) TrackingStatus status
    ) {
        return ResponseEntity.ok(trackingService.listTracking(date, status).stream()
                .map(TrackingStateResponse::from)
                .toList());
    }

    @GetMapping("/{patientId}")
    public ResponseEntity<TrackingStateResponse> get(
            @PathVariable("patientId") UUID patientId,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(TrackingStateResponse.from(trackingService.getTracking(patientId, date)));
    }

    @GetMapping("/{patientId}/history")
    public ResponseEntity<List<HistoryEntryResponse>> history(
            @PathVariable("patientId") UUID patientId,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(trackingService.getHistory(patientId, date).stream()
                .map(HistoryEntryResponse::from)
                .toList());
    }

    @PostMapping("/{patientId}/arrive")
    @Operation(summary = "Report arrival at a station")
    public ResponseEntity<TrackingStateResponse> arrive(
            @PathVariable("patientId") UUID patientId,
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId,
            @Valid @RequestBody ArrivalRequest request
    ) {
        return ResponseEntity.ok(TrackingStateResponse.from(
                trackingService.reportArrival(patientId, request.examDate(), request.stationCode(), actorId)));
    }

    @PostMapping("/{patientId}/start")
    @Operation(summary = "Report exam start at the current station")
    public ResponseEntity<TrackingStateResponse> start(
            @PathVariable("patientId") UUID patientId,
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId,
            @Valid @RequestBody StartExamRequest request
    ) {
        return ResponseEntity.ok(TrackingStateResponse.from(
                trackingService.reportStart(patientId, request.examDate(), actorId)));
    }

    @PostMapping("/{patientId}/complete")
    @Operation(summary = "Report exam completion at the current station")
    public ResponseEntity<TrackingStateResponse> complete(
            @PathVariable("patientId") UUID patientId,
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId,
            @Valid @RequestBody CompleteExamRequest request
    ) {
        return ResponseEntity.ok(TrackingStateResponse.from(
                trackingService.reportComplete(patientId, request.examDate(), actorId, request.notes())));
    }

    @PostMapping("/{patientId}/next-station")
    @Operation(summary = "Assign the next station after conflict checks")
    public ResponseEntity<AssignmentResponse> assignNextStation(
            @PathVariable("patientId") UUID patientId,
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId,
            @Valid @RequestBody AssignNextStationRequest request
    ) {
        return ResponseEntity.ok(AssignmentResponse.from(
                trackingService.assignNextStation(patientId, request.examDate(), request.stationCode(), actorId)));
    }

    @PostMapping("/{patientId}/next-station/override")
    @Operation(summary = "Assign the next station despite blocking findings")
    public ResponseEntity<AssignmentResponse> overrideNextStation(
            @PathVariable("patientId") UUID patientId,
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId,
            @Valid @RequestBody AssignNextStationRequest request
    ) {
        return ResponseEntity.ok(AssignmentResponse.from(trackingService.overrideNextStation(
                patientId, request.examDate(), request.stationCode(), actorId, request.reason())));
    }
}
