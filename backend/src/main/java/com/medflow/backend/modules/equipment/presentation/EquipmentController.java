package com.medflow.backend.modules.equipment.presentation;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.medflow.backend.global.web.RequestIdFilter;
import com.medflow.backend.modules.equipment.application.EquipmentService;
import com.medflow.backend.modules.equipment.domain.EquipmentStatus;
import com.medflow.backend.modules.equipment.presentation.dto.EquipmentLogResponse;
import com.medflow.backend.modules.equipment.presentation.dto.EquipmentResponse;
import com.medflow.backend.modules.equipment.presentation.dto.EquipmentStatusReportRequest;
import com.medflow.backend.modules.equipment.presentation.dto.RegisterEquipmentRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
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
@RequestMapping("/equipment")
@Tag(name = "Equipment")
public class EquipmentController {

    private final EquipmentService equipmentService;

    public EquipmentController(EquipmentService equipmentService) {
        this.equipmentService = equipmentService;
    }

    @GetMapping
    public ResponseEntity<List<EquipmentResponse>> list(
            @RequestParam(name = "stationCode", required = false) String stationCode
    ) {
        return ResponseEntity.ok(equipmentService.listEquipment(stationCode).stream()
                .map(EquipmentResponse::from)
                .toList());
    }

    @GetMapping("/unhealthy")
    @Operation(summary = "Equipment currently BROKEN or WARNING")
    public ResponseEntity<List<EquipmentResponse>> listUnhealthy() {
        return ResponseEntity.ok(equipmentService.listUnhealthy().stream()
                .map(EquipmentResponse::from)
                .toList());
    }

    @GetMapping("/station-status")
    @Operation(summary = "Worst equipment status per station")
    public ResponseEntity<Map<String, EquipmentStatus>> stationStatus() {
        return ResponseEntity.ok(equipmentService.statusByStation());
    }

    @PostMapping
    public ResponseEntity<EquipmentResponse> register(
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId,
            @Valid @RequestBody RegisterEquipmentRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(EquipmentResponse.from(equipmentService.registerEquipment(
                request.name(), request.stationCode(), request.equipmentType(), request.description(), actorId)));
    }

    @PostMapping("/{equipmentId}/failure")
    @Operation(summary = "Mark equipment BROKEN")
    public ResponseEntity<EquipmentResponse> reportFailure(
            @PathVariable("equipmentId") UUID equipmentId,
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId,
            @Valid @RequestBody(required = false) EquipmentStatusReportRequest request
    ) {
        return ResponseEntity.ok(EquipmentResponse.from(
                equipmentService.reportFailure(equipmentId, description(request), actorId)));
    }

    @PostMapping("/{equipmentId}/warning")
    @Operation(summary = "Mark equipment WARNING")
    public ResponseEntity<EquipmentResponse> reportWarning(
            @PathVariable("equipmentId") UUID equipmentId,
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId,
            @Valid @RequestBody(required = false) EquipmentStatusReportRequest request
    ) {
        return ResponseEntity.ok(EquipmentResponse.from(
                equipmentService.reportWarning(equipmentId, description(request), actorId)));
    }

    @PostMapping("/{equipmentId}/repair")
    @Operation(summary = "Mark equipment NORMAL again")
    public ResponseEntity<EquipmentResponse> reportRepair(
            @PathVariable("equipmentId") UUID equipmentId,
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId,
            @Valid @RequestBody(required = false) EquipmentStatusReportRequest request
    ) {
        return ResponseEntity.ok(EquipmentResponse.from(
                equipmentService.reportRepair(equipmentId, description(request), actorId)));
    }

    @GetMapping("/{equipmentId}/logs")
    public ResponseEntity<List<EquipmentLogResponse>> logs(@PathVariable("equipmentId") UUID equipmentId) {
        return ResponseEntity.ok(equipmentService.listLogs(equipmentId).stream()
                .map(EquipmentLogResponse::from)
                .toList());
    }

    private static String description(EquipmentStatusReportRequest request) {
        return request != null ? request.description() : null;
    }
}
