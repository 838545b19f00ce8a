package com.medflow.backend.modules.escort.presentation;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.medflow.backend.global.web.RequestIdFilter;
import com.medflow.backend.modules.escort.application.EscortAssignmentService;
import com.medflow.backend.modules.escort.presentation.dto.AssignEscortRequest;
import com.medflow.backend.modules.escort.presentation.dto.EscortAssignmentResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/escorts")
@Tag(name = "Escorts")
public class EscortController {

    private final EscortAssignmentService escortAssignmentService;

    public EscortController(EscortAssignmentService escortAssignmentService) {
        this.escortAssignmentService = escortAssignmentService;
    }

    @GetMapping
    public ResponseEntity<List<EscortAssignmentResponse>> listActive(
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(escortAssignmentService.listActive(date).stream()
                .map(EscortAssignmentResponse::from)
                .toList());
    }

    @PutMapping("/patients/{patientId}")
    @Operation(summary = "Assign or hand over the escort of a patient")
    public ResponseEntity<EscortAssignmentResponse> assign(
            @PathVariable("patientId") UUID patientId,
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId,
            @Valid @RequestBody AssignEscortRequest request
    ) {
        return ResponseEntity.ok(EscortAssignmentResponse.from(
                escortAssignmentService.assignEscort(patientId, request.examDate(), request.staffId(), actorId)));
    }

    @DeleteMapping("/patients/{patientId}")
    public ResponseEntity<EscortAssignmentResponse> release(
            @PathVariable("patientId") UUID patientId,
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(EscortAssignmentResponse.from(escortAssignmentService.releaseEscort(patientId, date, actorId)));
    }

    @GetMapping("/patients/{patientId}")
    public ResponseEntity<EscortAssignmentResponse> activeEscort(
            @PathVariable("patientId") UUID patientId,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return escortAssignmentService.getActiveEscort(patientId, date)
                .map(EscortAssignmentResponse::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/patients/{patientId}/history")
    public ResponseEntity<List<EscortAssignmentResponse>> history(
            @PathVariable("patientId") UUID patientId,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(escortAssignmentService.getAssignmentHistory(patientId, date).stream()
                .map(EscortAssignmentResponse::from)
                .toList());
    }

    @GetMapping("/staff/{staffId}")
    @Operation(summary = "Patient currently escorted by a staff member")
    public ResponseEntity<EscortAssignmentResponse> activeOfStaff(
            @PathVariable("staffId") String staffId,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return escortAssignmentService.getActiveAssignmentOfStaff(staffId, date)
                .map(EscortAssignmentResponse::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
