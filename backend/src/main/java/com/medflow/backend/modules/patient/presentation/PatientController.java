package com.medflow.backend.modules.patient.presentation;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.medflow.backend.global.web.RequestIdFilter;
import com.medflow.backend.modules.patient.application.PatientService;
import com.medflow.backend.modules.patient.application.PatientService.PatientRegistration;
import com.medflow.backend.modules.patient.presentation.dto.PatientResponse;
import com.medflow.backend.modules.patient.presentation.dto.RegisterPatientRequest;
import com.medflow.backend.modules.patient.presentation.dto.UpdateRequiredExamsRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/patients")
@Tag(name = "Patients")
public class PatientController {

    private final PatientService patientService;

    public PatientController(PatientService patientService) {
        this.patientService = patientService;
    }

    @GetMapping
    public ResponseEntity<List<PatientResponse>> list(
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(patientService.listPatients(date).stream()
                .map(PatientResponse::from)
                .toList());
    }

    @GetMapping("/{patientId}")
    public ResponseEntity<PatientResponse> get(@PathVariable("patientId") UUID patientId) {
        return ResponseEntity.ok(PatientResponse.from(patientService.getPatient(patientId)));
    }

    @PostMapping
    @Operation(summary = "Register a patient for a checkup date with their exam package")
    public ResponseEntity<PatientResponse> register(
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId,
            @Valid @RequestBody RegisterPatientRequest request
    ) {
        PatientRegistration registration = new PatientRegistration(
                request.chartNo(),
                request.fullName(),
                request.checkupDate(),
                request.vipLevel(),
                request.notes(),
                request.requiredExamCodes()
        );
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(PatientResponse.from(patientService.registerPatient(registration, actorId)));
    }

    @PutMapping("/{patientId}/required-exams")
    public ResponseEntity<PatientResponse> updateRequiredExams(
            @PathVariable("patientId") UUID patientId,
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId,
            @Valid @RequestBody UpdateRequiredExamsRequest request
    ) {
        return ResponseEntity.ok(PatientResponse.from(
                patientService.updateRequiredExams(patientId, request.requiredExamCodes(), actorId)));
    }

    @PostMapping("/{patientId}/deactivate")
    @Operation(summary = "Withdraw a patient; tracking operations are rejected afterwards")
    public ResponseEntity<PatientResponse> deactivate(
            @PathVariable("patientId") UUID patientId,
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId
    ) {
        return ResponseEntity.ok(PatientResponse.from(patientService.setActive(patientId, false, actorId)));
    }

    @PostMapping("/{patientId}/activate")
    public ResponseEntity<PatientResponse> activate(
            @PathVariable("patientId") UUID patientId,
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId
    ) {
        return ResponseEntity.ok(PatientResponse.from(patientService.setActive(patientId, true, actorId)));
    }
}
