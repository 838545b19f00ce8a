package com.medflow.backend.modules.patient.application;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.medflow.backend.global.error.NotFoundException;
import com.medflow.backend.global.error.ProblemException;
import com.medflow.backend.modules.audit.application.AuditLogService;
import com.medflow.backend.modules.patient.domain.Patient;
import com.medflow.backend.modules.patient.infrastructure.persistence.PatientRepository;
import com.medflow.backend.modules.station.application.StationRegistryService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class PatientService {

    private static final Logger log = LoggerFactory.getLogger(PatientService.class);

    private final PatientRepository patientRepository;
    private final PatientLockService patientLockService;
    private final StationRegistryService stationRegistryService;
    private final AuditLogService auditLogService;

    public PatientService(
            PatientRepository patientRepository,
            PatientLockService patientLockService,
            StationRegistryService stationRegistryService,
            AuditLogService auditLogService
    ) {
        this.patientRepository = patientRepository;
        this.patientLockService = patientLockService;
        this.stationRegistryService = stationRegistryService;
        this.auditLogService = auditLogService;
    }

    @Transactional(readOnly = true)
    public Patient getPatient(UUID patientId) {
        return patientRepository.findById(patientId)
                .orElseThrow(() -> NotFoundException.patient(patientId));
    }

    @Transactional(readOnly = true)
    public Patient getPatientOn(UUID patientId, LocalDate examDate) {
        Patient patient = getPatient(patientId);
        if (!patient.isBookedOn(examDate)) {
            throw NotFoundException.patientOnDate(patientId, examDate);
        }
        return patient;
    }

    @Transactional(readOnly = true)
    public List<Patient> listPatients(LocalDate checkupDate) {
        return patientRepository.findByCheckupDateOrderByChartNoAsc(checkupDate);
    }

    /**
     * Required station codes of the patient; empty when no package was booked.
     */
    @Transactional(readOnly = true)
    public List<String> requiredExamCodes(UUID patientId) {
        return List.copyOf(getPatient(patientId).getRequiredExamCodes());
    }

    public Patient registerPatient(PatientRegistration registration, String actorId) {
        String chartNo = registration.chartNo().trim();
        if (patientRepository.findByChartNoAndCheckupDate(chartNo, registration.checkupDate()).isPresent()) {
            throw new ProblemException(HttpStatus.CONFLICT, "PATIENT_ALREADY_REGISTERED",
                    "Chart " + chartNo + " is already registered for " + registration.checkupDate());
        }
        Patient patient = new Patient();
        patient.setChartNo(chartNo);
        patient.setFullName(registration.fullName().trim());
        patient.setCheckupDate(registration.checkupDate());
        patient.setVipLevel(registration.vipLevel() != null ? registration.vipLevel() : 0);
        patient.setNotes(registration.notes());
        patient.replaceRequiredExamCodes(validatedCodes(registration.requiredExamCodes()));
        Patient saved = patientRepository.save(patient);
        auditLogService.record(new AuditLogService.AuditLogCommand(
                "PATIENT_REGISTER",
                "PATIENT",
                saved.getId().toString(),
                actorId,
                null,
                Map.of("chartNo", chartNo, "requiredExams", List.copyOf(saved.getRequiredExamCodes()))
        ));
        log.info("Patient {} registered for {} with {} required exams",
                chartNo, saved.getCheckupDate(), saved.getRequiredExamCodes().size());
        return saved;
    }

    public Patient updateRequiredExams(UUID patientId, List<String> requiredExamCodes, String actorId) {
        Patient patient = patientLockService.lock(patientId);
        List<String> previous = List.copyOf(patient.getRequiredExamCodes());
        patient.replaceRequiredExamCodes(validatedCodes(requiredExamCodes));
        auditLogService.record(new AuditLogService.AuditLogCommand(
                "PATIENT_PACKAGE_UPDATE",
                "PATIENT",
                patientId.toString(),
                actorId,
                null,
                Map.of("previous", previous, "current", List.copyOf(patient.getRequiredExamCodes()))
        ));
        return patient;
    }

    public Patient setActive(UUID patientId, boolean active, String actorId) {
        Patient patient = patientLockService.lock(patientId);
        if (patient.isActive() != active) {
            patient.setActive(active);
            auditLogService.record(new AuditLogService.AuditLogCommand(
                    active ? "PATIENT_ACTIVATE" : "PATIENT_DEACTIVATE",
                    "PATIENT",
                    patientId.toString(),
                    actorId,
                    null,
                    null
            ));
        }
        return patient;
    }

    private List<String> validatedCodes(List<String> codes) {
        List<String> result = new ArrayList<>();
        if (codes == null) {
            return result;
        }
        for (String code : codes) {
            result.add(stationRegistryService.getStation(code).getCode());
        }
        return result;
    }

    public record PatientRegistration(
            String chartNo,
            String fullName,
            LocalDate checkupDate,
            Integer vipLevel,
            String notes,
            List<String> requiredExamCodes
    ) {
    }
}
