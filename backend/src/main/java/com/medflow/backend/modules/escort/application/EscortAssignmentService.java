package com.medflow.backend.modules.escort.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.medflow.backend.global.error.ConcurrencyConflictException;
import com.medflow.backend.global.error.NotFoundException;
import com.medflow.backend.modules.audit.application.AuditLogService;
import com.medflow.backend.modules.escort.domain.EscortAssignment;
import com.medflow.backend.modules.escort.infrastructure.persistence.EscortAssignmentRepository;
import com.medflow.backend.modules.patient.application.PatientLockService;
import com.medflow.backend.modules.patient.domain.Patient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Escort pairing. Reassignment swaps the active row inside one transaction under the patient lock,
 * so readers never observe zero or two active escorts for a patient. The staff lock, taken second,
 * keeps a staff member on at most one patient per date.
 */
@Service
@Transactional
public class EscortAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(EscortAssignmentService.class);

    private final EscortAssignmentRepository escortAssignmentRepository;
    private final PatientLockService patientLockService;
    private final StaffLockService staffLockService;
    private final AuditLogService auditLogService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public EscortAssignmentService(
            EscortAssignmentRepository escortAssignmentRepository,
            PatientLockService patientLockService,
            StaffLockService staffLockService,
            AuditLogService auditLogService,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.escortAssignmentRepository = escortAssignmentRepository;
        this.patientLockService = patientLockService;
        this.staffLockService = staffLockService;
        this.auditLogService = auditLogService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public EscortAssignment assignEscort(UUID patientId, LocalDate examDate, String staffId, String assignedBy) {
        if (staffId == null || staffId.isBlank()) {
            throw new IllegalArgumentException("staffId must not be blank");
        }
        String staff = staffId.trim();
        Patient patient = patientLockService.lock(patientId, examDate);
        Optional<EscortAssignment> current = escortAssignmentRepository.findByPatientIdAndExamDateAndActiveTrue(patientId, examDate);
        if (current.isPresent() && current.get().getStaffId().equals(staff)) {
            log.debug("Escort {} already assigned to patient {}", staff, patient.getChartNo());
            return current.get();
        }

        staffLockService.lock(staff, examDate);
        OffsetDateTime now = OffsetDateTime.now(clock);
        String previousStaff = current.map(EscortAssignment::getStaffId).orElse(null);
        current.ifPresent(assignment -> {
            assignment.release(assignedBy, now);
            escortAssignmentRepository.saveAndFlush(assignment);
        });
        for (EscortAssignment other : escortAssignmentRepository.findByStaffIdAndExamDateAndActiveTrue(staff, examDate)) {
            other.release(assignedBy, now);
            escortAssignmentRepository.saveAndFlush(other);
            log.info("Escort {} released from patient {} on reassignment", staff, other.getPatientId());
        }

        EscortAssignment saved;
        try {
            saved = escortAssignmentRepository.saveAndFlush(new EscortAssignment(patientId, examDate, staff, assignedBy, now));
        } catch (DataIntegrityViolationException ex) {
            throw new ConcurrencyConflictException("Escort of patient " + patientId + " changed concurrently", ex);
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("examDate", examDate.toString());
        detail.put("staffId", staff);
        if (previousStaff != null) {
            detail.put("previousStaffId", previousStaff);
        }
        auditLogService.record(new AuditLogService.AuditLogCommand(
                "ESCORT_ASSIGN",
                "PATIENT",
                patientId.toString(),
                assignedBy,
                null,
                detail
        ));
        eventPublisher.publishEvent(new EscortAssignedEvent(
                saved.getId(),
                patientId,
                patient.getChartNo(),
                patient.getFullName(),
                examDate,
                staff,
                previousStaff,
                assignedBy,
                now
        ));
        log.info("Escort {} assigned to patient {} (previous {})", staff, patient.getChartNo(), previousStaff);
        return saved;
    }

    public EscortAssignment releaseEscort(UUID patientId, LocalDate examDate, String actorId) {
        patientLockService.lock(patientId, examDate);
        EscortAssignment current = escortAssignmentRepository.findByPatientIdAndExamDateAndActiveTrue(patientId, examDate)
                .orElseThrow(() -> new NotFoundException("ESCORT_NOT_FOUND",
                        "No active escort for patient " + patientId + " on " + examDate));
        current.release(actorId, OffsetDateTime.now(clock));
        EscortAssignment saved = escortAssignmentRepository.saveAndFlush(current);
        auditLogService.record(new AuditLogService.AuditLogCommand(
                "ESCORT_RELEASE",
                "PATIENT",
                patientId.toString(),
                actorId,
                null,
                Map.of("examDate", examDate.toString(), "staffId", saved.getStaffId())
        ));
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<EscortAssignment> getActiveEscort(UUID patientId, LocalDate examDate) {
        return escortAssignmentRepository.findByPatientIdAndExamDateAndActiveTrue(patientId, examDate);
    }

    @Transactional(readOnly = true)
    public Optional<EscortAssignment> getActiveAssignmentOfStaff(String staffId, LocalDate examDate) {
        return escortAssignmentRepository.findByStaffIdAndExamDateAndActiveTrue(staffId, examDate).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public List<EscortAssignment> listActive(LocalDate examDate) {
        return escortAssignmentRepository.findByExamDateAndActiveTrueOrderByStaffIdAsc(examDate);
    }

    @Transactional(readOnly = true)
    public List<EscortAssignment> getAssignmentHistory(UUID patientId, LocalDate examDate) {
        return escortAssignmentRepository.findByPatientIdAndExamDateOrderByAssignedAtDesc(patientId, examDate);
    }
}
