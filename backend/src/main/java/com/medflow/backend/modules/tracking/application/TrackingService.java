package com.medflow.backend.modules.tracking.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.medflow.backend.global.error.ConcurrencyConflictException;
import com.medflow.backend.global.error.NotFoundException;
import com.medflow.backend.global.error.ProblemException;
import com.medflow.backend.modules.audit.application.AuditLogService;
import com.medflow.backend.modules.conflict.application.ConflictDetector;
import com.medflow.backend.modules.conflict.domain.ConflictBlockedException;
import com.medflow.backend.modules.conflict.domain.ConflictCheck;
import com.medflow.backend.modules.conflict.domain.ConflictReport;
import com.medflow.backend.modules.conflict.domain.ConflictScope;
import com.medflow.backend.modules.conflict.domain.ConflictType;
import com.medflow.backend.modules.conflict.domain.EquipmentBrokenDetectedEvent;
import com.medflow.backend.modules.equipment.application.EquipmentStatusFeed;
import com.medflow.backend.modules.equipment.domain.EquipmentStatus;
import com.medflow.backend.modules.patient.application.PatientLockService;
import com.medflow.backend.modules.patient.domain.Patient;
import com.medflow.backend.modules.station.application.StationRegistryService;
import com.medflow.backend.modules.station.domain.Station;
import com.medflow.backend.modules.station.infrastructure.persistence.StationRepository;
import com.medflow.backend.modules.tracking.domain.CapacityExceededException;
import com.medflow.backend.modules.tracking.domain.InvalidTransitionException;
import com.medflow.backend.modules.tracking.domain.TrackingAction;
import com.medflow.backend.modules.tracking.domain.TrackingHistory;
import com.medflow.backend.modules.tracking.domain.TrackingState;
import com.medflow.backend.modules.tracking.domain.TrackingStatus;
import com.medflow.backend.modules.tracking.domain.TrackingTransitions;
import com.medflow.backend.modules.tracking.infrastructure.persistence.TrackingHistoryRepository;
import com.medflow.backend.modules.tracking.infrastructure.persistence.TrackingStateRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Patient state machine. Each mutation locks the patient row first, so transitions of one patient are
 * serialized while different patients proceed in parallel. A rejected mutation rolls back with its
 * history entry.
 */
@Service
@Transactional
public class TrackingService {

    private static final Logger log = LoggerFactory.getLogger(TrackingService.class);

    public static final String OVERRIDE_AUDIT_ACTION = "TRACKING_ASSIGN_OVERRIDE";

    private final TrackingStateRepository trackingStateRepository;
    private final TrackingHistoryRepository trackingHistoryRepository;
    private final StationRepository stationRepository;
    private final PatientLockService patientLockService;
    private final ConflictDetector conflictDetector;
    private final EquipmentStatusFeed equipmentStatusFeed;
    private final AuditLogService auditLogService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public TrackingService(
            TrackingStateRepository trackingStateRepository,
            TrackingHistoryRepository trackingHistoryRepository,
            StationRepository stationRepository,
            PatientLockService patientLockService,
            ConflictDetector conflictDetector,
            EquipmentStatusFeed equipmentStatusFeed,
            AuditLogService auditLogService,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.trackingStateRepository = trackingStateRepository;
        this.trackingHistoryRepository = trackingHistoryRepository;
        this.stationRepository = stationRepository;
        this.patientLockService = patientLockService;
        this.conflictDetector = conflictDetector;
        this.equipmentStatusFeed = equipmentStatusFeed;
        this.auditLogService = auditLogService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public TrackingState reportArrival(UUID patientId, LocalDate examDate, String stationCode, String actorId) {
        Patient patient = lockActivePatient(patientId, examDate);
        Station station = requireActiveStation(stationCode);
        TrackingState state = trackingStateRepository.findByPatientIdAndExamDate(patientId, examDate).orElse(null);
        TrackingStatus current = state != null ? state.getStatus() : null;

        if (current == TrackingStatus.IN_EXAM) {
            String at = state.getCurrentStationCode();
            String detail = station.getCode().equals(at)
                    ? "Patient is already in exam at " + at
                    : "Patient is in exam at " + at + "; complete it before arriving at " + station.getCode();
            throw rejected(patient, TrackingAction.ARRIVE, new InvalidTransitionException(detail));
        }
        TrackingStatus next = transition(patient, current, TrackingAction.ARRIVE, true);

        if (state == null) {
            state = new TrackingState(patientId, examDate);
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        state.apply(next, station.getCode(), null, actorId, now);
        state = persist(state);
        appendHistory(state, station.getCode(), TrackingAction.ARRIVE, actorId, null, now);
        log.info("Patient {} arrived at {} ({} -> {})", patient.getChartNo(), station.getCode(), current, next);
        return state;
    }

    public TrackingState reportStart(UUID patientId, LocalDate examDate, String actorId) {
        Patient patient = lockActivePatient(patientId, examDate);
        TrackingState state = requireState(patientId, examDate);
        TrackingStatus next = transition(patient, state.getStatus(), TrackingAction.START, true);

        String code = state.getCurrentStationCode();
        Station station = lockStation(code);
        if (!station.isActive()) {
            throw rejected(patient, TrackingAction.START,
                    new InvalidTransitionException("Station " + code + " is not active"));
        }

        long inExam = countInExam(examDate, code);
        ConflictReport gate = conflictDetector.detect(
                new ConflictCheck(code, station.getCapacity(), inExam, equipmentStatusFeed.statusOf(code), null, null, null),
                ConflictScope.EXAM_START
        );
        if (gate.hasBlocking(ConflictType.CAPACITY)) {
            throw rejected(patient, TrackingAction.START, new CapacityExceededException(code, inExam, station.getCapacity()));
        }
        if (gate.hasBlocking()) {
            throw rejected(patient, TrackingAction.START, new ConflictBlockedException(gate));
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        state.apply(next, code, state.getNextStationCode(), actorId, now);
        state = persist(state);

        long recount = countInExam(examDate, code);
        if (recount > station.getCapacity()) {
            throw rejected(patient, TrackingAction.START, new CapacityExceededException(code, recount - 1, station.getCapacity()));
        }
        appendHistory(state, code, TrackingAction.START, actorId, null, now);
        log.info("Patient {} started exam at {} ({}/{})", patient.getChartNo(), code, recount, station.getCapacity());
        return state;
    }

    public TrackingState reportComplete(UUID patientId, LocalDate examDate, String actorId, String notes) {
        Patient patient = lockActivePatient(patientId, examDate);
        TrackingState state = requireState(patientId, examDate);
        String code = state.getCurrentStationCode();

        Set<String> done = new LinkedHashSet<>(completedStations(patientId, examDate));
        if (code != null) {
            done.add(code);
        }
        boolean remaining = requiredStations(patient).stream().anyMatch(required -> !done.contains(required));
        TrackingStatus next = transition(patient, state.getStatus(), TrackingAction.COMPLETE, remaining);

        OffsetDateTime now = OffsetDateTime.now(clock);
        String nextStation = next == TrackingStatus.COMPLETED ? null : state.getNextStationCode();
        state.apply(next, code, nextStation, actorId, now);
        state = persist(state);
        appendHistory(state, code, TrackingAction.COMPLETE, actorId, notes, now);
        log.info("Patient {} completed {} -> {}", patient.getChartNo(), code, next);
        return state;
    }

    public AssignmentResult assignNextStation(UUID patientId, LocalDate examDate, String stationCode, String actorId) {
        return assign(patientId, examDate, stationCode, actorId, null);
    }

    /**
     * Administrative assignment that commits despite blocking findings. The bypassed findings are audited.
     */
    public AssignmentResult overrideNextStation(
            UUID patientId,
            LocalDate examDate,
            String stationCode,
            String actorId,
            String reason
    ) {
        if (reason == null || reason.isBlank()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "OVERRIDE_REASON_REQUIRED",
                    "An override needs a reason");
        }
        return assign(patientId, examDate, stationCode, actorId, reason.trim());
    }

    private AssignmentResult assign(UUID patientId, LocalDate examDate, String stationCode, String actorId, String overrideReason) {
        Patient patient = lockActivePatient(patientId, examDate);
        Station station = requireActiveStation(stationCode);
        String code = station.getCode();
        TrackingState state = trackingStateRepository.findByPatientIdAndExamDate(patientId, examDate).orElse(null);
        TrackingStatus current = state != null ? state.getStatus() : null;
        TrackingStatus next = transition(patient, current, TrackingAction.ASSIGN, true);

        EquipmentStatus equipment = equipmentStatusFeed.statusOf(code);
        ConflictCheck check = new ConflictCheck(
                code,
                station.getCapacity(),
                countInExam(examDate, code),
                equipment,
                station.getPredecessorCodes(),
                completedStations(patientId, examDate),
                patient.getRequiredExamCodes(),
                state != null ? state.getCurrentStationCode() : null
        );
        ConflictReport report = conflictDetector.detect(check, ConflictScope.ASSIGNMENT);
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (report.hasBlocking(ConflictType.EQUIPMENT)) {
            eventPublisher.publishEvent(new EquipmentBrokenDetectedEvent(code, patientId, examDate, actorId, now));
        }
        if (report.hasBlocking() && overrideReason == null) {
            throw rejected(patient, TrackingAction.ASSIGN, new ConflictBlockedException(report));
        }

        if (state == null) {
            state = new TrackingState(patientId, examDate);
        }
        String currentStation = state.getCurrentStationCode();
        state.apply(next, currentStation, code, actorId, now);
        state = persist(state);
        appendHistory(state, code, TrackingAction.ASSIGN, actorId, overrideReason, now);

        if (overrideReason != null) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("examDate", examDate.toString());
            detail.put("stationCode", code);
            detail.put("reason", overrideReason);
            detail.put("findings", report.findings().stream()
                    .map(finding -> finding.severity() + " " + finding.type() + ": " + finding.message())
                    .toList());
            auditLogService.record(new AuditLogService.AuditLogCommand(
                    OVERRIDE_AUDIT_ACTION,
                    "PATIENT",
                    patientId.toString(),
                    actorId,
                    null,
                    detail
            ));
            log.warn("Patient {} assigned to {} by override of {}: {}", patient.getChartNo(), code, actorId, overrideReason);
        } else {
            log.info("Patient {} assigned next station {} ({} findings)", patient.getChartNo(), code, report.findings().size());
        }

        eventPublisher.publishEvent(new NextStationAssignedEvent(
                patientId,
                patient.getChartNo(),
                patient.getFullName(),
                examDate,
                currentStation,
                code,
                actorId,
                overrideReason != null,
                now
        ));
        return new AssignmentResult(state, report);
    }

    @Transactional(readOnly = true)
    public TrackingState getTracking(UUID patientId, LocalDate examDate) {
        return requireState(patientId, examDate);
    }

    @Transactional(readOnly = true)
    public List<TrackingState> listTracking(LocalDate examDate, TrackingStatus status) {
        if (status == null) {
            return trackingStateRepository.findByExamDateOrderByUpdatedAtDesc(examDate);
        }
        return trackingStateRepository.findByExamDateAndStatusOrderByUpdatedAtAsc(examDate, status);
    }

    /**
     * Newest entry first.
     */
    @Transactional(readOnly = true)
    public List<TrackingHistory> getHistory(UUID patientId, LocalDate examDate) {
        return trackingHistoryRepository.findByPatientIdAndExamDateOrderByIdDesc(patientId, examDate);
    }

    @Transactional(readOnly = true)
    public Set<String> completedStations(UUID patientId, LocalDate examDate) {
        return new LinkedHashSet<>(trackingHistoryRepository.findStationCodes(patientId, examDate, TrackingAction.COMPLETE));
    }

    /**
     * The patient's package, or every active station when none was booked.
     */
    @Transactional(readOnly = true)
    public List<String> requiredStations(Patient patient) {
        if (!patient.getRequiredExamCodes().isEmpty()) {
            return List.copyOf(patient.getRequiredExamCodes());
        }
        return stationRepository.findByActiveTrueOrderByCodeAsc().stream()
                .map(Station::getCode)
                .toList();
    }

    private Patient lockActivePatient(UUID patientId, LocalDate examDate) {
        Patient patient = patientLockService.lock(patientId, examDate);
        if (!patient.isActive()) {
            throw new InvalidTransitionException("Patient " + patient.getChartNo() + " is not active");
        }
        return patient;
    }

    private Station requireActiveStation(String stationCode) {
        String code = StationRegistryService.normalizeCode(stationCode);
        Station station = stationRepository.findByCode(code)
                .orElseThrow(() -> NotFoundException.station(code));
        if (!station.isActive()) {
            throw new InvalidTransitionException("Station " + code + " is not active");
        }
        return station;
    }

    private Station lockStation(String code) {
        try {
            return stationRepository.findByCodeForUpdate(code)
                    .orElseThrow(() -> NotFoundException.station(code));
        } catch (ConcurrencyFailureException ex) {
            throw new ConcurrencyConflictException("Station " + code + " is busy, retry", ex);
        }
    }

    private TrackingState requireState(UUID patientId, LocalDate examDate) {
        return trackingStateRepository.findByPatientIdAndExamDate(patientId, examDate)
                .orElseThrow(() -> NotFoundException.tracking(patientId, examDate));
    }

    private TrackingStatus transition(Patient patient, TrackingStatus current, TrackingAction action, boolean remaining) {
        try {
            return TrackingTransitions.next(current, action, remaining);
        } catch (InvalidTransitionException ex) {
            throw rejected(patient, action, ex);
        }
    }

    private long countInExam(LocalDate examDate, String stationCode) {
        return trackingStateRepository.countByExamDateAndCurrentStationCodeAndStatus(examDate, stationCode, TrackingStatus.IN_EXAM);
    }

    private TrackingState persist(TrackingState state) {
        try {
            return trackingStateRepository.saveAndFlush(state);
        } catch (ConcurrencyFailureException | DataIntegrityViolationException ex) {
            throw new ConcurrencyConflictException(
                    "Tracking state of patient " + state.getPatientId() + " changed concurrently", ex);
        }
    }

    private void appendHistory(
            TrackingState state,
            String stationCode,
            TrackingAction action,
            String actorId,
            String notes,
            OffsetDateTime at
    ) {
        trackingHistoryRepository.save(new TrackingHistory(
                state.getPatientId(),
                state.getExamDate(),
                stationCode,
                state.getStatus(),
                action,
                at,
                actorId,
                notes
        ));
    }

    private RuntimeException rejected(Patient patient, TrackingAction action, ProblemException ex) {
        log.warn("{} rejected for patient {}: {}", action, patient.getChartNo(), ex.getDetailMessage());
        return ex;
    }
}
