package com.medflow.backend.modules.patient.application;

import java.time.LocalDate;
import java.util.UUID;

import com.medflow.backend.global.error.ConcurrencyConflictException;
import com.medflow.backend.global.error.NotFoundException;
import com.medflow.backend.modules.patient.domain.Patient;
import com.medflow.backend.modules.patient.infrastructure.persistence.PatientRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Serializes every mutation of a patient's tracking and escort state on the patient row.
 * Callers must already be inside a transaction; the lock is held until it ends.
 */
@Component
public class PatientLockService {

    private static final Logger log = LoggerFactory.getLogger(PatientLockService.class);

    private final PatientRepository patientRepository;

    public PatientLockService(PatientRepository patientRepository) {
        this.patientRepository = patientRepository;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Patient lock(UUID patientId) {
        try {
            return patientRepository.findByIdForUpdate(patientId)
                    .orElseThrow(() -> NotFoundException.patient(patientId));
        } catch (PessimisticLockingFailureException ex) {
            log.warn("Lock on patient {} not acquired: {}", patientId, ex.getMessage());
            throw new ConcurrencyConflictException("Patient " + patientId + " is being updated by another request", ex);
        }
    }

    /**
     * Locks the patient and rejects an exam date other than the booked checkup date.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Patient lock(UUID patientId, LocalDate examDate) {
        Patient patient = lock(patientId);
        if (!patient.isBookedOn(examDate)) {
            throw NotFoundException.patientOnDate(patientId, examDate);
        }
        return patient;
    }
}
