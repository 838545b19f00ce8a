package com.medflow.backend.modules.escort.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.medflow.backend.global.error.ConcurrencyConflictException;
import com.medflow.backend.modules.escort.domain.EscortStaffSlot;
import com.medflow.backend.modules.escort.infrastructure.persistence.EscortStaffSlotRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Serializes escort changes that involve one staff member on one date, across patients.
 * The slot row is created on first use in its own short transaction so the caller's
 * transaction never sees a duplicate-key failure.
 */
@Component
public class StaffLockService {

    private static final Logger log = LoggerFactory.getLogger(StaffLockService.class);

    private static final int CREATE_ATTEMPTS = 3;

    private final EscortStaffSlotRepository escortStaffSlotRepository;
    private final TransactionTemplate slotCreation;
    private final Clock clock;

    public StaffLockService(
            EscortStaffSlotRepository escortStaffSlotRepository,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.escortStaffSlotRepository = escortStaffSlotRepository;
        this.slotCreation = new TransactionTemplate(transactionManager);
        this.slotCreation.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public EscortStaffSlot lock(String staffId, LocalDate examDate) {
        for (int attempt = 1; attempt <= CREATE_ATTEMPTS; attempt++) {
            Optional<EscortStaffSlot> slot = lockExisting(staffId, examDate);
            if (slot.isPresent()) {
                return slot.get();
            }
            createSlot(staffId, examDate);
        }
        return lockExisting(staffId, examDate)
                .orElseThrow(() -> new ConcurrencyConflictException(
                        "Staff " + staffId + " is being assigned by another request", null));
    }

    private Optional<EscortStaffSlot> lockExisting(String staffId, LocalDate examDate) {
        try {
            return escortStaffSlotRepository.findForUpdate(staffId, examDate);
        } catch (ConcurrencyFailureException ex) {
            log.warn("Lock on staff {} for {} not acquired: {}", staffId, examDate, ex.getMessage());
            throw new ConcurrencyConflictException("Staff " + staffId + " is being assigned by another request", ex);
        }
    }

    private void createSlot(String staffId, LocalDate examDate) {
        try {
            slotCreation.executeWithoutResult(status -> escortStaffSlotRepository.saveAndFlush(
                    new EscortStaffSlot(staffId, examDate, OffsetDateTime.now(clock))));
        } catch (DataIntegrityViolationException | ConcurrencyFailureException ex) {
            // another request created the slot first; the next lock attempt picks it up
            log.debug("Staff slot {} {} created concurrently: {}", staffId, examDate, ex.getMessage());
        }
    }
}
